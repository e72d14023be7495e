package com.nova.script.host;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import javax.imageio.ImageIO;

import com.nova.debug.Debug;

/**
 * Writes a multi-resolution {@code .ico} with PNG-compressed entries
 * (256, 128, 64, 48, 32 and 16 pixels square).
 */
public class IcoImageConverter implements ImageConverter {
    private static final String TAG = "IcoImageConverter";

    static final int[] SIZES = {256, 128, 64, 48, 32, 16};

    private static final int HEADER_BYTES = 6;
    private static final int ENTRY_BYTES = 16;

    @Override
    public boolean convert(Path source, Path target) {
        try {
            BufferedImage image = ImageIO.read(source.toFile());
            if (image == null) {
                Debug.get().w(TAG, "not a readable image: " + source);
                return false;
            }
            List<byte[]> entries = new ArrayList<>();
            for (int size : SIZES) entries.add(png(scale(image, size)));
            try (OutputStream out = Files.newOutputStream(target)) {
                write(out, entries);
            }
            return true;
        } catch (IOException e) {
            Debug.get().w(TAG, "Failed to convert " + source + " to ICO: " + e.getMessage());
            return false;
        }
    }

    private static BufferedImage scale(BufferedImage image, int size) {
        BufferedImage scaled = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.drawImage(image, 0, 0, size, size, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private static byte[] png(BufferedImage image) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", bytes)) throw new IOException("no PNG writer available");
        return bytes.toByteArray();
    }

    private static void write(OutputStream out, List<byte[]> entries) throws IOException {
        ByteBuffer dir = ByteBuffer.allocate(HEADER_BYTES + ENTRY_BYTES * entries.size()).order(ByteOrder.LITTLE_ENDIAN);
        dir.putShort((short) 0);               // reserved
        dir.putShort((short) 1);               // type: icon
        dir.putShort((short) entries.size());

        int offset = HEADER_BYTES + ENTRY_BYTES * entries.size();
        for (int i = 0; i < entries.size(); i++) {
            int size = SIZES[i];
            byte[] data = entries.get(i);
            dir.put((byte) (size >= 256 ? 0 : size)); // 0 encodes 256
            dir.put((byte) (size >= 256 ? 0 : size));
            dir.put((byte) 0);                 // palette
            dir.put((byte) 0);                 // reserved
            dir.putShort((short) 1);           // color planes
            dir.putShort((short) 32);          // bits per pixel
            dir.putInt(data.length);
            dir.putInt(offset);
            offset += data.length;
        }
        out.write(dir.array());
        for (byte[] data : entries) out.write(data);
    }
}

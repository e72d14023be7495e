import com.nova.script.host.IcoImageConverter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class IcoImageConverterTest {

    @TempDir
    Path dir;

    @Test
    void png_becomesMultiSizeIcon() throws Exception {
        BufferedImage image = new BufferedImage(40, 30, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, 0xFFFF0000);
        Path png = dir.resolve("logo.png");
        ImageIO.write(image, "png", png.toFile());
        Path ico = dir.resolve("logo.ico");

        assertTrue(new IcoImageConverter().convert(png, ico));

        ByteBuffer header = ByteBuffer.wrap(Files.readAllBytes(ico)).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(0, header.getShort());
        assertEquals(1, header.getShort());
        assertEquals(6, header.getShort());
        assertEquals(0, header.get());   // first entry is 256 px
        assertEquals(0, header.get());
        header.position(6 + 16);
        assertEquals((byte) 128, header.get());
    }

    @Test
    void unreadableImage_returnsFalse() throws Exception {
        Path notAnImage = dir.resolve("fake.png");
        Files.writeString(notAnImage, "not an image");

        assertFalse(new IcoImageConverter().convert(notAnImage, dir.resolve("fake.ico")));
        assertFalse(new IcoImageConverter().convert(dir.resolve("missing.png"), dir.resolve("missing.ico")));
    }
}

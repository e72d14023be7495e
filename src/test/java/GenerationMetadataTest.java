import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nova.script.codegen.GenerationMetadata;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GenerationMetadataTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void json_usesStableFieldNames() throws Exception {
        GenerationMetadata meta = new GenerationMetadata(true, true, "img/logo.png", "logo.ico", true, true);

        JsonNode node = om.readTree(meta.toJson());

        assertTrue(node.get("needsGuiCapability").asBoolean());
        assertTrue(node.get("needsGraphicsCapability").asBoolean());
        assertEquals("img/logo.png", node.get("iconSourcePath").asText());
        assertEquals("logo.ico", node.get("iconTargetBasename").asText());
        assertTrue(node.get("iconNeedsRasterConversion").asBoolean());
        assertTrue(node.get("needsDynamicBinding").asBoolean());
        assertEquals(6, node.size());
    }

    @Test
    void json_keepsNullIconFields() throws Exception {
        JsonNode node = om.readTree(new GenerationMetadata(false, false, null, null, false, false).toJson());
        assertTrue(node.has("iconSourcePath"));
        assertTrue(node.get("iconSourcePath").isNull());
    }

    @Test
    void fromJson_readsWhatToJsonWrites() {
        GenerationMetadata meta = GenerationMetadata.fromJson(
                "{\"needsGuiCapability\":true,\"needsGraphicsCapability\":false,"
                        + "\"iconSourcePath\":null,\"iconTargetBasename\":null,\"iconNeedsRasterConversion\":false}");
        assertTrue(meta.needsGuiCapability());
        assertFalse(meta.needsGraphicsCapability());
        assertFalse(meta.hasIcon());
        assertFalse(meta.needsDynamicBinding());
    }
}

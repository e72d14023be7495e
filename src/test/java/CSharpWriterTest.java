import com.nova.script.codegen.CSharpWriter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CSharpWriterTest {

    @Test
    void openAndClose_indentNestedLines() {
        CSharpWriter w = new CSharpWriter(0);
        w.open("if ({}) {", "ok");
        w.line("{}();", "Run");
        w.reopen("} else {");
        w.line("Stop();");
        w.close("}");

        assertEquals("if (ok) {\n    Run();\n} else {\n    Stop();\n}\n", w.toString());
        assertEquals(0, w.depth());
    }

    @Test
    void placeholderArguments_areNotRescanned() {
        CSharpWriter w = new CSharpWriter(0);
        w.line("x = {};", "{}");
        assertEquals("x = {};\n", w.toString());
    }

    @Test
    void placeholderCountMustMatch() {
        CSharpWriter w = new CSharpWriter(0);
        assertThrows(IllegalArgumentException.class, () -> w.line("{} {}", "a"));
        assertThrows(IllegalArgumentException.class, () -> w.line("{}", "a", "b"));
        assertThrows(IllegalStateException.class, () -> w.close("}"));
    }

    @Test
    void quote_escapesCSharpSpecials() {
        assertEquals("\"a\\\"b\"", CSharpWriter.quote("a\"b"));
        assertEquals("\"C:\\\\x\"", CSharpWriter.quote("C:\\x"));
        assertEquals("\"\\r\\n\\t\"", CSharpWriter.quote("\r\n\t"));
        assertEquals("\"\\u0001\"", CSharpWriter.quote("\u0001"));
    }

    @Test
    void identifiers() {
        assertEquals("@string", CSharpWriter.identifier("string"));
        assertEquals("total", CSharpWriter.identifier("total"));
        assertTrue(CSharpWriter.isValidClassName("_App1"));
        assertFalse(CSharpWriter.isValidClassName("1App"));
        assertFalse(CSharpWriter.isValidClassName("public"));
        assertFalse(CSharpWriter.isValidClassName(""));
    }
}

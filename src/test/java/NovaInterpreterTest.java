import com.nova.script.AcknowledgmentSource;
import com.nova.script.NovaScript;
import com.nova.script.parser.NovaRuntimeError;
import com.nova.script.parser.Value;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class NovaInterpreterTest {

    private final List<String> printed = new ArrayList<>();
    private int acks;
    private NovaScript nova;

    @BeforeEach
    void setUp() {
        nova = new NovaScript();
        nova.setOutput(printed::add);
        nova.setAcknowledgment(new AcknowledgmentSource() {
            @Override
            public void waitForAck() {
                acks++;
            }
        });
    }

    @Test
    void putPrintsVariable() {
        nova.run("have x = 5; put x;");
        assertEquals(Arrays.asList("5"), printed);
    }

    @Test
    void plusWithText_concatenates() {
        nova.run("have x = \"a\" + 1; put x; put 1 + \"b\"; put \"n=\" + 2.5;");
        assertEquals(Arrays.asList("a1", "1b", "n=2.5"), printed);
    }

    @Test
    void noPrecedence_leftToRight() {
        nova.run("put 2 + 3 * 4; put 2 + (3 * 4); put 10 - 4 - 3;");
        assertEquals(Arrays.asList("20", "14", "3"), printed);
    }

    @Test
    void division_isAlwaysFloatingPoint() {
        nova.run("put 7 / 2; put 6 / 3;");
        assertEquals(Arrays.asList("3.5", "2.0"), printed);
    }

    @Test
    void divisionByZero_stopsTheRun() {
        NovaRuntimeError e = assertThrows(NovaRuntimeError.class,
                () -> nova.run("put 1; put 5/0; put 2;"));
        assertEquals(NovaRuntimeError.Kind.DIVISION_BY_ZERO, e.kind());
        assertEquals(Arrays.asList("1"), printed);
    }

    @Test
    void when_takesOnlyOneBranch() {
        nova.run("when (1<2) { put \"yes\"; } otherwise { put \"no\"; }");
        assertEquals(Arrays.asList("yes"), printed);

        printed.clear();
        nova.run("when (2<1) { put \"yes\"; } otherwise { put \"no\"; }");
        assertEquals(Arrays.asList("no"), printed);
    }

    @Test
    void whileLoop_reevaluatesCondition() {
        nova.run("have i=0; while (i<3) { put i; i = i+1; }");
        assertEquals(Arrays.asList("0", "1", "2"), printed);
    }

    @Test
    void truthiness() {
        nova.run(String.join("\n",
                "have u",
                "when (u) { put \"unset\" }",
                "when (0) { put \"zero\" }",
                "when (0.0) { put \"zero float\" }",
                "when (1 == 2) { put \"false\" }",
                "when (\"\") { put \"empty text\" }",
                "when (3) { put \"three\" }"));
        assertEquals(Arrays.asList("empty text", "three"), printed);
    }

    @Test
    void comparisons() {
        nova.run("put 1 == 1.0; put \"a\" == \"a\"; put \"a\" < \"b\"; put 3 > 2.5; put 1 == \"1\";");
        assertEquals(Arrays.asList("true", "true", "true", "true", "false"), printed);
    }

    @Test
    void uninitializedVariable_printsUnset() {
        nova.run("have x; put x;");
        assertEquals(Arrays.asList("unset"), printed);
    }

    @Test
    void redeclaration_overwritesInTheSingleScope() {
        Map<String, Value> env = nova.run("have x = 1; when (1) { have x = 2; have y = 3; } put x; put y;");
        assertEquals(Arrays.asList("2", "3"), printed);
        assertEquals(Value.integer(2), env.get("x"));
    }

    @Test
    void undeclaredVariable_isUndefinedBehavior() {
        NovaRuntimeError e = assertThrows(NovaRuntimeError.class, () -> nova.run("put missing;"));
        assertEquals(NovaRuntimeError.Kind.UNDEFINED_BEHAVIOR, e.kind());
        assertEquals(1, e.line());
    }

    @Test
    void arithmeticOnText_isUndefinedBehavior() {
        NovaRuntimeError e = assertThrows(NovaRuntimeError.class, () -> nova.run("put \"a\" - 1;"));
        assertEquals(NovaRuntimeError.Kind.UNDEFINED_BEHAVIOR, e.kind());
    }

    @Test
    void integerOverflow_isUndefinedBehavior() {
        NovaRuntimeError e = assertThrows(NovaRuntimeError.class,
                () -> nova.run("put 9223372036854775807 + 1;"));
        assertEquals(NovaRuntimeError.Kind.UNDEFINED_BEHAVIOR, e.kind());
    }

    @Test
    void pause_waitsForAcknowledgment() {
        nova.run("put 1; pause; pause(\"ignored\"); put 2;");
        assertEquals(2, acks);
        assertEquals(Arrays.asList("1", "2"), printed);
    }

    @Test
    void uiStatements_cannotBeInterpreted() {
        NovaRuntimeError e = assertThrows(NovaRuntimeError.class,
                () -> nova.run("put 1; ui_window(\"x\") { label(\"y\") }"));
        assertEquals(NovaRuntimeError.Kind.UNDEFINED_BEHAVIOR, e.kind());
        assertEquals(Arrays.asList("1"), printed);

        assertThrows(NovaRuntimeError.class, () -> nova.run("ui_message(\"hi\")"));
    }

    @Test
    void initialEnvironment_isVisibleAndReturned() {
        Map<String, Value> initial = new LinkedHashMap<>();
        initial.put("base", Value.integer(40));

        Map<String, Value> env = nova.run("have answer = base + 2;", initial);

        assertEquals(Value.integer(42), env.get("answer"));
        assertEquals(Value.integer(40), env.get("base"));
        assertThrows(UnsupportedOperationException.class, () -> env.put("z", Value.unset()));
    }

    @Test
    void assignment_yieldsTheAssignedValue() {
        Map<String, Value> env = nova.run("put (x = 3) + 1; put x;");
        assertEquals(Arrays.asList("4", "3"), printed);
        assertEquals("3", env.get("x").toString());
    }

    @Test
    void assignmentToUndeclaredName_createsTheBinding() {
        Map<String, Value> env = nova.run("y = 7; put y;");
        assertEquals(Arrays.asList("7"), printed);
        assertTrue(env.containsKey("y"));
    }

    @Test
    void blockDeclarations_outliveTheirBlock() {
        nova.run("have i = 0; while (i < 3) { have last = i; i = i + 1 } put last;");
        assertEquals(Arrays.asList("2"), printed);
    }
}

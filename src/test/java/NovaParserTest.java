import com.nova.script.parser.Expr;
import com.nova.script.parser.Lexer;
import com.nova.script.parser.ParseError;
import com.nova.script.parser.Parser;
import com.nova.script.parser.Statement;
import com.nova.script.parser.Statement.Stmt;
import com.nova.script.parser.UnexpectedEndOfInput;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NovaParserTest {

    private static List<Stmt> parse(String src) {
        return new Parser(new Lexer(src).tokenize(), src).parse();
    }

    @Test
    void binaryChain_foldsLeftToRight() {
        List<Stmt> program = parse("put 2 + 3 * 4;");
        Statement.PrintStmt print = (Statement.PrintStmt) program.get(0);

        Expr.Binary outer = (Expr.Binary) print.expression;
        assertEquals("*", outer.operator.lexeme);
        Expr.Binary inner = (Expr.Binary) outer.left;
        assertEquals("+", inner.operator.lexeme);
    }

    @Test
    void parentheses_groupExplicitly() {
        Statement.PrintStmt print = (Statement.PrintStmt) parse("put 2 + (3 * 4)").get(0);
        Expr.Binary outer = (Expr.Binary) print.expression;
        assertEquals("+", outer.operator.lexeme);
        assertTrue(outer.right instanceof Expr.Binary);
    }

    @Test
    void assignment_takesTheRestOfTheExpression() {
        Statement.ExprStmt stmt = (Statement.ExprStmt) parse("i = i + 1;").get(0);
        Expr.Assign assign = (Expr.Assign) stmt.expression;
        assertEquals("i", assign.name.lexeme);
        assertTrue(assign.value instanceof Expr.Binary);
    }

    @Test
    void assignmentToNonVariable_isRejected() {
        ParseError e = assertThrows(ParseError.class, () -> parse("5 = 3;"));
        assertEquals("=", e.found().lexeme);
    }

    @Test
    void semicolonsAreOptional() {
        List<Stmt> program = parse("have x = 1\nput x\nlet y");
        assertEquals(3, program.size());
        assertNull(((Statement.VarStmt) program.get(2)).initializer);
    }

    @Test
    void whenOtherwise_buildsBothBranches() {
        Statement.If stmt = (Statement.If) parse("when (1 < 2) { put \"yes\"; } otherwise { put \"no\"; }").get(0);
        assertEquals(1, stmt.thenBranch.size());
        assertNotNull(stmt.elseBranch);
        assertEquals(1, stmt.elseBranch.size());
    }

    @Test
    void danglingOtherwise_isRejected() {
        assertThrows(ParseError.class, () -> parse("otherwise { put 1; }"));
    }

    @Test
    void unsupportedOperators_areParseErrors() {
        assertThrows(ParseError.class, () -> parse("put 1 != 2;"));
        assertThrows(ParseError.class, () -> parse("put 5 % 2;"));
        assertThrows(ParseError.class, () -> parse("put 1 <= 2;"));
    }

    @Test
    void keywordsCannotNameVariables() {
        assertThrows(ParseError.class, () -> parse("have while = 1;"));
        assertThrows(ParseError.class, () -> parse("put put;"));
    }

    @Test
    void missingClosingBrace_isUnexpectedEnd() {
        assertThrows(UnexpectedEndOfInput.class, () -> parse("while (1) { put 1;"));
        assertThrows(UnexpectedEndOfInput.class, () -> parse("have x ="));
    }

    @Test
    void pause_acceptsOptionalArgument() {
        List<Stmt> program = parse("pause; pause(); pause(\"msg\")");
        assertEquals(3, program.size());
        assertNull(((Statement.PauseStmt) program.get(0)).expression);
        assertNull(((Statement.PauseStmt) program.get(1)).expression);
        assertNotNull(((Statement.PauseStmt) program.get(2)).expression);
    }

    @Test
    void window_withDefaultsAndWidgets() {
        String src = String.join("\n",
                "ui_window {",
                "    set_icon(\"icon.png\")",
                "    label(\"Hi\", 10, 20)",
                "    button(\"Go\") { put \"clicked\"; }",
                "}");
        Statement.UiWindow window = (Statement.UiWindow) parse(src).get(0);

        assertEquals("Nova App", ((Expr.Literal) window.title).value.asText());
        assertEquals(400L, ((Expr.Literal) window.width).value.asLong());
        assertEquals(300L, ((Expr.Literal) window.height).value.asLong());
        assertEquals(3, window.body.size());

        assertEquals("icon.png", ((Statement.SetIcon) window.body.get(0)).path);
        Statement.Label label = (Statement.Label) window.body.get(1);
        assertTrue(label.hasPosition());
        assertNull(label.width);
        Statement.Button button = (Statement.Button) window.body.get(2);
        assertFalse(button.hasPosition());
        assertEquals(1, button.onClick.size());
    }

    @Test
    void widgetsOutsideWindow_areRejected() {
        assertThrows(ParseError.class, () -> parse("label(\"x\")"));
        assertThrows(ParseError.class, () -> parse("button(\"x\")"));
        assertThrows(ParseError.class, () -> parse("set_icon(\"a.ico\")"));
    }

    @Test
    void nestedWindow_isRejected() {
        assertThrows(ParseError.class, () -> parse("ui_window(\"a\") { ui_window(\"b\") { } }"));
        assertThrows(ParseError.class, () -> parse("when (1) { ui_window(\"b\") { } }"));
    }

    @Test
    void badArgumentCounts_areRejected() {
        assertThrows(ParseError.class, () -> parse("ui_window(\"a\", 1, 2, 3) { }"));
        assertThrows(ParseError.class, () -> parse("ui_window { label(\"a\", 1) }"));
        assertThrows(ParseError.class, () -> parse("ui_window { button(\"a\", 1, 2, 3) }"));
    }

    @Test
    void setIcon_requiresTextLiteral() {
        assertThrows(ParseError.class, () -> parse("ui_window { set_icon(path) }"));
    }

    @Test
    void unknownWindowLines_arePassedThroughVerbatim() {
        String src = String.join("\n",
                "ui_window(\"Demo\", 300, 200) {",
                "    form_1.BackColor = System.Drawing.Color.Black;",
                "    button(\"Quit\", 10, 10) {",
                "        Application.Exit()",
                "    }",
                "    for (int k = 0; k < 2; k++) { Console.WriteLine(k); }",
                "}");
        Statement.UiWindow window = (Statement.UiWindow) parse(src).get(0);

        Statement.RawPassthrough first = (Statement.RawPassthrough) window.body.get(0);
        assertEquals("form_1.BackColor = System.Drawing.Color.Black;", first.text);

        Statement.Button quit = (Statement.Button) window.body.get(1);
        Statement.RawPassthrough exit = (Statement.RawPassthrough) quit.onClick.get(0);
        assertEquals("Application.Exit()", exit.text);

        Statement.RawPassthrough loop = (Statement.RawPassthrough) window.body.get(2);
        assertEquals("for (int k = 0; k < 2; k++) { Console.WriteLine(k); }", loop.text);
    }

    @Test
    void assignmentInsideHandler_isStillNova() {
        String src = "ui_window { button(\"+\") { count = count + 1 } }";
        Statement.UiWindow window = (Statement.UiWindow) parse(src).get(0);
        Statement.Button button = (Statement.Button) window.body.get(0);
        assertTrue(button.onClick.get(0) instanceof Statement.ExprStmt);
    }

    @Test
    void handlerLine_thatIsOnlyNovaAtTheStart_isKeptVerbatim() {
        String src = "ui_window { button(\"b\") { total = int.Parse(\"5\") } }";
        Statement.UiWindow window = (Statement.UiWindow) parse(src).get(0);
        Statement.Button button = (Statement.Button) window.body.get(0);

        assertEquals(1, button.onClick.size());
        Statement.RawPassthrough raw = (Statement.RawPassthrough) button.onClick.get(0);
        assertEquals("total = int.Parse(\"5\")", raw.text);
    }

    @Test
    void windowLine_withUnsupportedOperator_isKeptVerbatim() {
        String src = String.join("\n",
                "ui_window {",
                "    ticks = ticks % 60;",
                "    counter = counter + 1",
                "}");
        Statement.UiWindow window = (Statement.UiWindow) parse(src).get(0);

        assertEquals("ticks = ticks % 60;", ((Statement.RawPassthrough) window.body.get(0)).text);
        assertTrue(window.body.get(1) instanceof Statement.ExprStmt);
    }

    @Test
    void strayClosingParen_endsTheRawLineAtItsLineBreak() {
        String src = String.join("\n",
                "ui_window {",
                "    form_1.Text = Describe(1))",
                "    label(\"after\")",
                "}");
        Statement.UiWindow window = (Statement.UiWindow) parse(src).get(0);

        assertEquals(2, window.body.size());
        assertEquals("form_1.Text = Describe(1))", ((Statement.RawPassthrough) window.body.get(0)).text);
        assertTrue(window.body.get(1) instanceof Statement.Label);
    }
}

package com.nova.script.codegen;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.nova.debug.Debug;
import com.nova.script.parser.Expr.Assign;
import com.nova.script.parser.Expr.Binary;
import com.nova.script.parser.Expr.ExprInterface;
import com.nova.script.parser.Expr.ExprVisitor;
import com.nova.script.parser.Expr.Literal;
import com.nova.script.parser.Expr.Variable;
import com.nova.script.parser.Statement.Button;
import com.nova.script.parser.Statement.ExprStmt;
import com.nova.script.parser.Statement.If;
import com.nova.script.parser.Statement.Label;
import com.nova.script.parser.Statement.MessageBoxStmt;
import com.nova.script.parser.Statement.PauseStmt;
import com.nova.script.parser.Statement.PrintStmt;
import com.nova.script.parser.Statement.RawPassthrough;
import com.nova.script.parser.Statement.SetIcon;
import com.nova.script.parser.Statement.Stmt;
import com.nova.script.parser.Statement.StmtVisitor;
import com.nova.script.parser.Statement.UiWindow;
import com.nova.script.parser.Statement.VarStmt;
import com.nova.script.parser.Statement.While;
import com.nova.script.parser.Value;

/**
 * Lowers a parsed Nova program into a C# WinForms/console program.
 *
 * One structure-preserving walk emits a fixed template per node. {@code ui_window}
 * bodies expand into widget construction and event wiring; click handlers are
 * generated by the same statement rules as top-level code. Capability flags are
 * raised wherever a UI node occurs, however deeply nested.
 *
 * Nova has one flat scope, so every variable the program declares or assigns is hoisted
 * to a single {@code dynamic} local at the top of {@code Main}; {@code have} itself
 * lowers to an assignment wherever it appears.
 *
 * The generator itself is stateless; each {@link #generate} call owns its own pass.
 */
public final class CSharpGenerator {
    private static final String TAG = "CSharpGenerator";

    public static final String DEFAULT_CLASS_NAME = "NovaProgram";

    static final int LABEL_DEFAULT_X = 80;
    static final int LABEL_DEFAULT_Y = 20;
    static final int LABEL_DEFAULT_WIDTH = 200;
    static final int LABEL_DEFAULT_HEIGHT = 24;
    static final int BUTTON_DEFAULT_X = 80;
    static final int BUTTON_DEFAULT_Y = 100;
    static final int BUTTON_WIDTH = 100;
    static final int BUTTON_HEIGHT = 30;

    public GenerationResult generate(List<Stmt> program) {
        return generate(program, DEFAULT_CLASS_NAME);
    }

    public GenerationResult generate(List<Stmt> program, String className) {
        String name = (className == null || className.trim().isEmpty()) ? DEFAULT_CLASS_NAME : className.trim();
        if (!CSharpWriter.isValidClassName(name)) {
            throw new IllegalArgumentException("Not a valid C# class name: " + name);
        }

        Pass pass = new Pass();
        pass.statements(program);

        GenerationMetadata metadata = new GenerationMetadata(
                pass.needsGui,
                pass.needsGraphics,
                pass.icon == null ? null : pass.icon.sourcePath(),
                pass.icon == null ? null : pass.icon.targetBasename(),
                pass.icon != null && pass.icon.needsRasterConversion(),
                !pass.variables.isEmpty());

        String source = assemble(name, pass);
        Debug.get().d(TAG, "generated " + name + ": " + metadata);
        return new GenerationResult(name, source, metadata);
    }

    private static String assemble(String className, Pass pass) {
        CSharpWriter w = new CSharpWriter(0);
        w.line("using System;");
        if (pass.needsGui) w.line("using System.Windows.Forms;");
        if (pass.needsGraphics) w.line("using System.Drawing;");
        w.line("using System.IO;");
        w.blank();
        w.open("public class {} {", className);
        w.line("[STAThread]");
        w.open("public static void Main(string[] args) {");
        if (pass.needsGui) {
            w.line("Application.EnableVisualStyles();");
            w.line("Application.SetCompatibleTextRenderingDefault(false);");
        }
        for (String variable : pass.variables) {
            w.line("dynamic {} = null;", CSharpWriter.identifier(variable));
        }
        w.append(pass.body);
        w.close("}");
        if (pass.usesTruthy) {
            w.blank();
            w.open("static bool NovaTruthy(object value) {");
            w.line("if (value == null) return false;");
            w.line("if (value is bool) return (bool) value;");
            w.line("if (value is string) return true;");
            w.line("return Convert.ToDouble(value) != 0.0;");
            w.close("}");
        }
        if (pass.usesDivide) {
            w.blank();
            w.open("static double NovaDivide(object left, object right) {");
            w.line("double divisor = Convert.ToDouble(right);");
            w.line("if (divisor == 0.0) throw new DivideByZeroException(\"Division by zero!\");");
            w.line("return Convert.ToDouble(left) / divisor;");
            w.close("}");
        }
        w.close("}");
        return w.toString();
    }

    /** State of a single generation: output buffer, capability flags and naming counters. */
    private static final class Pass implements StmtVisitor, ExprVisitor<String> {
        final CSharpWriter body = new CSharpWriter(2);
        final Set<String> variables = new LinkedHashSet<>();
        final Deque<String> forms = new ArrayDeque<>();
        boolean needsGui;
        boolean needsGraphics;
        boolean usesTruthy;
        boolean usesDivide;
        IconResolution icon;
        int windows;
        int labels;
        int buttons;
        int icons;

        void statements(List<Stmt> stmts) {
            for (Stmt s : stmts) s.accept(this);
        }

        void requireGui(boolean graphics) {
            needsGui = true;
            if (graphics) needsGraphics = true;
        }

        // -------------------------
        // Statements
        // -------------------------

        @Override
        public void visitExprStmt(ExprStmt stmt) {
            body.line("{};", render(stmt.expression));
        }

        @Override
        public void visitVarStmt(VarStmt stmt) {
            variables.add(stmt.name.lexeme);
            String value = (stmt.initializer == null) ? "null" : render(stmt.initializer);
            body.line("{} = {};", CSharpWriter.identifier(stmt.name.lexeme), value);
        }

        @Override
        public void visitPrintStmt(PrintStmt stmt) {
            body.line("Console.WriteLine({});", render(stmt.expression));
        }

        @Override
        public void visitPauseStmt(PauseStmt stmt) {
            body.line("Console.ReadKey(true);");
        }

        @Override
        public void visitIfStmt(If stmt) {
            body.open("if ({}) {", condition(stmt.condition));
            statements(stmt.thenBranch);
            if (stmt.elseBranch != null) {
                body.reopen("} else {");
                statements(stmt.elseBranch);
            }
            body.close("}");
        }

        @Override
        public void visitWhileStmt(While stmt) {
            body.open("while ({}) {", condition(stmt.condition));
            statements(stmt.body);
            body.close("}");
        }

        @Override
        public void visitMessageBoxStmt(MessageBoxStmt stmt) {
            requireGui(false);
            body.line("MessageBox.Show({});", textArgument(stmt.message));
        }

        @Override
        public void visitUiWindowStmt(UiWindow stmt) {
            requireGui(true);
            String form = "form_" + (++windows);
            body.line("Form {} = new Form();", form);
            body.line("{}.Text = {};", form, textArgument(stmt.title));
            body.line("{}.ClientSize = new System.Drawing.Size({}, {});", form, render(stmt.width), render(stmt.height));
            forms.push(form);
            try {
                statements(stmt.body);
            } finally {
                forms.pop();
            }
            body.line("Application.Run({});", form);
        }

        @Override
        public void visitSetIconStmt(SetIcon stmt) {
            requireGui(true);
            icon = IconResolution.resolve(stmt.path);
            int n = ++icons;
            String form = forms.peek();
            String path = "iconPath_" + n;
            String error = "iconError_" + n;
            String view = "iconView_" + n;
            body.open("{");
            body.line("string {} = System.IO.Path.Combine(AppDomain.CurrentDomain.BaseDirectory, {});",
                    path, CSharpWriter.quote(icon.targetBasename()));
            body.open("try {");
            body.line("{}.Icon = new System.Drawing.Icon({});", form, path);
            body.reopen("} catch (Exception {}) {", error);
            body.line("Console.WriteLine(\"Icon load error: \" + {}.Message);", error);
            body.line("PictureBox {} = new PictureBox();", view);
            body.line("{}.SizeMode = PictureBoxSizeMode.Zoom;", view);
            body.line("{}.SetBounds(8, 8, 64, 64);", view);
            body.line("{}.ImageLocation = System.IO.Path.Combine(AppDomain.CurrentDomain.BaseDirectory, {});",
                    view, CSharpWriter.quote(icon.sourceBasename()));
            body.line("{}.Controls.Add({});", form, view);
            body.close("}");
            body.close("}");
        }

        @Override
        public void visitLabelStmt(Label stmt) {
            requireGui(true);
            String lbl = "lbl_" + (++labels);
            body.line("Label {} = new Label() { Text = {}, AutoSize = true };", lbl, textArgument(stmt.text));
            if (stmt.hasPosition()) {
                body.line("{}.SetBounds({}, {}, {}, {});", lbl, render(stmt.x), render(stmt.y),
                        stmt.width == null ? Integer.toString(LABEL_DEFAULT_WIDTH) : render(stmt.width),
                        stmt.height == null ? Integer.toString(LABEL_DEFAULT_HEIGHT) : render(stmt.height));
            } else {
                body.line("{}.Location = new System.Drawing.Point({}, {});", lbl,
                        Integer.toString(LABEL_DEFAULT_X), Integer.toString(LABEL_DEFAULT_Y));
            }
            body.line("{}.Controls.Add({});", forms.peek(), lbl);
        }

        @Override
        public void visitButtonStmt(Button stmt) {
            requireGui(true);
            int n = ++buttons;
            String btn = "btn_" + n;
            body.line("Button {} = new Button() { Text = {} };", btn, textArgument(stmt.text));
            if (stmt.hasPosition()) {
                body.line("{}.SetBounds({}, {}, {}, {});", btn, render(stmt.x), render(stmt.y),
                        Integer.toString(BUTTON_WIDTH), Integer.toString(BUTTON_HEIGHT));
            } else {
                body.line("{}.SetBounds({}, {}, {}, {});", btn,
                        Integer.toString(BUTTON_DEFAULT_X), Integer.toString(BUTTON_DEFAULT_Y),
                        Integer.toString(BUTTON_WIDTH), Integer.toString(BUTTON_HEIGHT));
            }
            if (stmt.onClick != null) {
                body.open("{}.Click += (sender_{}, args_{}) => {", btn, Integer.toString(n), Integer.toString(n));
                statements(stmt.onClick);
                body.close("};");
            }
            body.line("{}.Controls.Add({});", forms.peek(), btn);
        }

        @Override
        public void visitRawPassthroughStmt(RawPassthrough stmt) {
            String text = stmt.text;
            if (!(text.endsWith(";") || text.endsWith("{") || text.endsWith("}"))) text = text + ";";
            body.line("{}", text);
        }

        // -------------------------
        // Expressions
        // -------------------------

        String render(ExprInterface expr) {
            return expr.accept(this);
        }

        /** C# conditions must be bool; anything that is not a comparison goes through NovaTruthy. */
        String condition(ExprInterface expr) {
            if (expr instanceof Binary && isComparison(((Binary) expr).operator.lexeme)) {
                return render(expr);
            }
            usesTruthy = true;
            return "NovaTruthy(" + render(expr) + ")";
        }

        /** Widget and dialog text must be a C# string. */
        String textArgument(ExprInterface expr) {
            if (expr instanceof Literal && ((Literal) expr).value.getType() == Value.Type.TEXT) {
                return render(expr);
            }
            return "Convert.ToString(" + render(expr) + ")";
        }

        private static boolean isComparison(String op) {
            return op.equals("==") || op.equals("<") || op.equals(">");
        }

        // Nested operands are parenthesized so C# precedence cannot regroup the flat left-to-right chain.
        private String operand(ExprInterface expr) {
            String text = render(expr);
            return (expr instanceof Binary || expr instanceof Assign) ? "(" + text + ")" : text;
        }

        @Override
        public String visitBinaryExpr(Binary expr) {
            if (expr.operator.lexeme.equals("/")) {
                usesDivide = true;
                return "NovaDivide(" + render(expr.left) + ", " + render(expr.right) + ")";
            }
            return operand(expr.left) + " " + expr.operator.lexeme + " " + operand(expr.right);
        }

        @Override
        public String visitLiteralExpr(Literal expr) {
            Value v = expr.value;
            switch (v.getType()) {
                case TEXT:
                    return CSharpWriter.quote(v.asText());
                case NUMBER:
                    return v.toString();
                case BOOLEAN:
                    return v.asBool() ? "true" : "false";
                default:
                    return "null";
            }
        }

        @Override
        public String visitVariableExpr(Variable expr) {
            return CSharpWriter.identifier(expr.name.lexeme);
        }

        @Override
        public String visitAssignExpr(Assign expr) {
            variables.add(expr.name.lexeme);
            return CSharpWriter.identifier(expr.name.lexeme) + " = " + render(expr.value);
        }
    }
}

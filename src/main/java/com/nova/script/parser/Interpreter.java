package com.nova.script.parser;

import java.util.List;

import com.nova.debug.Debug;
import com.nova.script.AcknowledgmentSource;
import com.nova.script.OutputSink;
import com.nova.script.parser.Expr.Assign;
import com.nova.script.parser.Expr.Binary;
import com.nova.script.parser.Expr.ExprVisitor;
import com.nova.script.parser.Expr.Literal;
import com.nova.script.parser.Expr.Variable;
import com.nova.script.parser.NovaRuntimeError.Kind;
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

/**
 * Tree-walking evaluator. Every failure is fatal: the first {@link NovaRuntimeError}
 * propagates out of {@link #execute(List)} and nothing after it runs.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "Interpreter";

    private final Environment env;
    private final OutputSink output;
    private final AcknowledgmentSource acknowledgment;

    public Interpreter(Environment env, OutputSink output, AcknowledgmentSource acknowledgment) {
        this.env = env;
        this.output = output;
        this.acknowledgment = acknowledgment;
    }

    public void execute(List<Stmt> program) {
        for (Stmt stmt : program) stmt.accept(this);
    }

    public Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    public void visitVarStmt(VarStmt stmt) {
        Value value = (stmt.initializer == null) ? Value.unset() : eval(stmt.initializer);
        env.define(stmt.name.lexeme, value);
    }

    public void visitPrintStmt(PrintStmt stmt) {
        output.println(eval(stmt.expression).toString());
    }

    public void visitPauseStmt(PauseStmt stmt) {
        if (stmt.expression != null) eval(stmt.expression);
        Debug.get().d(TAG, "pause at line " + stmt.keyword.line);
        acknowledgment.waitForAck();
    }

    public void visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) execute(stmt.thenBranch);
        else if (stmt.elseBranch != null) execute(stmt.elseBranch);
    }

    public void visitWhileStmt(While stmt) {
        while (eval(stmt.condition).isTruthy()) {
            execute(stmt.body);
        }
    }

    public void visitMessageBoxStmt(MessageBoxStmt stmt) {
        throw unsupported(stmt.keyword, "ui_message");
    }

    public void visitUiWindowStmt(UiWindow stmt) {
        throw unsupported(stmt.keyword, "ui_window");
    }

    public void visitSetIconStmt(SetIcon stmt) {
        throw unsupported(stmt.keyword, "set_icon");
    }

    public void visitLabelStmt(Label stmt) {
        throw unsupported(stmt.keyword, "label");
    }

    public void visitButtonStmt(Button stmt) {
        throw unsupported(stmt.keyword, "button");
    }

    public void visitRawPassthroughStmt(RawPassthrough stmt) {
        throw unsupported(stmt.first, "raw window line");
    }

    private NovaRuntimeError unsupported(Token at, String what) {
        return new NovaRuntimeError(Kind.UNDEFINED_BEHAVIOR, at.line,
                what + " cannot be executed by the interpreter; compile the program instead");
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.lexeme) {
            case "+":
                if (left.getType() == Value.Type.TEXT || right.getType() == Value.Type.TEXT) {
                    return Value.text(left.toString() + right.toString());
                }
                requireNumbers(left, right, op);
                if (left.isInteger() && right.isInteger()) {
                    return Value.integer(exact(op, () -> Math.addExact(left.asLong(), right.asLong())));
                }
                return Value.number(left.asNumber() + right.asNumber());
            case "-":
                requireNumbers(left, right, op);
                if (left.isInteger() && right.isInteger()) {
                    return Value.integer(exact(op, () -> Math.subtractExact(left.asLong(), right.asLong())));
                }
                return Value.number(left.asNumber() - right.asNumber());
            case "*":
                requireNumbers(left, right, op);
                if (left.isInteger() && right.isInteger()) {
                    return Value.integer(exact(op, () -> Math.multiplyExact(left.asLong(), right.asLong())));
                }
                return Value.number(left.asNumber() * right.asNumber());
            case "/":
                requireNumbers(left, right, op);
                if (right.asNumber() == 0.0) {
                    throw new NovaRuntimeError(Kind.DIVISION_BY_ZERO, op.line, "Division by zero!");
                }
                return Value.number(left.asNumber() / right.asNumber());
            case "==":
                return Value.bool(left.equals(right));
            case "<":
                return Value.bool(compare(left, right, op) < 0);
            case ">":
                return Value.bool(compare(left, right, op) > 0);
            default:
                throw new NovaRuntimeError(Kind.UNDEFINED_BEHAVIOR, op.line, "Unsupported binary operator: " + op.lexeme);
        }
    }

    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    public Value visitVariableExpr(Variable expr) {
        Value value = env.get(expr.name.lexeme);
        if (value == null) {
            throw new NovaRuntimeError(Kind.UNDEFINED_BEHAVIOR, expr.name.line, "Undefined variable: " + expr.name.lexeme);
        }
        return value;
    }

    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        env.assign(expr.name.lexeme, value);
        return value;
    }

    private int compare(Value left, Value right, Token op) {
        if (left.getType() == Value.Type.TEXT && right.getType() == Value.Type.TEXT) {
            return left.asText().compareTo(right.asText());
        }
        requireNumbers(left, right, op);
        if (left.isInteger() && right.isInteger()) return Long.compare(left.asLong(), right.asLong());
        return Double.compare(left.asNumber(), right.asNumber());
    }

    private void requireNumbers(Value left, Value right, Token op) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) return;
        throw new NovaRuntimeError(Kind.UNDEFINED_BEHAVIOR, op.line,
                "Operator '" + op.lexeme + "' expects numbers, got " + left.describe() + " and " + right.describe());
    }

    private interface LongOp {
        long apply();
    }

    private static long exact(Token op, LongOp fn) {
        try {
            return fn.apply();
        } catch (ArithmeticException e) {
            throw new NovaRuntimeError(Kind.UNDEFINED_BEHAVIOR, op.line, "Integer overflow in '" + op.lexeme + "'");
        }
    }
}

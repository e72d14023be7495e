package com.nova.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    /** Statements that only make sense inside a {@code ui_window} body. */
    public interface UiStmt extends Stmt {}

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitVarStmt(VarStmt stmt);
        void visitPrintStmt(PrintStmt stmt);
        void visitPauseStmt(PauseStmt stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitMessageBoxStmt(MessageBoxStmt stmt);
        void visitUiWindowStmt(UiWindow stmt);
        void visitSetIconStmt(SetIcon stmt);
        void visitLabelStmt(Label stmt);
        void visitButtonStmt(Button stmt);
        void visitRawPassthroughStmt(RawPassthrough stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer; // may be null
        VarStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    public static final class PrintStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface expression;
        PrintStmt(Token keyword, Expr.ExprInterface expression) { this.keyword = keyword; this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
    }

    public static final class PauseStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface expression; // may be null, evaluated and discarded
        PauseStmt(Token keyword, Expr.ExprInterface expression) { this.keyword = keyword; this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitPauseStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch; // null when there is no 'otherwise'
        If(Expr.ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;
        While(Expr.ExprInterface condition, List<Stmt> body) {
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    public static final class MessageBoxStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface message;
        MessageBoxStmt(Token keyword, Expr.ExprInterface message) { this.keyword = keyword; this.message = message; }
        public void accept(StmtVisitor visitor) { visitor.visitMessageBoxStmt(this); }
    }

    public static final class UiWindow implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface title;
        public final Expr.ExprInterface width;
        public final Expr.ExprInterface height;
        public final List<Stmt> body;
        UiWindow(Token keyword, Expr.ExprInterface title, Expr.ExprInterface width, Expr.ExprInterface height, List<Stmt> body) {
            this.keyword = keyword;
            this.title = title;
            this.width = width;
            this.height = height;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitUiWindowStmt(this); }
    }

    public static final class SetIcon implements UiStmt {
        public final Token keyword;
        public final String path;
        SetIcon(Token keyword, String path) { this.keyword = keyword; this.path = path; }
        public void accept(StmtVisitor visitor) { visitor.visitSetIconStmt(this); }
    }

    public static final class Label implements UiStmt {
        public final Token keyword;
        public final Expr.ExprInterface text;
        // x, y, width and height are each null when omitted
        public final Expr.ExprInterface x;
        public final Expr.ExprInterface y;
        public final Expr.ExprInterface width;
        public final Expr.ExprInterface height;
        Label(Token keyword, Expr.ExprInterface text, Expr.ExprInterface x, Expr.ExprInterface y,
              Expr.ExprInterface width, Expr.ExprInterface height) {
            this.keyword = keyword;
            this.text = text;
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
        }
        public boolean hasPosition() { return x != null; }
        public void accept(StmtVisitor visitor) { visitor.visitLabelStmt(this); }
    }

    public static final class Button implements UiStmt {
        public final Token keyword;
        public final Expr.ExprInterface text;
        public final Expr.ExprInterface x; // may be null
        public final Expr.ExprInterface y; // may be null
        public final List<Stmt> onClick;   // null when the button has no handler
        Button(Token keyword, Expr.ExprInterface text, Expr.ExprInterface x, Expr.ExprInterface y, List<Stmt> onClick) {
            this.keyword = keyword;
            this.text = text;
            this.x = x;
            this.y = y;
            this.onClick = onClick;
        }
        public boolean hasPosition() { return x != null; }
        public void accept(StmtVisitor visitor) { visitor.visitButtonStmt(this); }
    }

    /** A window-body line kept verbatim for the generated program. */
    public static final class RawPassthrough implements UiStmt {
        public final Token first;
        public final String text;
        RawPassthrough(Token first, String text) { this.first = first; this.text = text; }
        public void accept(StmtVisitor visitor) { visitor.visitRawPassthroughStmt(this); }
    }
}

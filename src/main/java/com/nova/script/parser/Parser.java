package com.nova.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.nova.debug.Debug;
import com.nova.script.parser.Expr.Assign;
import com.nova.script.parser.Expr.Binary;
import com.nova.script.parser.Expr.ExprInterface;
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
import com.nova.script.parser.Statement.UiWindow;
import com.nova.script.parser.Statement.VarStmt;
import com.nova.script.parser.Statement.While;

/**
 * Recursive-descent parser shared by the interpreter and the code generator.
 *
 * Statements are dispatched on their leading identifier. Expressions are flat:
 * {@code primary (op primary)*}, folded strictly left to right with no precedence.
 */
public class Parser {
    private static final String TAG = "Parser";

    static final Set<String> BINARY_OPERATORS = new HashSet<>(Arrays.asList("+", "-", "*", "/", "==", "<", ">"));

    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "have", "let", "print", "put", "pause", "when", "otherwise", "while",
            "ui_message", "ui_window", "set_icon", "label", "button"));

    private final List<Token> tokens;
    private final String source;
    private int current = 0;

    public Parser(List<Token> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(statement(true, false));
        }
        Debug.get().d(TAG, "parsed " + statements.size() + " top-level statements from " + tokens.size() + " tokens");
        return statements;
    }

    /**
     * @param topLevel whether {@code ui_window} may appear here
     * @param ui whether unknown lines fall back to raw passthrough (window bodies and click handlers)
     */
    private Stmt statement(boolean topLevel, boolean ui) {
        Token head = peek();
        if (head.type == TokenType.IDENTIFIER) {
            switch (head.lexeme) {
                case "have":
                case "let":
                    advance();
                    return varDeclaration();
                case "print":
                case "put":
                    advance();
                    return printStatement();
                case "pause":
                    advance();
                    return pauseStatement();
                case "when":
                    advance();
                    return whenStatement(ui);
                case "while":
                    advance();
                    return whileStatement(ui);
                case "ui_message":
                    advance();
                    return messageBoxStatement();
                case "ui_window":
                    if (!topLevel) {
                        throw error(head, "statement", "'ui_window' is only allowed at top level.");
                    }
                    advance();
                    return windowStatement();
                case "otherwise":
                    throw error(head, "statement", "'otherwise' without a preceding 'when' block.");
                case "set_icon":
                case "label":
                case "button":
                    throw error(head, "statement", "'" + head.lexeme + "' is only allowed inside ui_window.");
                default:
                    if (ui) return nextIsOperator() ? novaOrRaw() : rawPassthrough();
            }
        }
        return exprStatement();
    }

    /**
     * Inside a window body or click handler, a line is a Nova expression statement only
     * when it parses completely up to its line end, {@code ;} or the closing brace.
     * Anything else is rewound and kept verbatim.
     */
    private Stmt novaOrRaw() {
        int start = current;
        try {
            Stmt stmt = exprStatement();
            if (endsLine()) return stmt;
        } catch (ParseError e) {
            Debug.get().t(TAG, () -> "not a Nova line at " + tokens.get(start).position() + ": " + e.getMessage());
        }
        current = start;
        return rawPassthrough();
    }

    private boolean endsLine() {
        if (isAtEnd()) return true;
        Token next = tokens.get(current);
        return previous().type == TokenType.SEMICOLON
                || next.type == TokenType.RIGHT_BRACE
                || next.line > previous().line;
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "variable name");
        if (KEYWORDS.contains(name.lexeme)) {
            throw error(name, "variable name", "'" + name.lexeme + "' is a keyword and cannot name a variable.");
        }
        ExprInterface initializer = null;
        if (checkOperator("=")) {
            advance();
            initializer = expression();
        }
        optionalSemicolon();
        return new VarStmt(name, initializer);
    }

    private Stmt printStatement() {
        Token keyword = previous();
        ExprInterface value = expression();
        optionalSemicolon();
        return new PrintStmt(keyword, value);
    }

    private Stmt pauseStatement() {
        Token keyword = previous();
        ExprInterface value = null;
        if (match(TokenType.LEFT_PAREN)) {
            if (!check(TokenType.RIGHT_PAREN)) value = expression();
            consume(TokenType.RIGHT_PAREN, "')'");
        }
        optionalSemicolon();
        return new PauseStmt(keyword, value);
    }

    private Stmt whenStatement(boolean ui) {
        ExprInterface condition = condition("when");
        List<Stmt> thenBranch = block(ui);
        List<Stmt> elseBranch = null;
        if (!isAtEnd() && peek().is(TokenType.IDENTIFIER, "otherwise")) {
            advance();
            elseBranch = block(ui);
        }
        return new If(condition, thenBranch, elseBranch);
    }

    // The condition and body are parsed exactly once; the interpreter re-runs the cached nodes.
    private Stmt whileStatement(boolean ui) {
        ExprInterface condition = condition("while");
        List<Stmt> body = block(ui);
        return new While(condition, body);
    }

    private Stmt messageBoxStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "'(' after 'ui_message'");
        ExprInterface message = expression();
        consume(TokenType.RIGHT_PAREN, "')'");
        optionalSemicolon();
        return new MessageBoxStmt(keyword, message);
    }

    private ExprInterface condition(String keyword) {
        consume(TokenType.LEFT_PAREN, "'(' after '" + keyword + "'");
        ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "')' after " + keyword + " condition");
        return condition;
    }

    private List<Stmt> block(boolean ui) {
        consume(TokenType.LEFT_BRACE, "'{'");
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE)) {
            if (isAtEnd()) throw endOfInput("'}'");
            statements.add(statement(false, ui));
        }
        consume(TokenType.RIGHT_BRACE, "'}' after block");
        return statements;
    }

    private Stmt exprStatement() {
        ExprInterface expr = expression();
        optionalSemicolon();
        return new ExprStmt(expr);
    }

    // -------------------------
    // ui_window sub-grammar
    // -------------------------

    private Stmt windowStatement() {
        Token keyword = previous();
        List<ExprInterface> args = check(TokenType.LEFT_PAREN) ? arguments("ui_window") : new ArrayList<>();
        if (args.size() > 3) {
            throw error(keyword, "at most 3 arguments", "ui_window expects (title, width, height).");
        }
        ExprInterface title = args.size() >= 1 ? args.get(0) : new Literal(Value.text("Nova App"), null);
        ExprInterface width = args.size() >= 2 ? args.get(1) : new Literal(Value.integer(400), null);
        ExprInterface height = args.size() >= 3 ? args.get(2) : new Literal(Value.integer(300), null);

        consume(TokenType.LEFT_BRACE, "'{' after ui_window header");
        List<Stmt> body = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            if (isAtEnd()) throw endOfInput("'}' closing ui_window");
            body.add(windowItem());
        }
        consume(TokenType.RIGHT_BRACE, "'}' closing ui_window");
        return new UiWindow(keyword, title, width, height, body);
    }

    private Stmt windowItem() {
        Token head = peek();
        if (head.type == TokenType.IDENTIFIER) {
            switch (head.lexeme) {
                case "set_icon":
                    advance();
                    return setIcon();
                case "label":
                    advance();
                    return label();
                case "button":
                    advance();
                    return button();
                default:
                    break;
            }
        }
        return statement(false, true);
    }

    private Stmt setIcon() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "'(' after 'set_icon'");
        Token path = consume(TokenType.TEXT, "icon path text");
        consume(TokenType.RIGHT_PAREN, "')'");
        optionalSemicolon();
        return new SetIcon(keyword, (String) path.literal);
    }

    private Stmt label() {
        Token keyword = previous();
        List<ExprInterface> args = check(TokenType.LEFT_PAREN) ? arguments("label") : new ArrayList<>();
        if (args.size() == 2 || args.size() > 5) {
            throw error(keyword, "label(text[, x, y[, w[, h]]])", "label expects text, then x and y together, then optional width and height.");
        }
        optionalSemicolon();
        ExprInterface text = args.isEmpty() ? new Literal(Value.text(""), null) : args.get(0);
        return new Label(keyword, text,
                argOrNull(args, 1), argOrNull(args, 2), argOrNull(args, 3), argOrNull(args, 4));
    }

    private Stmt button() {
        Token keyword = previous();
        List<ExprInterface> args = check(TokenType.LEFT_PAREN) ? arguments("button") : new ArrayList<>();
        if (args.size() == 2 || args.size() > 3) {
            throw error(keyword, "button(text[, x, y])", "button expects text, then x and y together.");
        }
        ExprInterface text = args.isEmpty() ? new Literal(Value.text("Button"), null) : args.get(0);
        List<Stmt> onClick = null;
        if (check(TokenType.LEFT_BRACE)) {
            onClick = block(true);
        } else {
            optionalSemicolon();
        }
        return new Button(keyword, text, argOrNull(args, 1), argOrNull(args, 2), onClick);
    }

    /**
     * Consumes one source line verbatim. A line that opens braces or parentheses keeps going
     * until they close, so multi-line target snippets survive intact.
     */
    private Stmt rawPassthrough() {
        Token first = peek();
        Token last = first;
        int depth = 0;
        int parens = 0;
        while (!isAtEnd()) {
            Token t = peek();
            if (depth == 0 && parens == 0 && t.line > last.line) break;
            if (depth == 0 && t.type == TokenType.RIGHT_BRACE) break;
            advance();
            last = t;
            if (t.type == TokenType.LEFT_BRACE) depth++;
            else if (t.type == TokenType.RIGHT_BRACE) depth--;
            else if (t.type == TokenType.LEFT_PAREN) parens++;
            else if (t.type == TokenType.RIGHT_PAREN) parens = Math.max(0, parens - 1);
            else if (depth == 0 && parens == 0 && t.type == TokenType.SEMICOLON) break;
        }
        if (depth > 0) throw endOfInput("'}'");
        String text = source.substring(first.offset, last.end());
        Debug.get().t(TAG, () -> "raw passthrough at " + first.position() + ": " + text);
        return new RawPassthrough(first, text);
    }

    private List<ExprInterface> arguments(String owner) {
        consume(TokenType.LEFT_PAREN, "'(' after '" + owner + "'");
        List<ExprInterface> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')' after " + owner + " arguments");
        return args;
    }

    private static ExprInterface argOrNull(List<ExprInterface> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() {
        ExprInterface left = primary();
        while (check(TokenType.OPERATOR)) {
            Token op = advance();
            if (op.lexeme.equals("=")) {
                if (!(left instanceof Variable)) {
                    throw error(op, "variable before '='", "Invalid assignment target.");
                }
                ExprInterface value = expression();
                return new Assign(((Variable) left).name, value);
            }
            if (!BINARY_OPERATORS.contains(op.lexeme)) {
                throw error(op, "one of + - * / == < > =", "Unsupported operator '" + op.lexeme + "'.");
            }
            ExprInterface right = primary();
            left = new Binary(left, op, right);
        }
        return left;
    }

    private ExprInterface primary() {
        if (isAtEnd()) throw endOfInput("expression");
        if (match(TokenType.NUMBER, TokenType.TEXT)) {
            return new Literal(Value.ofLiteral(previous().literal), previous());
        }
        if (check(TokenType.IDENTIFIER)) {
            Token name = peek();
            if (KEYWORDS.contains(name.lexeme)) {
                throw error(name, "expression", "Keyword '" + name.lexeme + "' cannot be used as a value.");
            }
            advance();
            return new Variable(name);
        }
        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "')' after expression");
            return expr;
        }
        throw error(peek(), "expression", "Expect expression.");
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private void optionalSemicolon() {
        match(TokenType.SEMICOLON);
    }

    private boolean nextIsOperator() {
        int next = current + 1;
        return next < tokens.size() && tokens.get(next).type == TokenType.OPERATOR;
    }

    private boolean checkOperator(String lexeme) {
        return !isAtEnd() && peek().is(TokenType.OPERATOR, lexeme);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (isAtEnd()) throw endOfInput(expected);
        if (check(type)) return advance();
        throw error(peek(), expected, "Expect " + expected + " but found '" + peek().lexeme + "'.");
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return current >= tokens.size(); }
    private Token peek() {
        if (isAtEnd()) throw endOfInput("more input");
        return tokens.get(current);
    }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String expected, String message) {
        return new ParseError(expected, token, message);
    }

    private UnexpectedEndOfInput endOfInput(String expected) {
        if (tokens.isEmpty()) return new UnexpectedEndOfInput(1, 1, expected);
        Token last = tokens.get(tokens.size() - 1);
        return new UnexpectedEndOfInput(last.line, last.column + last.lexeme.length(), expected);
    }
}

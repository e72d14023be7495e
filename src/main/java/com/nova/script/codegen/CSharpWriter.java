package com.nova.script.codegen;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Line-oriented C# emitter with indentation and the escaping rules for text
 * literals and identifiers.
 *
 * Templates use {@code {}} placeholders, filled in order. Arguments are inserted
 * as-is and never re-scanned, so raw text containing braces or quotes is safe.
 */
public final class CSharpWriter {
    private static final String INDENT = "    ";

    private static final Set<String> CSHARP_KEYWORDS = new HashSet<>(Arrays.asList(
            "abstract", "as", "base", "bool", "break", "byte", "case", "catch", "char", "checked",
            "class", "const", "continue", "decimal", "default", "delegate", "do", "double", "else",
            "enum", "event", "explicit", "extern", "false", "finally", "fixed", "float", "for",
            "foreach", "goto", "if", "implicit", "in", "int", "interface", "internal", "is", "lock",
            "long", "namespace", "new", "null", "object", "operator", "out", "override", "params",
            "private", "protected", "public", "readonly", "ref", "return", "sbyte", "sealed",
            "short", "sizeof", "stackalloc", "static", "string", "struct", "switch", "this",
            "throw", "true", "try", "typeof", "uint", "ulong", "unchecked", "unsafe", "ushort",
            "using", "virtual", "void", "volatile", "while"));

    private final StringBuilder out = new StringBuilder();
    private int depth;

    public CSharpWriter(int depth) {
        this.depth = depth;
    }

    public CSharpWriter line(String template, String... args) {
        for (int i = 0; i < depth; i++) out.append(INDENT);
        out.append(fill(template, args)).append('\n');
        return this;
    }

    /** Emits {@code header} and indents everything until the matching {@link #close}. */
    public CSharpWriter open(String template, String... args) {
        line(template, args);
        depth++;
        return this;
    }

    public CSharpWriter close(String template, String... args) {
        if (depth == 0) throw new IllegalStateException("close() without matching open()");
        depth--;
        return line(template, args);
    }

    /** Emits a line one level out without leaving the block, as in {@code "} else {"}. */
    public CSharpWriter reopen(String template, String... args) {
        if (depth == 0) throw new IllegalStateException("reopen() outside a block");
        depth--;
        line(template, args);
        depth++;
        return this;
    }

    public CSharpWriter blank() {
        out.append('\n');
        return this;
    }

    public CSharpWriter append(CSharpWriter nested) {
        out.append(nested.out);
        return this;
    }

    public int depth() {
        return depth;
    }

    static String fill(String template, String... args) {
        if (args.length == 0) return template;
        StringBuilder sb = new StringBuilder(template.length() + 32);
        int argIndex = 0;
        int from = 0;
        int at;
        while ((at = template.indexOf("{}", from)) >= 0) {
            if (argIndex >= args.length) throw new IllegalArgumentException("Too few arguments for template: " + template);
            sb.append(template, from, at).append(args[argIndex++]);
            from = at + 2;
        }
        if (argIndex != args.length) throw new IllegalArgumentException("Too many arguments for template: " + template);
        sb.append(template, from, template.length());
        return sb.toString();
    }

    /** C# regular string literal for {@code text}, quotes included. */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default:
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /** Nova identifiers that collide with C# keywords are emitted verbatim-escaped ({@code @class}). */
    public static String identifier(String name) {
        return CSHARP_KEYWORDS.contains(name) ? "@" + name : name;
    }

    public static boolean isValidClassName(String name) {
        if (name == null || name.isEmpty() || CSHARP_KEYWORDS.contains(name)) return false;
        if (!Character.isLetter(name.charAt(0)) && name.charAt(0) != '_') return false;
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}

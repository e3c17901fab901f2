package com.migrationanalyzer.core.scanner.impl.refactoring;

import com.migrationanalyzer.core.scanner.base.SourceLine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based structural view of a Java file: classes and methods found by signature patterns
 * and brace depth.
 *
 * <p>String and character literals and trailing line comments are removed before braces are
 * counted. Braces inside text blocks or block comments opened mid-line are still counted.
 */
public final class BraceStructure {

    /**
     * Maximum number of lines between a method signature and its opening brace.
     */
    static final int SIGNATURE_LOOKAHEAD = 6;

    private static final Pattern TYPE_DECLARATION = Pattern.compile(
        "(?<![.\\w])(?:class|interface|enum|record)\\s+(\\w+)");
    private static final Pattern LEADING_ANNOTATIONS = Pattern.compile(
        "^\\s*(?:@[\\w.]+(?:\\([^)]*\\))?\\s*)+");
    private static final Pattern METHOD_SIGNATURE = Pattern.compile(
        "^\\s*((?:(?:public|protected|private|static|final|abstract|synchronized|native|default|strictfp)\\s+)*)"
            + "(?:<[^>]+>\\s+)?(?:[\\w.$]+(?:<[^()]*>)?(?:\\[\\])*\\s+)?(\\w+)\\s*\\(");
    private static final Set<String> NOT_A_METHOD = Set.of(
        "if", "for", "while", "switch", "catch", "synchronized", "return", "new", "else", "do", "try",
        "throw", "case", "assert", "yield", "super", "this");
    private static final Pattern STRING_LITERAL = Pattern.compile("\"(?:\\\\.|[^\"\\\\])*\"");
    private static final Pattern CHAR_LITERAL = Pattern.compile("'(?:\\\\.|[^'\\\\])+'");

    private final List<MethodSpan> methods;
    private final List<ClassSpan> classes;

    private BraceStructure(List<MethodSpan> methods, List<ClassSpan> classes) {
        this.methods = List.copyOf(methods);
        this.classes = List.copyOf(classes);
    }

    /**
     * Analyzes the code lines of one file.
     *
     * @param lines non-comment lines in file order
     * @return structure of the file
     */
    public static BraceStructure analyze(List<SourceLine> lines) {
        List<MethodSpan> methods = new ArrayList<>();
        List<ClassSpan> classes = new ArrayList<>();
        Deque<Block> stack = new ArrayDeque<>();
        Pending pending = null;

        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            String code = stripLiterals(line.text());

            if (pending != null && i - pending.index() > SIGNATURE_LOOKAHEAD) {
                pending = null;
            }

            Matcher type = TYPE_DECLARATION.matcher(code);
            if (type.find()) {
                pending = new Pending(BlockKind.CLASS, type.group(1), line.lineNumber(), i);
            } else {
                Pending method = methodSignature(code, line.lineNumber(), i, stack.peek());
                if (method != null) {
                    pending = method;
                }
            }

            for (int c = 0; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == ';' && pending != null && pending.kind() == BlockKind.METHOD) {
                    // abstract or interface method: declaration without body
                    pending = null;
                } else if (ch == '{') {
                    if (pending != null) {
                        stack.push(new Block(pending.kind(), pending.name(), pending.lineNumber()));
                        pending = null;
                    } else {
                        stack.push(new Block(BlockKind.OTHER, null, line.lineNumber()));
                    }
                } else if (ch == '}' && !stack.isEmpty()) {
                    Block closed = stack.pop();
                    if (closed.kind() == BlockKind.METHOD) {
                        methods.add(new MethodSpan(closed.name(), closed.startLine(), line.lineNumber()));
                    } else if (closed.kind() == BlockKind.CLASS) {
                        classes.add(new ClassSpan(closed.name(), closed.startLine(), closed.publicMethods()));
                    }
                }
            }
        }

        // unbalanced input: report what is still open up to the last line
        int lastLine = lines.isEmpty() ? 0 : lines.get(lines.size() - 1).lineNumber();
        while (!stack.isEmpty()) {
            Block open = stack.pop();
            if (open.kind() == BlockKind.METHOD) {
                methods.add(new MethodSpan(open.name(), open.startLine(), lastLine));
            } else if (open.kind() == BlockKind.CLASS) {
                classes.add(new ClassSpan(open.name(), open.startLine(), open.publicMethods()));
            }
        }

        methods.sort((a, b) -> Integer.compare(a.startLine(), b.startLine()));
        classes.sort((a, b) -> Integer.compare(a.line(), b.line()));
        return new BraceStructure(methods, classes);
    }

    /**
     * Recognizes a method or constructor signature and counts public methods of the
     * enclosing class body.
     */
    private static Pending methodSignature(String code, int lineNumber, int index, Block enclosing) {
        String withoutAnnotations = LEADING_ANNOTATIONS.matcher(code).replaceFirst("");
        Matcher matcher = METHOD_SIGNATURE.matcher(withoutAnnotations);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(2);
        String beforeParen = withoutAnnotations.substring(0, matcher.end() - 1);
        if (NOT_A_METHOD.contains(name) || beforeParen.contains("=")
            || NOT_A_METHOD.contains(firstWord(withoutAnnotations))) {
            return null;
        }
        boolean declaresType = !matcher.group(1).isBlank() || beforeParen.trim().contains(" ");
        if (!declaresType) {
            // a bare call such as foo(x); has neither modifiers nor a return type
            return null;
        }

        if (enclosing != null && enclosing.kind() == BlockKind.CLASS) {
            boolean isPublic = matcher.group(1).contains("public");
            boolean isConstructor = name.equals(enclosing.name());
            if (isPublic && !isConstructor) {
                enclosing.countPublicMethod();
            }
        }
        return new Pending(BlockKind.METHOD, name, lineNumber, index);
    }

    private static String firstWord(String code) {
        String trimmed = code.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isJavaIdentifierPart(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end);
    }

    static String stripLiterals(String text) {
        String stripped = STRING_LITERAL.matcher(text).replaceAll("\"\"");
        stripped = CHAR_LITERAL.matcher(stripped).replaceAll("' '");
        int comment = stripped.indexOf("//");
        return comment >= 0 ? stripped.substring(0, comment) : stripped;
    }

    public List<MethodSpan> methods() {
        return methods;
    }

    public List<ClassSpan> classes() {
        return classes;
    }

    /**
     * A method or constructor body.
     *
     * @param name method name
     * @param startLine line of the signature
     * @param endLine line of the closing brace
     */
    public record MethodSpan(String name, int startLine, int endLine) {

        public int length() {
            return endLine - startLine + 1;
        }
    }

    /**
     * A class, interface, enum or record body.
     *
     * @param name type name
     * @param line line of the declaration
     * @param publicMethods public methods declared directly in the body
     */
    public record ClassSpan(String name, int line, int publicMethods) {
    }

    private enum BlockKind {
        CLASS, METHOD, OTHER
    }

    private record Pending(BlockKind kind, String name, int lineNumber, int index) {
    }

    private static final class Block {
        private final BlockKind kind;
        private final String name;
        private final int startLine;
        private int publicMethods;

        Block(BlockKind kind, String name, int startLine) {
            this.kind = kind;
            this.name = name;
            this.startLine = startLine;
        }

        BlockKind kind() {
            return kind;
        }

        String name() {
            return name;
        }

        int startLine() {
            return startLine;
        }

        int publicMethods() {
            return publicMethods;
        }

        void countPublicMethod() {
            publicMethods++;
        }
    }
}

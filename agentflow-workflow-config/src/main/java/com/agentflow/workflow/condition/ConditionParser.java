package com.agentflow.workflow.condition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent parser for route conditions. Grammar:
 * <pre>
 * expr       := andExpr ( "or" andExpr )*
 * andExpr    := notExpr ( "and" notExpr )*
 * notExpr    := "not" notExpr | comparison
 * comparison := operand ( ("==" | "!=" | "&gt;=" | "&lt;=" | "&gt;" | "&lt;") operand )?
 * operand    := "(" expr ")" | number | string | true | false | null | field
 * field      := [ "state." ] name ( "." key )*
 * </pre>
 * A comparison with an unset field is false; a bare operand tests truthiness.
 * Nothing outside this grammar is accepted, so conditions can never run arbitrary code.
 */
public final class ConditionParser {

    private static final String DEFAULT = "default";

    private final String source;
    private final List<Token> tokens;
    private int pos;

    private ConditionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    public static Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConditionSyntaxException(String.valueOf(expression), 0, "Empty condition");
        }
        if (DEFAULT.equals(expression.trim())) return Condition.ALWAYS;
        ConditionParser parser = new ConditionParser(expression);
        Node root = parser.parseOr();
        if (parser.pos < parser.tokens.size()) {
            Token t = parser.tokens.get(parser.pos);
            throw new ConditionSyntaxException(expression, t.position, "Unexpected '" + t.text + "'");
        }
        Set<String> fields = new LinkedHashSet<>();
        root.collectFields(fields);
        return new ParsedCondition(expression.trim(), root, Collections.unmodifiableSet(fields));
    }

    // ---- parser

    private Node parseOr() {
        Node left = parseAnd();
        while (acceptWord("or")) {
            Node right = parseAnd();
            Node l = left;
            left = new Node() {
                public Object eval(Map<String, Object> s) { return truthy(l.eval(s)) || truthy(right.eval(s)); }
                public void collectFields(Set<String> out) { l.collectFields(out); right.collectFields(out); }
            };
        }
        return left;
    }

    private Node parseAnd() {
        Node left = parseNot();
        while (acceptWord("and")) {
            Node right = parseNot();
            Node l = left;
            left = new Node() {
                public Object eval(Map<String, Object> s) { return truthy(l.eval(s)) && truthy(right.eval(s)); }
                public void collectFields(Set<String> out) { l.collectFields(out); right.collectFields(out); }
            };
        }
        return left;
    }

    private Node parseNot() {
        if (acceptWord("not")) {
            Node inner = parseNot();
            return new Node() {
                public Object eval(Map<String, Object> s) { return !truthy(inner.eval(s)); }
                public void collectFields(Set<String> out) { inner.collectFields(out); }
            };
        }
        return parseComparison();
    }

    private Node parseComparison() {
        Node left = parseOperand();
        Token t = peek();
        if (t != null && t.kind == Kind.OPERATOR) {
            pos++;
            Node right = parseOperand();
            String op = t.text;
            return new Node() {
                public Object eval(Map<String, Object> s) {
                    Object a = left.eval(s);
                    Object b = right.eval(s);
                    if ((left instanceof FieldNode && a == null) || (right instanceof FieldNode && b == null)) {
                        return false;
                    }
                    return compare(a, op, b);
                }
                public void collectFields(Set<String> out) { left.collectFields(out); right.collectFields(out); }
            };
        }
        return left;
    }

    private Node parseOperand() {
        Token t = peek();
        if (t == null) throw new ConditionSyntaxException(source, source.length(), "Unexpected end of condition");
        pos++;
        switch (t.kind) {
            case LPAREN: {
                Node inner = parseOr();
                Token close = peek();
                if (close == null || close.kind != Kind.RPAREN) {
                    throw new ConditionSyntaxException(source, close != null ? close.position : source.length(), "Expected ')'");
                }
                pos++;
                return inner;
            }
            case NUMBER:
                return constant(new BigDecimal(t.text));
            case STRING:
                return constant(t.text);
            case WORD: {
                String lower = t.text.toLowerCase(Locale.ROOT);
                if (lower.equals("true")) return constant(Boolean.TRUE);
                if (lower.equals("false")) return constant(Boolean.FALSE);
                if (lower.equals("null") || t.text.equals("None")) return constant(null);
                if (lower.equals("and") || lower.equals("or") || lower.equals("not")) {
                    throw new ConditionSyntaxException(source, t.position, "Unexpected '" + t.text + "'");
                }
                return field(t);
            }
            default:
                throw new ConditionSyntaxException(source, t.position, "Unexpected '" + t.text + "'");
        }
    }

    private Node field(Token t) {
        String path = t.text.startsWith("state.") ? t.text.substring("state.".length()) : t.text;
        if (path.isEmpty() || path.equals("state") || path.contains("__")) {
            throw new ConditionSyntaxException(source, t.position, "Invalid field reference '" + t.text + "'");
        }
        return new FieldNode(path.split("\\."));
    }

    private static Node constant(Object value) {
        return new Node() {
            public Object eval(Map<String, Object> s) { return value; }
            public void collectFields(Set<String> out) { }
        };
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private boolean acceptWord(String word) {
        Token t = peek();
        if (t != null && t.kind == Kind.WORD && t.text.equalsIgnoreCase(word)) {
            pos++;
            return true;
        }
        return false;
    }

    // ---- evaluation

    static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return toDecimal(n).signum() != 0;
        if (v instanceof String s) return !s.isEmpty();
        if (v instanceof Collection<?> c) return !c.isEmpty();
        if (v instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    static boolean compare(Object a, String op, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            int c = toDecimal(x).compareTo(toDecimal(y));
            return switch (op) {
                case "==" -> c == 0;
                case "!=" -> c != 0;
                case ">" -> c > 0;
                case "<" -> c < 0;
                case ">=" -> c >= 0;
                default -> c <= 0;
            };
        }
        if (op.equals("==")) return Objects.equals(a, b);
        if (op.equals("!=")) return !Objects.equals(a, b);
        if (a instanceof String x && b instanceof String y) {
            int c = x.compareTo(y);
            return switch (op) {
                case ">" -> c > 0;
                case "<" -> c < 0;
                case ">=" -> c >= 0;
                default -> c <= 0;
            };
        }
        // Ordering between values of different types never matches.
        return false;
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal d) return d;
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return BigDecimal.valueOf(n.longValue());
    }

    // ---- tokens

    private enum Kind { WORD, NUMBER, STRING, OPERATOR, LPAREN, RPAREN }

    private static final class Token {
        final Kind kind;
        final String text;
        final int position;

        Token(Kind kind, String text, int position) {
            this.kind = kind;
            this.text = text;
            this.position = position;
        }
    }

    private static List<Token> tokenize(String s) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                out.add(new Token(Kind.LPAREN, "(", i++));
            } else if (c == ')') {
                out.add(new Token(Kind.RPAREN, ")", i++));
            } else if (c == '"' || c == '\'') {
                int end = s.indexOf(c, i + 1);
                if (end < 0) throw new ConditionSyntaxException(s, i, "Unterminated string");
                out.add(new Token(Kind.STRING, s.substring(i + 1, end), i));
                i = end + 1;
            } else if (c == '=' || c == '!' || c == '<' || c == '>') {
                boolean twoChar = i + 1 < s.length() && s.charAt(i + 1) == '=';
                String op = twoChar ? s.substring(i, i + 2) : String.valueOf(c);
                if (op.equals("=") || op.equals("!")) throw new ConditionSyntaxException(s, i, "Unknown operator '" + op + "'");
                out.add(new Token(Kind.OPERATOR, op, i));
                i += op.length();
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
                int start = i++;
                while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) i++;
                String num = s.substring(start, i);
                try {
                    new BigDecimal(num);
                } catch (NumberFormatException e) {
                    throw new ConditionSyntaxException(s, start, "Invalid number '" + num + "'");
                }
                out.add(new Token(Kind.NUMBER, num, start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_' || s.charAt(i) == '.')) i++;
                out.add(new Token(Kind.WORD, s.substring(start, i), start));
            } else {
                throw new ConditionSyntaxException(s, i, "Unexpected character '" + c + "'");
            }
        }
        return out;
    }

    // ---- tree

    private interface Node {
        Object eval(Map<String, Object> state);

        void collectFields(Set<String> out);
    }

    private static final class FieldNode implements Node {
        private final String[] path;

        FieldNode(String[] path) {
            this.path = path;
        }

        @Override
        public Object eval(Map<String, Object> state) {
            Object current = state.get(path[0]);
            for (int i = 1; i < path.length && current != null; i++) {
                current = current instanceof Map<?, ?> m ? m.get(path[i]) : null;
            }
            return current;
        }

        @Override
        public void collectFields(Set<String> out) {
            out.add(path[0]);
        }
    }

    private static final class ParsedCondition implements Condition {
        private final String text;
        private final Node root;
        private final Set<String> fields;

        ParsedCondition(String text, Node root, Set<String> fields) {
            this.text = text;
            this.root = root;
            this.fields = fields;
        }

        @Override
        public boolean test(Map<String, Object> state) {
            return truthy(root.eval(state != null ? state : Map.of()));
        }

        @Override
        public Set<String> referencedFields() {
            return fields;
        }

        @Override
        public String toString() {
            return text;
        }
    }
}

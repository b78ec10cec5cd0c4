package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.parser.SourceText;
import org.treesitter.TSNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import static org.dxworks.phpast.ast.NodeFactory.children;
import static org.dxworks.phpast.parser.TreeSitterNodes.allChildren;
import static org.dxworks.phpast.parser.TreeSitterNodes.findFirstChild;
import static org.dxworks.phpast.parser.TreeSitterNodes.isTypeOneOf;

/**
 * Handlers for scalar literals and strings, including interpolated strings and heredocs.
 */
final class LiteralHandlers {

    private static final Pattern DECIMAL = Pattern.compile("[0-9]+");
    private static final Pattern HEX = Pattern.compile("[0-9a-f]+");
    private static final Pattern OCTAL = Pattern.compile("[0-7]*");
    private static final Pattern BINARY = Pattern.compile("[01]+");

    private static final String[] LITERAL_PARTS = {"string_content", "string_value", "escape_sequence", "text"};
    private static final String[] INTERPOLATION_TOKENS = {"{", "}", "${"};

    private LiteralHandlers() {
    }

    static void register(Map<String, NodeHandler> handlers) {
        handlers.put("integer", LiteralHandlers::integer);
        handlers.put("float", (node, session) -> parseFloat(session.text(node)));
        handlers.put("string", LiteralHandlers::string);
        handlers.put("encapsed_string", LiteralHandlers::encapsedString);
        handlers.put("heredoc", LiteralHandlers::heredoc);
        handlers.put("nowdoc", LiteralHandlers::nowdoc);
        handlers.put("shell_command_expression", LiteralHandlers::shellCommand);
        handlers.put("boolean", LiteralHandlers::namedConstant);
        handlers.put("null", LiteralHandlers::namedConstant);
    }

    // --- numbers ---

    private static Object integer(TSNode node, ConversionSession session) {
        Object value = parseInteger(session.text(node));
        return value != null ? value : session.stub(node);
    }

    /**
     * Decimal, hex, octal and binary integer literals. A value that does not fit a signed
     * 64-bit integer becomes a {@code Double}, as in PHP. Malformed digits give {@code null}.
     */
    static Object parseInteger(String raw) {
        String text = raw.trim().replace("_", "").toLowerCase(Locale.ROOT);
        int radix = 10;
        String digits = text;
        Pattern valid = DECIMAL;
        if (text.startsWith("0x")) {
            radix = 16;
            digits = text.substring(2);
            valid = HEX;
        } else if (text.startsWith("0b")) {
            radix = 2;
            digits = text.substring(2);
            valid = BINARY;
        } else if (text.startsWith("0o")) {
            radix = 8;
            digits = text.substring(2);
            valid = OCTAL;
        } else if (text.length() > 1 && text.startsWith("0")) {
            radix = 8;
            digits = text.substring(1);
            valid = OCTAL;
        }
        if (!valid.matcher(digits).matches()) return null;
        if (digits.isEmpty()) return 0L;

        BigInteger value = new BigInteger(digits, radix);
        if (value.bitLength() < 64) return value.longValue();
        return value.doubleValue();
    }

    static Double parseFloat(String raw) {
        return Double.parseDouble(raw.trim().replace("_", ""));
    }

    private static Object namedConstant(TSNode node, ConversionSession session) {
        int line = session.line(node);
        return session.factory().node(AstKind.CONST, 0,
                children("name", TypeFlagMapper.nameNode(session.text(node), line, session.factory())), line);
    }

    // --- strings ---

    private static Object string(TSNode node, ConversionSession session) {
        String text = stripBinaryPrefix(session.text(node));
        if (text.startsWith("\"")) {
            return unescapeDoubleQuoted(unquote(text), '"');
        }
        return unescapeSingleQuoted(unquote(text));
    }

    private static Object encapsedString(TSNode node, ConversionSession session) {
        List<TSNode> tokens = allChildren(node);
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (!tokens.isEmpty() && !tokens.get(0).isNamed()) start = tokens.get(0).getEndByte();
        if (tokens.size() > 1 && !tokens.get(tokens.size() - 1).isNamed()) end = tokens.get(tokens.size() - 1).getStartByte();
        return interpolated(node, tokens, start, end, '"', 0, session);
    }

    private static Object shellCommand(TSNode node, ConversionSession session) {
        List<TSNode> tokens = allChildren(node);
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (!tokens.isEmpty() && !tokens.get(0).isNamed()) start = tokens.get(0).getEndByte();
        if (tokens.size() > 1 && !tokens.get(tokens.size() - 1).isNamed()) end = tokens.get(tokens.size() - 1).getStartByte();
        Object command = interpolated(node, tokens, start, end, '`', 0, session);
        return session.factory().node(AstKind.SHELL_EXEC, 0, children("expr", command), session.line(node));
    }

    private static Object heredoc(TSNode node, ConversionSession session) {
        int[] bounds = heredocBounds(node, session.getSourceText());
        TSNode body = findFirstChild(node, "heredoc_body");
        List<TSNode> parts = body != null ? allChildren(body) : allChildren(node);
        int indent = closingIndent(node, session.getSourceText());
        return interpolated(node, parts, bounds[0], bounds[1], (char) 0, indent, session);
    }

    private static Object nowdoc(TSNode node, ConversionSession session) {
        SourceText text = session.getSourceText();
        int[] bounds = heredocBounds(node, text);
        return dedent(text.slice(bounds[0], bounds[1]), true, closingIndent(node, text));
    }

    /** Spaces and tabs before the closing label; that much is removed from every content line. */
    static int closingIndent(TSNode node, SourceText text) {
        TSNode closing = findFirstChild(node, "heredoc_end");
        if (closing == null) return 0;
        int lineStart = closing.getStartByte();
        while (lineStart > node.getStartByte() && text.byteAt(lineStart - 1) != '\n') lineStart--;
        int indent = 0;
        while (lineStart + indent < closing.getEndByte()
                && (text.byteAt(lineStart + indent) == ' ' || text.byteAt(lineStart + indent) == '\t')) {
            indent++;
        }
        return indent;
    }

    /** Removes up to {@code indent} leading blanks from each line that starts inside {@code run}. */
    static String dedent(String run, boolean atLineStart, int indent) {
        if (indent == 0 || run.isEmpty()) return run;
        StringBuilder result = new StringBuilder(run.length());
        boolean lineStart = atLineStart;
        int skipped = 0;
        for (int i = 0; i < run.length(); i++) {
            char c = run.charAt(i);
            if (lineStart && skipped < indent && (c == ' ' || c == '\t')) {
                skipped++;
                continue;
            }
            lineStart = c == '\n';
            skipped = 0;
            result.append(c);
        }
        return result.toString();
    }

    /**
     * The byte range of a heredoc's content: from the line after the opening label up to,
     * but not including, the line break before the closing label.
     */
    static int[] heredocBounds(TSNode node, SourceText text) {
        TSNode opening = findFirstChild(node, "heredoc_start");
        TSNode closing = findFirstChild(node, "heredoc_end");
        int start = opening != null ? opening.getEndByte() : node.getStartByte();
        int end = closing != null ? closing.getStartByte() : node.getEndByte();

        while (start < end && text.byteAt(start) != '\n') start++;
        if (start < end) start++;

        while (end > start && (text.byteAt(end - 1) == ' ' || text.byteAt(end - 1) == '\t')) end--;
        if (end > start && text.byteAt(end - 1) == '\n') end--;
        if (end > start && text.byteAt(end - 1) == '\r') end--;
        return new int[]{start, Math.max(start, end)};
    }

    /**
     * Splits the content range of an interpolating string into literal runs and embedded
     * expressions. Literal-only content is a plain string, anything else an
     * {@code AST_ENCAPS_LIST}.
     */
    private static Object interpolated(TSNode node, List<TSNode> children, int start, int end, char quote,
                                       int indent, ConversionSession session) {
        SourceText text = session.getSourceText();
        List<Object> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int position = start;

        for (TSNode child : children) {
            if (child.getEndByte() <= start || child.getStartByte() >= end) continue;
            if (child.isNamed() && isTypeOneOf(child.getType(), LITERAL_PARTS)) continue;
            if (!child.isNamed() && !isTypeOneOf(child.getType(), INTERPOLATION_TOKENS)) continue;

            literal.append(literalRun(text, start, position, child.getStartByte(), indent));
            position = child.getEndByte();
            if (!child.isNamed()) continue;

            flushLiteral(parts, literal, quote);
            ConversionSession.add(parts, session.expr(child));
        }
        literal.append(literalRun(text, start, position, end, indent));
        flushLiteral(parts, literal, quote);

        if (parts.isEmpty()) return "";
        if (parts.size() == 1 && parts.get(0) instanceof String) return parts.get(0);
        return session.factory().list(AstKind.ENCAPS_LIST, 0, parts, session.line(node));
    }

    private static String literalRun(SourceText text, int contentStart, int from, int to, int indent) {
        boolean atLineStart = from == contentStart || text.byteAt(from - 1) == '\n';
        return dedent(text.slice(from, to), atLineStart, indent);
    }

    private static void flushLiteral(List<Object> parts, StringBuilder literal, char quote) {
        if (literal.length() == 0) return;
        parts.add(unescapeDoubleQuoted(literal.toString(), quote));
        literal.setLength(0);
    }

    private static String stripBinaryPrefix(String text) {
        if (text.length() > 1 && (text.charAt(0) == 'b' || text.charAt(0) == 'B')) {
            return text.substring(1);
        }
        return text;
    }

    private static String unquote(String text) {
        if (text.length() < 2) return "";
        return text.substring(1, text.length() - 1);
    }

    /** Only {@code \\} and {@code \'} are escapes inside single quotes. */
    static String unescapeSingleQuoted(String body) {
        StringBuilder result = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length() && (body.charAt(i + 1) == '\\' || body.charAt(i + 1) == '\'')) {
                result.append(body.charAt(++i));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * Double-quote escapes. {@code quote} is the delimiter that may be escaped, or 0 for
     * heredocs where no delimiter escape exists. Unknown escapes keep their backslash.
     */
    static String unescapeDoubleQuoted(String body, char quote) {
        StringBuilder result = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                result.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            switch (next) {
                case 'n': result.append('\n'); i += 2; continue;
                case 't': result.append('\t'); i += 2; continue;
                case 'r': result.append('\r'); i += 2; continue;
                case 'v': result.append('\u000B'); i += 2; continue;
                case 'e': result.append('\u001B'); i += 2; continue;
                case 'f': result.append('\f'); i += 2; continue;
                case '\\': result.append('\\'); i += 2; continue;
                case '$': result.append('$'); i += 2; continue;
                default:
                    break;
            }
            if (quote != 0 && next == quote) {
                result.append(quote);
                i += 2;
            } else if (next >= '0' && next <= '7') {
                int j = i + 1;
                while (j < body.length() && j < i + 4 && body.charAt(j) >= '0' && body.charAt(j) <= '7') j++;
                result.append((char) (Integer.parseInt(body.substring(i + 1, j), 8) & 0xFF));
                i = j;
            } else if (next == 'x' && i + 2 < body.length() && isHexDigit(body.charAt(i + 2))) {
                int j = i + 2;
                while (j < body.length() && j < i + 4 && isHexDigit(body.charAt(j))) j++;
                result.append((char) Integer.parseInt(body.substring(i + 2, j), 16));
                i = j;
            } else if (next == 'u' && i + 2 < body.length() && body.charAt(i + 2) == '{') {
                int close = body.indexOf('}', i + 3);
                String hex = close < 0 ? "" : body.substring(i + 3, close);
                if (!hex.isEmpty() && HEX.matcher(hex.toLowerCase(Locale.ROOT)).matches()) {
                    result.appendCodePoint(Integer.parseInt(hex, 16));
                    i = close + 1;
                } else {
                    result.append(c);
                    i++;
                }
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}

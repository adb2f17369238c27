package io.hyperfoil.tools.select.parse;

import io.hyperfoil.tools.select.tree.Node;
import io.hyperfoil.tools.select.tree.SourceText;
import io.hyperfoil.tools.select.tree.Tag;
import io.hyperfoil.tools.select.tree.TokenKind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Clojure source into a lossless {@link Node} tree rooted at {@link Tag#FORMS}.
 * Whitespace, commas, line breaks and comments are kept as trivia nodes so that the tree
 * reproduces the source character for character.
 */
public final class SourceParser {

    private static final Pattern INT_PATTERN = Pattern.compile(
            "([-+]?)(?:(0)|([1-9][0-9]*)|0[xX]([0-9A-Fa-f]+)|0([0-7]+)|([1-9][0-9]?)[rR]([0-9A-Za-z]+)|0[0-9]+)(N)?");
    private static final Pattern RATIO_PATTERN = Pattern.compile("([-+]?[0-9]+)/([0-9]+)");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("([-+]?[0-9]+(\\.[0-9]*)?([eE][-+]?[0-9]+)?)(M)?");

    private static final String TERMINATORS = "\";@^`~()[]{}\\";

    private final SourceText source;
    private final String text;
    private final Deque<Frame> open = new ArrayDeque<>();
    private int offset;

    private SourceParser(String text) {
        this.source = new SourceText(text);
        this.text = text;
        this.offset = 0;
    }

    /**
     * Reads the whole text.
     *
     * @param text the source, never null
     * @return the {@link Tag#FORMS} root spanning all of {@code text}
     * @throws ParseException when the source is malformed or ends in the middle of a form
     */
    public static Node parse(String text) throws ParseException {
        return new SourceParser(text).readAll();
    }

    /**
     * Reads iteratively: every form still waiting for its content is a {@link Frame} on
     * {@link #open}, so nesting depth costs heap rather than call stack.
     */
    private Node readAll() throws ParseException {
        open.push(Frame.root());
        while (true) {
            Frame frame = open.peek();
            if (frame.isComplete()) {
                close(frame);
                continue;
            }
            if (atEnd()) {
                if (frame.tag == Tag.FORMS) {
                    return Node.branch(Tag.FORMS, source, 0, text.length(), frame.children);
                }
                throw frame.isDelimited()
                        ? error("Unexpected EOF while reading " + frame.tag + ", expected " + frame.closer)
                        : error("Unexpected EOF while reading " + frame.tag);
            }
            char c = peek();
            if (isCloser(c)) {
                if (frame.isDelimited() && c == frame.closer) {
                    offset++;
                    close(frame);
                    continue;
                }
                if (frame.tag == Tag.FORMS) {
                    throw error("Unmatched delimiter: " + c);
                }
                throw frame.isDelimited()
                        ? error("Unmatched delimiter: " + c + ", expected " + frame.closer)
                        : error("Unexpected " + c + " while reading " + frame.tag);
            }
            Node node = readNext();
            if (node != null) {
                frame.add(node);
            }
        }
    }

    private void close(Frame frame) {
        open.pop();
        open.peek().add(Node.branch(frame.tag, source, frame.start, offset, frame.children));
    }

    /**
     * Reads one leaf, or opens a frame for a form with content and returns null.
     */
    private Node readNext() throws ParseException {
        int start = offset;
        char c = peek();
        if (isLineBreak()) {
            return readLineBreaks(start);
        }
        if (c == ',') {
            while (!atEnd() && peek() == ',') {
                offset++;
            }
            return Node.leaf(Tag.COMMA, source, start, offset);
        }
        if (isWhitespace(c)) {
            while (!atEnd() && isWhitespace(peek()) && !isLineBreak()) {
                offset++;
            }
            return Node.leaf(Tag.WHITESPACE, source, start, offset);
        }
        switch (c) {
            case ';':
                return readComment(start);
            case '(':
                return openDelimited(Tag.LIST, start);
            case '[':
                return openDelimited(Tag.VECTOR, start);
            case '{':
                return openDelimited(Tag.MAP, start);
            case '"':
                return readString(start);
            case '\'':
                return openPrefixed(Tag.QUOTE, start, 1);
            case '`':
                return openPrefixed(Tag.SYNTAX_QUOTE, start, 1);
            case '~':
                return openPrefixed(peek(1) == '@' ? Tag.UNQUOTE_SPLICING : Tag.UNQUOTE, start, 1);
            case '@':
                return openPrefixed(Tag.DEREF, start, 1);
            case '^':
                return openPrefixed(Tag.META, start, 2);
            case '#':
                return readDispatch(start);
            case '\\':
                return readCharacter(start);
            case ':':
                return readKeyword(start, false);
            default:
                return readSymbolOrNumber(start);
        }
    }

    private Node readLineBreaks(int start) {
        while (!atEnd() && isLineBreak()) {
            offset += peek() == '\r' ? 2 : 1;
        }
        return Node.leaf(Tag.NEWLINE, source, start, offset);
    }

    private Node readComment(int start) {
        while (!atEnd() && !isLineBreak()) {
            offset++;
        }
        return Node.leaf(Tag.COMMENT, source, start, offset);
    }

    private Node openDelimited(Tag tag, int start) {
        offset += tag.getOpen().length();
        open.push(Frame.delimited(tag, start));
        return null;
    }

    private Node openPrefixed(Tag tag, int start, int formCount) {
        offset += tag.getOpen().length();
        open.push(Frame.prefixed(tag, start, formCount));
        return null;
    }

    private Node readDispatch(int start) throws ParseException {
        if (offset + 1 >= text.length()) {
            offset++;
            throw error("Unexpected EOF while reading dispatch macro");
        }
        char c = peek(1);
        switch (c) {
            case '{':
                return openDelimited(Tag.SET, start);
            case '(':
                return openDelimited(Tag.FN, start);
            case '"':
                return readRegex(start);
            case '^':
                return openPrefixed(Tag.META_STAR, start, 2);
            case '\'':
                return openPrefixed(Tag.VAR, start, 1);
            case '_':
                return openPrefixed(Tag.UNEVAL, start, 1);
            case '=':
                return openPrefixed(Tag.EVAL, start, 1);
            case '!':
                return readComment(start);
            case '#':
                return readSymbolicValue(start);
            case '?':
                return openReaderConditional(start);
            case ':':
                return openNamespacedMap(start);
            default:
                if (isTokenChar(c)) {
                    return openTaggedLiteral(start);
                }
                offset++;
                throw error("No dispatch macro for: " + c);
        }
    }

    private Node openReaderConditional(int start) {
        offset++;
        int dispatchStart = offset;
        offset++;
        if (!atEnd() && peek() == '@') {
            offset++;
        }
        Frame frame = Frame.prefixed(Tag.READER_MACRO, start, 1);
        String dispatch = text.substring(dispatchStart, offset);
        frame.children.add(Node.token(TokenKind.SYMBOL, dispatch, source, dispatchStart, offset));
        open.push(frame);
        return null;
    }

    private Node openTaggedLiteral(int start) throws ParseException {
        offset++;
        Frame frame = Frame.prefixed(Tag.READER_MACRO, start, 1);
        frame.children.add(readSymbolOrNumber(offset));
        open.push(frame);
        return null;
    }

    private Node openNamespacedMap(int start) throws ParseException {
        offset++;
        Frame frame = Frame.prefixed(Tag.NAMESPACED_MAP, start, 1);
        frame.children.add(readKeyword(offset, true));
        while (!atEnd() && (isWhitespace(peek()) || peek() == ',' || isLineBreak())) {
            frame.children.add(readNext());
        }
        if (atEnd() || peek() != '{') {
            throw error("Namespaced map must specify a map");
        }
        open.push(frame);
        return openDelimited(Tag.MAP, offset);
    }

    private Node readSymbolicValue(int start) throws ParseException {
        offset += 2;
        String name = readTokenText();
        switch (name) {
            case "Inf":
                return Node.token(TokenKind.NUMBER, Double.POSITIVE_INFINITY, source, start, offset);
            case "-Inf":
                return Node.token(TokenKind.NUMBER, Double.NEGATIVE_INFINITY, source, start, offset);
            case "NaN":
                return Node.token(TokenKind.NUMBER, Double.NaN, source, start, offset);
            default:
                throw error("Invalid symbolic value: ##" + name);
        }
    }

    private Node readString(int start) throws ParseException {
        offset++;
        StringBuilder buf = new StringBuilder();
        boolean multiLine = false;
        while (true) {
            if (atEnd()) {
                throw error("Unexpected EOF while reading string.");
            }
            char c = text.charAt(offset++);
            if (c == '"') {
                break;
            }
            if (c == '\n') {
                multiLine = true;
            }
            if (c == '\\') {
                readEscape(buf);
            } else {
                buf.append(c);
            }
        }
        String value = buf.toString();
        if (multiLine) {
            return Node.leaf(Tag.MULTI_LINE, value, source, start, offset);
        }
        return Node.token(TokenKind.STRING, value, source, start, offset);
    }

    private void readEscape(StringBuilder buf) throws ParseException {
        if (atEnd()) {
            throw error("Unexpected EOF while reading string.");
        }
        char c = text.charAt(offset++);
        switch (c) {
            case 'n':
                buf.append('\n');
                break;
            case 't':
                buf.append('\t');
                break;
            case 'r':
                buf.append('\r');
                break;
            case 'b':
                buf.append('\b');
                break;
            case 'f':
                buf.append('\f');
                break;
            case 'u':
                if (offset + 4 > text.length()) {
                    throw error("Unexpected EOF while reading string.");
                }
                buf.append(unicode(text.substring(offset, offset + 4)));
                offset += 4;
                break;
            default:
                buf.append(c);
                break;
        }
    }

    private Node readRegex(int start) throws ParseException {
        offset += 2;
        StringBuilder buf = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw error("Unexpected EOF while reading regex.");
            }
            char c = text.charAt(offset++);
            if (c == '"') {
                break;
            }
            buf.append(c);
            if (c == '\\') {
                if (atEnd()) {
                    throw error("Unexpected EOF while reading regex.");
                }
                buf.append(text.charAt(offset++));
            }
        }
        return Node.leaf(Tag.REGEX, buf.toString(), source, start, offset);
    }

    private Node readCharacter(int start) throws ParseException {
        offset++;
        if (atEnd()) {
            throw error("Unexpected EOF while reading character.");
        }
        offset++;
        readTokenText();
        String name = text.substring(start + 1, offset);
        return Node.token(TokenKind.CHARACTER, character(name), source, start, offset);
    }

    private Node readKeyword(int start, boolean allowEmpty) throws ParseException {
        offset++;
        if (!atEnd() && peek() == ':') {
            offset++;
        }
        String name = readTokenText();
        if (name.isEmpty() && !allowEmpty) {
            if (atEnd()) {
                throw error("Unexpected EOF while reading keyword.");
            }
            throw error("Invalid keyword: " + text.substring(start, offset));
        }
        return Node.token(TokenKind.KEYWORD, text.substring(start, offset), source, start, offset);
    }

    private Node readSymbolOrNumber(int start) throws ParseException {
        String token = readTokenText();
        if (token.isEmpty()) {
            throw error("Unexpected character: " + peek());
        }
        if (looksNumeric(token)) {
            return Node.token(TokenKind.NUMBER, number(token), source, start, offset);
        }
        return Node.token(TokenKind.SYMBOL, token, source, start, offset);
    }

    private String readTokenText() {
        int start = offset;
        while (!atEnd() && isTokenChar(peek())) {
            offset++;
        }
        return text.substring(start, offset);
    }

    private Number number(String token) throws ParseException {
        Matcher m = INT_PATTERN.matcher(token);
        if (m.matches()) {
            if (m.group(2) != null) {
                return m.group(8) != null ? BigInteger.ZERO : (Number) 0L;
            }
            String digits;
            int radix;
            if (m.group(3) != null) {
                digits = m.group(3);
                radix = 10;
            } else if (m.group(4) != null) {
                digits = m.group(4);
                radix = 16;
            } else if (m.group(5) != null) {
                digits = m.group(5);
                radix = 8;
            } else if (m.group(7) != null) {
                digits = m.group(7);
                radix = Integer.parseInt(m.group(6));
            } else {
                throw error("Invalid number: " + token);
            }
            BigInteger n;
            try {
                n = new BigInteger(digits, radix);
            } catch (NumberFormatException e) {
                throw error("Invalid number: " + token);
            }
            if ("-".equals(m.group(1))) {
                n = n.negate();
            }
            if (m.group(8) != null || n.bitLength() >= 64) {
                return n;
            }
            return n.longValue();
        }
        m = FLOAT_PATTERN.matcher(token);
        if (m.matches()) {
            if (m.group(4) != null) {
                return new BigDecimal(m.group(1));
            }
            return Double.parseDouble(token);
        }
        m = RATIO_PATTERN.matcher(token);
        if (m.matches()) {
            BigInteger denominator = new BigInteger(m.group(2));
            if (denominator.signum() == 0) {
                throw error("Divide by zero: " + token);
            }
            return new BigDecimal(new BigInteger(m.group(1))).doubleValue() / denominator.doubleValue();
        }
        throw error("Invalid number: " + token);
    }

    private Character character(String name) throws ParseException {
        if (name.length() == 1) {
            return name.charAt(0);
        }
        switch (name) {
            case "newline":
                return '\n';
            case "space":
                return ' ';
            case "tab":
                return '\t';
            case "backspace":
                return '\b';
            case "formfeed":
                return '\f';
            case "return":
                return '\r';
            default:
                break;
        }
        if (name.length() == 5 && name.charAt(0) == 'u') {
            return unicode(name.substring(1));
        }
        if (name.length() > 1 && name.length() <= 4 && name.charAt(0) == 'o') {
            try {
                return (char) Integer.parseInt(name.substring(1), 8);
            } catch (NumberFormatException e) {
                throw error("Invalid octal escape sequence: \\" + name);
            }
        }
        throw error("Unsupported character: \\" + name);
    }

    private char unicode(String hex) throws ParseException {
        try {
            return (char) Integer.parseInt(hex, 16);
        } catch (NumberFormatException e) {
            throw error("Invalid unicode escape: \\u" + hex);
        }
    }

    private static boolean looksNumeric(String token) {
        char c = token.charAt(0);
        if (Character.isDigit(c)) {
            return true;
        }
        return (c == '+' || c == '-') && token.length() > 1 && Character.isDigit(token.charAt(1));
    }

    private static boolean isTokenChar(char c) {
        return !isWhitespace(c) && c != '\n' && c != ',' && TERMINATORS.indexOf(c) < 0;
    }

    private static boolean isWhitespace(char c) {
        return c != '\n' && Character.isWhitespace(c);
    }

    private static boolean isCloser(char c) {
        return c == ')' || c == ']' || c == '}';
    }

    private boolean isLineBreak() {
        char c = peek();
        return c == '\n' || (c == '\r' && peek(1) == '\n');
    }

    private boolean atEnd() {
        return offset >= text.length();
    }

    private char peek() {
        return text.charAt(offset);
    }

    private char peek(int ahead) {
        int index = offset + ahead;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private ParseException error(String message) {
        return new ParseException(message, source.positionOf(Math.min(offset, text.length())));
    }

    /**
     * A form whose children are still being read. Delimited frames end at their closer,
     * prefixed frames after a fixed number of non-trivia children.
     */
    private static final class Frame {

        private final Tag tag;
        private final int start;
        private final char closer;
        private final int formCount;
        private final List<Node> children = new ArrayList<>();
        private int forms;

        private Frame(Tag tag, int start, char closer, int formCount) {
            this.tag = tag;
            this.start = start;
            this.closer = closer;
            this.formCount = formCount;
        }

        static Frame root() {
            return new Frame(Tag.FORMS, 0, '\0', -1);
        }

        static Frame delimited(Tag tag, int start) {
            return new Frame(tag, start, tag.getClose().charAt(0), -1);
        }

        static Frame prefixed(Tag tag, int start, int formCount) {
            return new Frame(tag, start, '\0', formCount);
        }

        boolean isDelimited() {
            return closer != '\0';
        }

        boolean isComplete() {
            return formCount >= 0 && forms >= formCount;
        }

        void add(Node node) {
            children.add(node);
            if (!node.isTrivia()) {
                forms++;
            }
        }
    }
}

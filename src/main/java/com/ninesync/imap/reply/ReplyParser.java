package com.ninesync.imap.reply;

import com.ninesync.exception.ImapParseException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for IMAP server replies.
 *
 * <p>Literal payloads ({@code {N}} followed by N raw bytes) are first folded
 * into quoted strings by {@link #unfoldLiterals(byte[])}; the resulting text
 * maps each received byte to one character (ISO-8859-1) so payload bytes can
 * be recovered exactly with {@link Atom#bytes()}.</p>
 *
 * <p>Tokens, left to right, skipping spaces:</p>
 * <ul>
 *   <li>{@code [} starts a bracketed attribute list closed by the matching
 *       {@code ]}; its contents are split into atoms</li>
 *   <li>{@code (} starts a nested list closed by the matching {@code )}</li>
 *   <li>{@code "} starts a quoted atom closed by the next unescaped {@code "}</li>
 *   <li>anything else is a bare atom up to the next space; a {@code [...]}
 *       section inside it (as in {@code BODY[HEADER.FIELDS (FROM)]}) is kept whole</li>
 * </ul>
 */
public final class ReplyParser {

    private ReplyParser() {}

    /**
     * Replace every {@code {N}} literal announcement and its N payload bytes with
     * an equivalent quoted string. Backslash and double quote are escaped; all
     * other bytes, line breaks included, are copied verbatim.
     */
    public static String unfoldLiterals(byte[] buffer) {
        StringBuilder out = new StringBuilder(buffer.length + 16);
        boolean inQuote = false;
        int i = 0;
        while (i < buffer.length) {
            char c = (char) (buffer[i] & 0xff);
            if (inQuote) {
                out.append(c);
                if (c == '\\' && i + 1 < buffer.length) {
                    out.append((char) (buffer[i + 1] & 0xff));
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    inQuote = false;
                }
                i++;
                continue;
            }
            if (c == '"') {
                inQuote = true;
                out.append(c);
                i++;
                continue;
            }
            if (c == '{') {
                long[] literal = literalHeader(buffer, i);
                if (literal != null) {
                    int start = (int) literal[0];
                    long length = literal[1];
                    if (start + length > buffer.length) {
                        throw new ImapParseException("Literal of " + length + " bytes truncated after "
                                + (buffer.length - start));
                    }
                    appendQuoted(out, buffer, start, (int) length);
                    i = start + (int) length;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Parse one response line. Literal announcements in the text are unfolded first.
     */
    public static ReplyTree parseReply(String rawText) {
        String text = rawText.indexOf('{') >= 0
                ? unfoldLiterals(rawText.getBytes(StandardCharsets.ISO_8859_1))
                : rawText;
        List<ReplyTree> lines = tokenize(text);
        if (lines.isEmpty()) {
            throw new ImapParseException("Empty reply");
        }
        return lines.get(0);
    }

    /**
     * Parse a whole response unit (untagged lines plus the tagged completion).
     */
    public static List<ReplyTree> parseUnit(byte[] unit) {
        return tokenize(unfoldLiterals(unit));
    }

    private static List<ReplyTree> tokenize(String text) {
        Cursor cursor = new Cursor(text);
        List<ReplyTree> lines = new ArrayList<>();
        while (!cursor.atEnd()) {
            List<ReplyToken> tokens = cursor.parseTokens((char) 0);
            if (!tokens.isEmpty()) {
                lines.add(new ReplyTree(tokens));
            }
        }
        return lines;
    }

    /**
     * @return {payloadStart, length} if a literal header ending a line starts at
     *         {@code pos}, otherwise null
     */
    private static long[] literalHeader(byte[] buffer, int pos) {
        int i = pos + 1;
        long length = 0;
        int digits = 0;
        while (i < buffer.length && buffer[i] >= '0' && buffer[i] <= '9') {
            length = length * 10 + (buffer[i] - '0');
            if (length > Integer.MAX_VALUE) {
                throw new ImapParseException("Literal too large");
            }
            digits++;
            i++;
        }
        if (digits == 0 || i >= buffer.length) {
            return null;
        }
        if (buffer[i] == '+') {
            i++;
        }
        if (i >= buffer.length || buffer[i] != '}') {
            return null;
        }
        i++;
        if (i < buffer.length && buffer[i] == '\r') {
            i++;
        }
        if (i >= buffer.length || buffer[i] != '\n') {
            return null;
        }
        return new long[]{i + 1, length};
    }

    private static void appendQuoted(StringBuilder out, byte[] buffer, int start, int length) {
        out.append('"');
        for (int k = start; k < start + length; k++) {
            char c = (char) (buffer[k] & 0xff);
            if (c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        out.append('"');
    }

    private static final class Cursor {

        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        /**
         * Read tokens until {@code terminator}, or until end of line when the
         * terminator is 0.
         */
        List<ReplyToken> parseTokens(char terminator) {
            List<ReplyToken> tokens = new ArrayList<>();
            while (true) {
                skipBlanks();
                if (atEnd() || text.charAt(pos) == '\n') {
                    if (terminator != 0) {
                        throw new ImapParseException("Unbalanced '" + opening(terminator) + "' in reply");
                    }
                    if (!atEnd()) {
                        pos++;
                    }
                    return tokens;
                }
                char c = text.charAt(pos);
                if (terminator != 0 && c == terminator) {
                    pos++;
                    return tokens;
                }
                switch (c) {
                    case '(' -> {
                        pos++;
                        tokens.add(new ListNode(parseTokens(')')));
                    }
                    case '[' -> tokens.add(parseAttrList());
                    case '"' -> tokens.add(new Atom(parseQuoted(), true));
                    case ')', ']' -> throw new ImapParseException("Unexpected '" + c + "' at offset " + pos);
                    default -> tokens.add(new Atom(parseBare(), false));
                }
            }
        }

        private void skipBlanks() {
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (c != ' ' && c != '\t' && c != '\r') {
                    return;
                }
                pos++;
            }
        }

        private AttrList parseAttrList() {
            int start = ++pos;
            int depth = 1;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\n') {
                    break;
                }
                if (c == '[') {
                    depth++;
                } else if (c == ']' && --depth == 0) {
                    String content = text.substring(start, pos++);
                    List<String> atoms = new ArrayList<>();
                    for (String atom : content.split("[\\s()]+")) {
                        if (!atom.isEmpty()) {
                            atoms.add(unquote(atom));
                        }
                    }
                    return new AttrList(atoms);
                }
                pos++;
            }
            throw new ImapParseException("Unbalanced '[' in reply");
        }

        private String parseQuoted() {
            StringBuilder sb = new StringBuilder();
            pos++;
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '\\' && pos < text.length()) {
                    sb.append(text.charAt(pos++));
                } else if (c == '"') {
                    return sb.toString();
                } else {
                    sb.append(c);
                }
            }
            throw new ImapParseException("Unterminated quoted string");
        }

        private String parseBare() {
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == ' ' || c == '\r' || c == '\n' || c == '(' || c == ')') {
                    break;
                }
                if (c == '[') {
                    int close = text.indexOf(']', pos);
                    int eol = text.indexOf('\n', pos);
                    if (close < 0 || (eol >= 0 && eol < close)) {
                        throw new ImapParseException("Unbalanced '[' in atom");
                    }
                    pos = close + 1;
                    continue;
                }
                if (c == ']') {
                    break;
                }
                pos++;
            }
            return text.substring(start, pos);
        }

        private static String unquote(String atom) {
            if (atom.length() >= 2 && atom.startsWith("\"") && atom.endsWith("\"")) {
                return atom.substring(1, atom.length() - 1);
            }
            return atom;
        }

        private static char opening(char terminator) {
            return terminator == ')' ? '(' : '[';
        }
    }
}

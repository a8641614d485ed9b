package com.ninesync.imap;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Received, not yet consumed server data of one session.
 *
 * <p>Data arrives as complete logical response lines (a line together with any
 * literal payloads it announces), so line boundaries recorded here never fall
 * inside a literal. Not thread-safe; {@link ImapSession} guards it.</p>
 */
public class ResponseBuffer {

    enum LineKind {
        UNTAGGED,
        CONTINUATION,
        TAGGED,
        OTHER
    }

    record Line(int start, int end, LineKind kind, String tag, String status) {

        Line shift(int delta) {
            return new Line(start - delta, end - delta, kind, tag, status);
        }
    }

    private byte[] data = new byte[4096];
    private int size;
    private final List<Line> lines = new ArrayList<>();

    public void append(byte[] line) {
        ensureCapacity(size + line.length);
        System.arraycopy(line, 0, data, size, line.length);
        lines.add(classify(line, size, size + line.length));
        size += line.length;
    }

    public int size() {
        return size;
    }

    public int lineCount() {
        return lines.size();
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Index of the completion line {@code <tag> OK|NO|BAD ...}, or -1.
     *
     * @param window 0 to rescan every buffered line; otherwise only lines ending
     *               within the trailing {@code window} bytes are examined
     */
    public int findTagged(String tag, int window) {
        int from = 0;
        if (window > 0 && size > window) {
            int limit = size - window;
            from = lines.size();
            while (from > 0 && lines.get(from - 1).end() > limit) {
                from--;
            }
        }
        for (int i = from; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line.kind() == LineKind.TAGGED && line.tag().equals(tag)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Byte offset where the response unit ending with the last buffered line
     * starts: the untagged lines directly preceding it belong to the same reply.
     */
    public int isolateLastResponseUnit() {
        if (lines.isEmpty()) {
            return 0;
        }
        return lines.get(unitStart(lines.size() - 1)).start();
    }

    /**
     * Remove and return the response unit completed by {@code tag}, or null if
     * its completion line has not arrived.
     */
    public byte[] takeResponseUnit(String tag) {
        int end = findTagged(tag, 0);
        if (end < 0) {
            return null;
        }
        return take(unitStart(end), end);
    }

    /** Status word of the buffered completion line for {@code tag}, or null. */
    public String statusOf(String tag) {
        int index = findTagged(tag, 0);
        return index >= 0 ? lines.get(index).status() : null;
    }

    public void clear() {
        lines.clear();
        size = 0;
    }

    @Override
    public String toString() {
        return new String(data, 0, size, StandardCharsets.ISO_8859_1);
    }

    private int unitStart(int completionIndex) {
        int first = completionIndex;
        while (first > 0 && lines.get(first - 1).kind() == LineKind.UNTAGGED) {
            first--;
        }
        return first;
    }

    private byte[] take(int firstLine, int lastLine) {
        int from = lines.get(firstLine).start();
        int to = lines.get(lastLine).end();
        byte[] unit = Arrays.copyOfRange(data, from, to);

        int removed = to - from;
        System.arraycopy(data, to, data, from, size - to);
        size -= removed;
        lines.subList(firstLine, lastLine + 1).clear();
        for (int i = firstLine; i < lines.size(); i++) {
            lines.set(i, lines.get(i).shift(removed));
        }
        return unit;
    }

    private void ensureCapacity(int needed) {
        if (needed > data.length) {
            data = Arrays.copyOf(data, Math.max(needed, data.length * 2));
        }
    }

    static Line classify(byte[] line, int start, int end) {
        if (line.length == 0) {
            return new Line(start, end, LineKind.OTHER, null, null);
        }
        if (line[0] == '*') {
            return new Line(start, end, LineKind.UNTAGGED, "*", null);
        }
        if (line[0] == '+') {
            return new Line(start, end, LineKind.CONTINUATION, "+", null);
        }
        int space = indexOf(line, (byte) ' ', 0);
        if (space <= 0) {
            return new Line(start, end, LineKind.OTHER, null, null);
        }
        int next = indexOf(line, (byte) ' ', space + 1);
        int statusEnd = next > 0 ? next : trimmedLength(line);
        if (statusEnd <= space + 1) {
            return new Line(start, end, LineKind.OTHER, null, null);
        }
        String tag = new String(line, 0, space, StandardCharsets.US_ASCII);
        String status = new String(line, space + 1, statusEnd - space - 1, StandardCharsets.US_ASCII)
                .toUpperCase(Locale.ROOT);
        if (status.equals("OK") || status.equals("NO") || status.equals("BAD")) {
            return new Line(start, end, LineKind.TAGGED, tag, status);
        }
        return new Line(start, end, LineKind.OTHER, null, null);
    }

    private static int indexOf(byte[] line, byte b, int from) {
        for (int i = from; i < line.length; i++) {
            if (line[i] == b) {
                return i;
            }
            if (line[i] == '\r' || line[i] == '\n') {
                return -1;
            }
        }
        return -1;
    }

    private static int trimmedLength(byte[] line) {
        int n = line.length;
        while (n > 0 && (line[n - 1] == '\r' || line[n - 1] == '\n')) {
            n--;
        }
        return n;
    }
}

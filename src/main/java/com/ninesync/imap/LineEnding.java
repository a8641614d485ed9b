package com.ninesync.imap;

/**
 * Command line terminator. AUTO follows whatever the server greeting used and
 * writes CRLF until the greeting has been seen.
 */
public enum LineEnding {
    AUTO("\r\n"),
    CRLF("\r\n"),
    LF("\n");

    private final String terminator;

    LineEnding(String terminator) {
        this.terminator = terminator;
    }

    public String terminator() {
        return terminator;
    }

    /** Terminator observed at the end of a received line. */
    public static LineEnding detect(byte[] line) {
        int n = line.length;
        if (n >= 2 && line[n - 2] == '\r' && line[n - 1] == '\n') {
            return CRLF;
        }
        return LF;
    }
}

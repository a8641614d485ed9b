package com.ninesync.imap;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Frames server output into logical response lines.
 *
 * <p>A physical line (split on CRLF or LF) that ends with a literal
 * announcement {@code {N}} is followed by exactly N raw bytes, after which the
 * same logical line continues. The decoder accumulates the line, every
 * announced payload and the continuation lines, and delivers the whole unit as
 * one {@code byte[]} with the original terminators intact. Payloads may arrive
 * split across any number of reads.</p>
 */
@Slf4j
public class ImapResponseDecoder extends ByteToMessageDecoder {

    private final int maxLineLength;

    // Logical line under construction
    private ByteBuf pending;
    private long literalBytesRemaining = 0;

    public ImapResponseDecoder(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    /**
     * Decode at most one logical line per call; Netty calls again while input
     * remains and the previous call made progress.
     */
    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (!in.isReadable()) {
            return;
        }
        if (pending == null) {
            pending = ctx.alloc().buffer();
        }

        if (literalBytesRemaining > 0) {
            int toRead = (int) Math.min(literalBytesRemaining, in.readableBytes());
            pending.writeBytes(in, toRead);
            literalBytesRemaining -= toRead;
            return; // yield back so callDecode can re-enter
        }

        decodeLine(in, out);
    }

    /**
     * Line mode: move one physical line, terminator included, into the pending
     * unit and emit the unit unless the line announces a literal.
     */
    private void decodeLine(ByteBuf in, List<Object> out) {
        int startIndex = in.readerIndex();
        int readableBytes = in.readableBytes();

        for (int i = 0; i < readableBytes; i++) {
            if (in.getByte(startIndex + i) != '\n') {
                continue;
            }
            int lineLength = i;
            boolean hasCR = lineLength > 0 && in.getByte(startIndex + lineLength - 1) == '\r';
            int textLength = hasCR ? lineLength - 1 : lineLength;

            if (textLength > maxLineLength) {
                // Advance past the bad frame so we can recover
                in.readerIndex(startIndex + i + 1);
                releasePending();
                throw new TooLongFrameException(
                        "IMAP response line length (" + textLength + ") exceeds " + maxLineLength);
            }

            long literal = literalLength(in, startIndex, textLength);
            pending.writeBytes(in, i + 1);

            if (literal >= 0) {
                literalBytesRemaining = literal;
                return;
            }

            byte[] unit = new byte[pending.readableBytes()];
            pending.readBytes(unit);
            releasePending();
            out.add(unit);
            return;
        }

        // No complete line yet - check if buffered data already exceeds max
        if (readableBytes > maxLineLength) {
            releasePending();
            throw new TooLongFrameException(
                    "IMAP response line length (" + readableBytes + ") exceeds " + maxLineLength);
        }
    }

    /**
     * Size announced by a trailing {@code {N}} on the line, or -1.
     */
    private static long literalLength(ByteBuf in, int start, int textLength) {
        if (textLength < 3 || in.getByte(start + textLength - 1) != '}') {
            return -1;
        }
        int i = start + textLength - 2;
        if (in.getByte(i) == '+') {
            i--;
        }
        long value = 0;
        long multiplier = 1;
        int digits = 0;
        while (i >= start && Character.isDigit(in.getByte(i))) {
            value += (in.getByte(i) - '0') * multiplier;
            multiplier *= 10;
            digits++;
            i--;
        }
        if (digits == 0 || digits > 10 || i < start || in.getByte(i) != '{') {
            return -1;
        }
        return value;
    }

    private void releasePending() {
        literalBytesRemaining = 0;
        if (pending != null) {
            pending.release();
            pending = null;
        }
    }

    @Override
    protected void handlerRemoved0(ChannelHandlerContext ctx) {
        releasePending();
    }
}

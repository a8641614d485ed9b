package com.ninesync.imap;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Hands decoded response lines to the owning {@link ImapSession}.
 */
@Slf4j
public class ImapClientHandler extends SimpleChannelInboundHandler<byte[]> {

    private static final int LOG_LIMIT = 200;

    private final ImapSession session;

    public ImapClientHandler(ImapSession session) {
        this.session = session;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, byte[] line) {
        if (log.isDebugEnabled()) {
            log.debug("IMAP << {}", abbreviate(line));
        }
        session.onResponseLine(line);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        log.info("IMAP connection closed: {}", session);
        session.onClosed();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        String msg = cause.getMessage();
        if (cause instanceof javax.net.ssl.SSLHandshakeException
                || (cause.getCause() != null && cause.getCause() instanceof javax.net.ssl.SSLHandshakeException)) {
            log.warn("IMAP TLS handshake failed with {}: {}", session, msg);
        } else if ("Connection reset".equals(msg) || cause instanceof java.io.IOException) {
            log.debug("IMAP connection reset by {}: {}", session, msg);
        } else {
            log.error("IMAP error on {}: {}", session, msg);
        }
        ctx.close();
    }

    private static String abbreviate(byte[] line) {
        int end = line.length;
        while (end > 0 && (line[end - 1] == '\r' || line[end - 1] == '\n')) {
            end--;
        }
        if (end > LOG_LIMIT) {
            return new String(line, 0, LOG_LIMIT, StandardCharsets.ISO_8859_1) + "... (" + line.length + " bytes)";
        }
        return new String(line, 0, end, StandardCharsets.ISO_8859_1);
    }
}

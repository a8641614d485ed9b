package com.ninesync.imap;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * IMAP client Netty channel initializer
 */
@Slf4j
@RequiredArgsConstructor
public class ImapClientInitializer extends ChannelInitializer<SocketChannel> {

    private final ImapSession session;
    private final SslContext sslContext;
    private final int maxLineLength;

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();

        // Implicit TLS (port 993)
        if (session.getTransport() == TransportKind.TLS) {
            SslHandler sslHandler = sslContext.newHandler(ch.alloc(), session.getHost(), session.getPort());
            pipeline.addLast("ssl", sslHandler);
            sslHandler.handshakeFuture().addListener(future -> {
                if (future.isSuccess()) {
                    log.info("IMAPS TLS handshake completed with {}", session);
                } else {
                    log.warn("IMAPS TLS handshake failed with {}: {}", session, future.cause().getMessage());
                }
            });
        }

        pipeline.addLast("decoder", new ImapResponseDecoder(maxLineLength));
        pipeline.addLast("encoder", new StringEncoder(StandardCharsets.UTF_8));
        pipeline.addLast("handler", new ImapClientHandler(session));
    }
}

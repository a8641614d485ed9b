package com.ninesync.service;

import com.ninesync.config.ClientProperties;
import com.ninesync.exception.ImapAuthenticationException;
import com.ninesync.exception.ImapClientException;
import com.ninesync.exception.ImapTransportException;
import com.ninesync.imap.CommandDispatcher;
import com.ninesync.imap.CommandResult;
import com.ninesync.imap.ImapClientInitializer;
import com.ninesync.imap.ImapSession;
import com.ninesync.imap.TransportKind;
import com.ninesync.imap.reply.ReplyTree;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens, reuses and closes sessions.
 *
 * <p>Opening is two-phase. The probe connects with the configured transport,
 * reads the greeting and the capabilities. Then, for a plain connection whose
 * server advertises STARTTLS, a second secured session is attempted and
 * replaces the probe only if it comes up; otherwise the probe continues.
 * Login happens only after this decision, on the session that will be kept.</p>
 */
@Slf4j
@Service
public class SessionManager {

    private final ClientProperties properties;
    private final CommandDispatcher dispatcher;
    private final SessionRegistry registry;
    private final CredentialStore credentialStore;
    private final EventLoopGroup group;
    private final SslContext sslContext;
    private final Clock clock;
    private final Map<String, Object> openLocks = new ConcurrentHashMap<>();

    public SessionManager(ClientProperties properties,
                          CommandDispatcher dispatcher,
                          SessionRegistry registry,
                          CredentialStore credentialStore,
                          EventLoopGroup group,
                          SslContext sslContext,
                          Clock clock) {
        this.properties = properties;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.credentialStore = credentialStore;
        this.group = group;
        this.sslContext = sslContext;
        this.clock = clock;
    }

    public ImapSession open(String serverName) {
        ClientProperties.Server server = properties.server(serverName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown server: " + serverName));
        return open(server);
    }

    /**
     * Live session for the server, opened and authenticated if needed.
     *
     * @throws ImapTransportException      connect, TLS or greeting failure
     * @throws ImapAuthenticationException login refused or no credentials
     */
    public ImapSession open(ClientProperties.Server server) {
        synchronized (openLocks.computeIfAbsent(server.getName(), name -> new Object())) {
            ImapSession existing = registry.get(server.getName());
            if (existing != null) {
                return existing;
            }
            return establish(server);
        }
    }

    private ImapSession establish(ClientProperties.Server server) {

        ImapSession session = probe(server, server.getTransport());
        if (server.getTransport() == TransportKind.PLAIN && server.isUpgrade() && session.hasCapability("STARTTLS")) {
            session = upgradeOrContinue(server, session);
        }

        try {
            if (!session.isPreauthenticated()) {
                login(server, session);
            }
            session.authenticated();
            refreshCapabilities(session);
            if (session.hasCapability("QRESYNC")) {
                CommandResult enabled = dispatcher.runCommand(session, "ENABLE QRESYNC");
                if (enabled.ok()) {
                    session.qresyncEnabled();
                }
            }
        } catch (ImapClientException e) {
            disconnect(session);
            throw e;
        }

        ImapSession previous = registry.register(session);
        if (previous != null && previous != session) {
            close(previous);
        }
        log.info("IMAP session ready: {} (tls={}, qresync={})", session, session.isTlsActive(), session.isQresyncEnabled());
        return session;
    }

    /** LOGOUT and close. Safe to call on closed or already closed sessions. */
    public void close(ImapSession session) {
        if (session == null) {
            return;
        }
        registry.unregister(session);
        if (session.isOpen() && session.channel() != null) {
            try {
                dispatcher.runCommand(session, "LOGOUT");
            } catch (ImapClientException e) {
                log.debug("LOGOUT on {} did not complete: {}", session, e.getMessage());
            }
        }
        disconnect(session);
    }

    /**
     * Connect, read the greeting and query capabilities. For STARTTLS transport
     * the TLS layer is negotiated before the capability query.
     */
    ImapSession probe(ClientProperties.Server server, TransportKind transport) {
        ImapSession session = new ImapSession(server.getName(), server.getHost(), server.getPort(),
                transport, server.getLineEnding(), clock);
        connect(session);
        try {
            String greeting = awaitGreeting(session);
            if (greeting.toUpperCase(Locale.ROOT).startsWith("* BYE")) {
                throw new ImapTransportException(session.getServerName(), transport, "server refused connection: " + greeting);
            }
            session.greeted();
            log.info("Connected to {}: {}", session, greeting);

            if (transport == TransportKind.STARTTLS) {
                startTls(session);
            }
            refreshCapabilities(session);
            return session;
        } catch (ImapClientException e) {
            disconnect(session);
            throw e;
        }
    }

    private ImapSession upgradeOrContinue(ClientProperties.Server server, ImapSession insecure) {
        ImapSession secured;
        try {
            secured = probe(server, TransportKind.STARTTLS);
        } catch (ImapClientException e) {
            log.warn("STARTTLS upgrade for {} failed, continuing unencrypted: {}", server.getName(), e.getMessage());
            return insecure;
        }
        log.info("Upgraded {} to TLS, dropping the unencrypted connection", server.getName());
        close(insecure);
        return secured;
    }

    private void connect(ImapSession session) {
        long connectTimeout = properties.getImap().getConnectTimeout();
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ImapClientInitializer(session, sslContext, properties.getImap().getMaxLineLength()));

        ChannelFuture future = bootstrap.connect(session.getHost(), session.getPort());
        if (!future.awaitUninterruptibly(connectTimeout) || !future.isSuccess()) {
            future.channel().close();
            Throwable cause = future.cause();
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "connect to " + session.getHost() + ":" + session.getPort() + " failed"
                            + (cause != null ? ": " + cause.getMessage() : " (timeout)"), cause);
        }
        Channel channel = future.channel();
        session.attach(channel);

        SslHandler ssl = channel.pipeline().get(SslHandler.class);
        if (ssl != null) {
            awaitHandshake(session, ssl.handshakeFuture());
        }
    }

    private void startTls(ImapSession session) {
        CommandResult result = dispatcher.runCommand(session, "STARTTLS");
        if (!result.ok()) {
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "STARTTLS refused: " + result.status() + " " + result.statusText());
        }
        Channel channel = session.channel();
        SslHandler ssl = sslContext.newHandler(channel.alloc(), session.getHost(), session.getPort());
        channel.pipeline().addFirst("ssl", ssl);
        awaitHandshake(session, ssl.handshakeFuture());
        log.info("STARTTLS negotiated with {}", session);
    }

    private void awaitHandshake(ImapSession session, Future<Channel> handshake) {
        if (!handshake.awaitUninterruptibly(properties.getImap().getConnectTimeout()) || !handshake.isSuccess()) {
            Throwable cause = handshake.cause();
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "TLS handshake failed" + (cause != null ? ": " + cause.getMessage() : " (timeout)"), cause);
        }
        session.tlsStarted();
    }

    private String awaitGreeting(ImapSession session) {
        String greeting;
        try {
            greeting = session.awaitGreeting(Duration.ofMillis(properties.getImap().getConnectTimeout()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "interrupted while waiting for greeting", e);
        }
        if (greeting == null) {
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "connection closed before greeting");
        }
        return greeting;
    }

    private void login(ClientProperties.Server server, ImapSession session) {
        List<String> ports = List.of(String.valueOf(server.getPort()),
                server.getTransport() == TransportKind.TLS ? "imaps" : "imap");
        Credentials credentials = credentialStore.lookup(server.getHost(), ports)
                .orElseThrow(() -> new ImapAuthenticationException(server.getName(),
                        "no credentials for " + server.getHost() + ":" + server.getPort()));

        CommandResult result = dispatcher.login(session, credentials.user(), credentials.secret());
        if (!result.ok()) {
            credentialStore.forget(server.getHost(), server.getPort());
            throw new ImapAuthenticationException(server.getName(),
                    "LOGIN rejected for " + credentials.user() + ": " + result.status() + " " + result.statusText());
        }
        log.info("Logged in to {} as {}", session, credentials.user());
    }

    private void refreshCapabilities(ImapSession session) {
        CommandResult result = dispatcher.runChecked(session, "CAPABILITY");
        Set<String> capabilities = new LinkedHashSet<>();
        for (ReplyTree reply : result.untagged("CAPABILITY")) {
            for (int i = 2; i < reply.size(); i++) {
                String capability = reply.text(i);
                if (capability != null) {
                    capabilities.add(capability);
                }
            }
        }
        session.setCapabilities(capabilities);
        log.debug("Capabilities of {}: {}", session, capabilities);
    }

    private void disconnect(ImapSession session) {
        Channel channel = session.channel();
        if (channel != null) {
            channel.close().awaitUninterruptibly(properties.getImap().getConnectTimeout());
        }
        session.onClosed();
    }
}

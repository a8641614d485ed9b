package com.ninesync.service;

import com.ninesync.config.ClientProperties;
import com.ninesync.exception.ImapClientException;
import com.ninesync.imap.CommandDispatcher;
import com.ninesync.imap.ImapSession;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions by server name, at most one per server, plus the keepalive
 * sweep that keeps idle sessions from being timed out by the server.
 */
@Slf4j
@Component
public class SessionRegistry {

    private final Map<String, ImapSession> sessions = new ConcurrentHashMap<>();
    private final ClientProperties properties;
    private final CommandDispatcher dispatcher;
    private final Clock clock;

    private Disposable keepalive;

    public SessionRegistry(ClientProperties properties, CommandDispatcher dispatcher, Clock clock) {
        this.properties = properties;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        Duration interval = Duration.ofMillis(properties.getImap().getKeepaliveInterval());
        keepalive = Flux.interval(interval, interval, Schedulers.boundedElastic())
                .subscribe(tick -> sweep(clock.instant()),
                        e -> log.error("Keepalive sweep stopped: {}", e.getMessage(), e));
        log.info("IMAP keepalive sweep every {}s (idle threshold {}s)",
                interval.toSeconds(), properties.getImap().getKeepaliveIdle() / 1000);
    }

    @PreDestroy
    public void stop() {
        if (keepalive != null) {
            keepalive.dispose();
        }
    }

    /** Live session for the server, or null. */
    public ImapSession get(String serverName) {
        ImapSession session = sessions.get(serverName);
        if (session != null && !session.isOpen()) {
            sessions.remove(serverName, session);
            return null;
        }
        return session;
    }

    /**
     * @return the session previously registered for the same server, or null
     */
    public ImapSession register(ImapSession session) {
        return sessions.put(session.getServerName(), session);
    }

    public void unregister(ImapSession session) {
        sessions.remove(session.getServerName(), session);
    }

    public List<ImapSession> sessions() {
        return new ArrayList<>(sessions.values());
    }

    /**
     * Send a detached NOOP on every live session idle longer than the
     * configured threshold; drop sessions whose stream has closed.
     *
     * @return number of sessions probed
     */
    public int sweep(Instant now) {
        Duration idle = Duration.ofMillis(properties.getImap().getKeepaliveIdle());
        int probed = 0;
        for (ImapSession session : sessions()) {
            if (!session.isOpen()) {
                unregister(session);
                continue;
            }
            if (session.idleTime(now).compareTo(idle) <= 0) {
                continue;
            }
            try {
                dispatcher.sendDetached(session, "NOOP");
                probed++;
            } catch (ImapClientException e) {
                log.warn("Keepalive failed on {}: {}", session, e.getMessage());
                unregister(session);
            }
        }
        if (probed > 0) {
            log.info("Keepalive sent to {} idle session(s)", probed);
        }
        return probed;
    }
}

package com.ninesync.imap;

import com.ninesync.domain.MailboxState;
import com.ninesync.exception.ImapTransportException;
import io.netty.channel.Channel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * State of one connection to an IMAP server.
 *
 * <p>The owning task issues commands and awaits their completions; the Netty
 * event loop delivers received lines through {@link #onResponseLine(byte[])}.
 * Both sides meet on this object's monitor.</p>
 */
@Slf4j
public class ImapSession {

    @Getter
    private final String serverName;
    @Getter
    private final String host;
    @Getter
    private final int port;
    @Getter
    private final TransportKind transport;

    private final Clock clock;
    private final ResponseBuffer buffer = new ResponseBuffer();
    private final Map<String, PendingCommand> pending = new LinkedHashMap<>();
    private final Map<String, String> completions = new HashMap<>();
    private final Map<String, PendingCommand> completed = new HashMap<>();
    private final Map<String, MailboxState> mailboxes = new HashMap<>();

    private Channel channel;
    private LineEnding lineEnding;
    private ImapState state = ImapState.CONNECTING;
    private Set<String> capabilities = Collections.emptySet();
    private String selectedMailbox;
    private long sequence;
    private Instant lastCommandTime;
    private String greeting;
    private boolean closed;
    private boolean tlsActive;
    private boolean qresyncEnabled;
    private boolean continuationRequested;

    public ImapSession(String serverName, String host, int port, TransportKind transport,
                       LineEnding lineEnding, Clock clock) {
        this.serverName = serverName;
        this.host = host;
        this.port = port;
        this.transport = transport;
        this.lineEnding = lineEnding;
        this.clock = clock;
        this.lastCommandTime = clock.instant();
        this.tlsActive = transport == TransportKind.TLS;
    }

    public synchronized void attach(Channel channel) {
        this.channel = channel;
    }

    public synchronized Channel channel() {
        return channel;
    }

    // ================================================================
    // Command side
    // ================================================================

    /**
     * Write {@code <tag> <command>} and register it as pending.
     *
     * @return the tag, one more than the previous tag on this session
     */
    public synchronized String issue(String command, String kind, boolean detached) {
        if (closed || channel == null) {
            throw new ImapTransportException(serverName, transport, "connection is closed");
        }
        String tag = Long.toString(++sequence);
        Instant now = clock.instant();
        pending.put(tag, new PendingCommand(tag, command, kind, detached, now));
        lastCommandTime = now;
        channel.writeAndFlush(tag + " " + command + terminator());
        return tag;
    }

    /**
     * Write {@code <tag> <command> <literal>} with the last argument sent as a
     * literal. Without LITERAL+ the literal is synchronizing: the payload is
     * written only after the server's continuation request. If the server
     * completes the command instead, the payload is never written.
     *
     * @return the tag; its completion is awaited as for {@link #issue}
     */
    public synchronized String issueLiteral(String command, String literal, String kind, Duration timeout)
            throws InterruptedException {
        if (closed || channel == null) {
            throw new ImapTransportException(serverName, transport, "connection is closed");
        }
        String tag = Long.toString(++sequence);
        Instant now = clock.instant();
        pending.put(tag, new PendingCommand(tag, command, kind, false, now));
        lastCommandTime = now;
        int length = literal.getBytes(StandardCharsets.UTF_8).length;
        if (hasCapability("LITERAL+")) {
            channel.writeAndFlush(tag + " " + command + " {" + length + "+}" + terminator() + literal + terminator());
            return tag;
        }

        continuationRequested = false;
        channel.writeAndFlush(tag + " " + command + " {" + length + "}" + terminator());
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!continuationRequested) {
            if (closed || !pending.containsKey(tag)) {
                return tag;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                abandon(tag);
                throw new ImapTransportException(serverName, transport,
                        "no continuation for tag " + tag + " within " + timeout.toMillis() + "ms");
            }
            wait(Math.max(1, remaining / 1_000_000));
        }
        continuationRequested = false;
        channel.writeAndFlush(literal + terminator());
        return tag;
    }

    /**
     * Block until the completion line for {@code tag} has been received.
     * On timeout the tag is abandoned: its late reply is discarded on arrival.
     *
     * @param window trailing byte window searched for the completion line, 0 for all
     * @return false if the stream closed first
     */
    public synchronized boolean awaitTag(String tag, Duration timeout, int window) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (completions.containsKey(tag) || buffer.findTagged(tag, window) >= 0) {
                return true;
            }
            if (closed) {
                return false;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                abandon(tag);
                throw new ImapTransportException(serverName, transport,
                        "no completion for tag " + tag + " within " + timeout.toMillis() + "ms");
            }
            wait(Math.max(1, remaining / 1_000_000));
        }
    }

    /**
     * Remove and return the response unit completed by {@code tag}; null when
     * the completion has not arrived.
     */
    public synchronized byte[] takeResponseUnit(String tag) {
        byte[] unit = buffer.takeResponseUnit(tag);
        if (unit != null) {
            completions.remove(tag);
            completed.remove(tag);
        }
        return unit;
    }

    /** OK, NO or BAD once the completion for {@code tag} has arrived, else null. */
    public synchronized String completionStatus(String tag) {
        String status = completions.get(tag);
        return status != null ? status : buffer.statusOf(tag);
    }

    /** Kind recorded when {@code tag} was issued, while it is pending or unconsumed; else null. */
    public synchronized String commandKind(String tag) {
        PendingCommand command = pending.get(tag);
        if (command == null) {
            command = completed.get(tag);
        }
        return command != null ? command.kind() : null;
    }

    public synchronized boolean isPending(String tag) {
        return pending.containsKey(tag);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    /** Received lines not yet taken by any command. */
    public synchronized int bufferedLines() {
        return buffer.lineCount();
    }

    private void abandon(String tag) {
        if (pending.remove(tag) != null) {
            log.warn("Abandoned tag {} on {}", tag, serverName);
        }
    }

    // ================================================================
    // Event loop side
    // ================================================================

    /**
     * One complete logical response line, literal payloads included.
     */
    public synchronized void onResponseLine(byte[] line) {
        if (greeting == null) {
            greeting = new String(line, StandardCharsets.ISO_8859_1).trim();
            if (lineEnding == LineEnding.AUTO) {
                lineEnding = LineEnding.detect(line);
            }
            notifyAll();
            return;
        }
        ResponseBuffer.Line parsed = ResponseBuffer.classify(line, 0, line.length);
        if (parsed.kind() == ResponseBuffer.LineKind.CONTINUATION) {
            continuationRequested = true;
            notifyAll();
            return;
        }
        buffer.append(line);
        if (parsed.kind() == ResponseBuffer.LineKind.TAGGED) {
            PendingCommand command = pending.remove(parsed.tag());
            if (command == null) {
                log.warn("Completion for unknown tag {} from {}, discarding its reply", parsed.tag(), serverName);
                buffer.takeResponseUnit(parsed.tag());
            } else if (command.detached()) {
                buffer.takeResponseUnit(parsed.tag());
            } else {
                completions.put(parsed.tag(), parsed.status());
                completed.put(parsed.tag(), command);
            }
        }
        notifyAll();
    }

    public synchronized void onClosed() {
        if (!closed) {
            closed = true;
            state = ImapState.LOGOUT;
            selectedMailbox = null;
            notifyAll();
        }
    }

    /**
     * Block until the server greeting arrives.
     *
     * @return the greeting line, or null if the stream closed first
     */
    public synchronized String awaitGreeting(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (greeting == null && !closed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new ImapTransportException(serverName, transport, "no greeting within " + timeout.toMillis() + "ms");
            }
            wait(Math.max(1, remaining / 1_000_000));
        }
        return greeting;
    }

    // ================================================================
    // Session attributes
    // ================================================================

    public synchronized boolean isOpen() {
        return !closed;
    }

    public synchronized String getGreeting() {
        return greeting;
    }

    public synchronized boolean isPreauthenticated() {
        return greeting != null && greeting.toUpperCase(Locale.ROOT).startsWith("* PREAUTH");
    }

    public synchronized Set<String> getCapabilities() {
        return capabilities;
    }

    public synchronized void setCapabilities(Set<String> capabilities) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String capability : capabilities) {
            normalized.add(capability.toUpperCase(Locale.ROOT));
        }
        this.capabilities = Collections.unmodifiableSet(normalized);
    }

    public synchronized boolean hasCapability(String capability) {
        return capabilities.contains(capability.toUpperCase(Locale.ROOT));
    }

    public synchronized ImapState getState() {
        return state;
    }

    public synchronized void authenticated() {
        if (!closed) {
            state = ImapState.AUTHENTICATED;
        }
    }

    public synchronized void greeted() {
        if (!closed && state == ImapState.CONNECTING) {
            state = isPreauthenticated() ? ImapState.AUTHENTICATED : ImapState.NOT_AUTHENTICATED;
        }
    }

    public synchronized String getSelectedMailbox() {
        return selectedMailbox;
    }

    /** Record the selected mailbox, replacing any previous selection. */
    public synchronized void selected(String mailbox) {
        selectedMailbox = mailbox;
        state = mailbox != null ? ImapState.SELECTED : ImapState.AUTHENTICATED;
    }

    public synchronized Instant getLastCommandTime() {
        return lastCommandTime;
    }

    public synchronized Duration idleTime(Instant now) {
        return Duration.between(lastCommandTime, now);
    }

    public synchronized long getSequence() {
        return sequence;
    }

    public synchronized LineEnding getLineEnding() {
        return lineEnding;
    }

    public synchronized boolean isTlsActive() {
        return tlsActive;
    }

    public synchronized void tlsStarted() {
        tlsActive = true;
    }

    public synchronized boolean isQresyncEnabled() {
        return qresyncEnabled;
    }

    public synchronized void qresyncEnabled() {
        qresyncEnabled = true;
    }

    /** Local mirror of the mailbox as last observed on this session, or null. */
    public synchronized MailboxState mailbox(String name) {
        return mailboxes.get(name);
    }

    public synchronized void mailbox(MailboxState state) {
        mailboxes.put(state.getName(), state);
    }

    public Clock clock() {
        return clock;
    }

    private String terminator() {
        return lineEnding.terminator();
    }

    @Override
    public String toString() {
        return serverName + "(" + host + ":" + port + ", " + transport + ")";
    }
}

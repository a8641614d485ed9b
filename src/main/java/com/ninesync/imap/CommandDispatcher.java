package com.ninesync.imap;

import com.ninesync.config.ClientProperties;
import com.ninesync.exception.ImapParseException;
import com.ninesync.exception.ImapProtocolException;
import com.ninesync.exception.ImapTransportException;
import com.ninesync.imap.reply.ReplyParser;
import com.ninesync.imap.reply.ReplyTree;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Writes tagged commands onto a session's stream and correlates completions.
 *
 * <p>Several commands may be sent before any is awaited (pipelining). Every
 * completion is matched to its own tag, so completions arriving out of send
 * order are attributed correctly.</p>
 */
@Slf4j
@Component
public class CommandDispatcher {

    private final ClientProperties properties;
    private final MeterRegistry meterRegistry;

    public CommandDispatcher(ClientProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Format and send a command without waiting for its completion.
     *
     * @return the tag the command was sent with
     */
    public String send(ImapSession session, String commandTemplate, Object... args) {
        return send(session, false, commandTemplate, args);
    }

    /**
     * Send a command whose reply nobody will await; it is dropped on arrival.
     */
    public String sendDetached(ImapSession session, String commandTemplate, Object... args) {
        return send(session, true, commandTemplate, args);
    }

    /**
     * LOGIN with the secret quoted, or sent as a literal when quoting cannot
     * carry it (CR, LF, NUL or 8-bit characters).
     */
    public CommandResult login(ImapSession session, String user, String secret) {
        if (isQuotable(secret)) {
            return runCommand(session, "LOGIN %s %s", quote(user), quote(secret));
        }
        String command = "LOGIN " + quote(user);
        String tag;
        try {
            tag = session.issueLiteral(command, secret, "login",
                    Duration.ofMillis(properties.getImap().getCommandTimeout()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "interrupted while sending LOGIN", e);
        }
        log.debug("IMAP >> {} {} {literal}", tag, command);
        meterRegistry.counter("ninesync.imap.commands", "verb", "LOGIN").increment();
        return collect(session, tag);
    }

    /**
     * Block until the completion for {@code tag} arrives.
     *
     * @return false if the stream closed before the completion appeared
     */
    public boolean awaitTag(ImapSession session, String tag) {
        Duration timeout = Duration.ofMillis(properties.getImap().getCommandTimeout());
        try {
            return session.awaitTag(tag, timeout, properties.getImap().getSearchWindow());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "interrupted while waiting for tag " + tag, e);
        }
    }

    /**
     * Send, await and parse. A NO or BAD completion is returned, not thrown;
     * a closed stream is thrown as {@link ImapTransportException}.
     */
    public CommandResult runCommand(ImapSession session, String commandTemplate, Object... args) {
        String tag = send(session, commandTemplate, args);
        return collect(session, tag);
    }

    /**
     * As {@link #runCommand} but a non-OK completion is thrown as
     * {@link ImapProtocolException}.
     */
    public CommandResult runChecked(ImapSession session, String commandTemplate, Object... args) {
        CommandResult result = runCommand(session, commandTemplate, args);
        if (!result.ok()) {
            throw new ImapProtocolException(session.getServerName(), verb(format(commandTemplate, args)),
                    result.status(), result.statusText());
        }
        return result;
    }

    /**
     * Await {@code tag} and take its response unit off the session buffer.
     */
    public CommandResult collect(ImapSession session, String tag) {
        if (!awaitTag(session, tag)) {
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "connection closed while waiting for tag " + tag);
        }
        String kind = session.commandKind(tag);
        byte[] unit = session.takeResponseUnit(tag);
        if (unit == null) {
            throw new ImapTransportException(session.getServerName(), session.getTransport(),
                    "completion for tag " + tag + " was consumed elsewhere");
        }
        CommandResult result = parse(tag, unit);
        if (!result.ok()) {
            log.warn("IMAP {} tag {}: {} {}", session.getServerName(), tag, result.status(), result.statusText());
            meterRegistry.counter("ninesync.imap.command.failures",
                    "verb", kind != null ? kind.toUpperCase(Locale.ROOT) : "UNKNOWN",
                    "status", String.valueOf(result.status())).increment();
        }
        return result;
    }

    static CommandResult parse(String tag, byte[] unit) {
        List<ReplyTree> replies;
        try {
            replies = ReplyParser.parseUnit(unit);
        } catch (ImapParseException e) {
            log.warn("Malformed reply for tag {}: {}", tag, e.getMessage());
            ReplyTree completion = ReplyParser.parseReply(lastLine(unit));
            return new CommandResult(tag, completion.status(),
                    "malformed reply: " + e.getMessage(), List.of(), true);
        }
        if (replies.isEmpty()) {
            throw new ImapParseException("Empty response unit for tag " + tag);
        }
        ReplyTree completion = replies.get(replies.size() - 1);
        List<ReplyTree> untagged = new ArrayList<>();
        for (ReplyTree reply : replies.subList(0, replies.size() - 1)) {
            if (reply.isUntagged()) {
                untagged.add(reply);
            }
        }
        return new CommandResult(tag, completion.status(), completion.statusText(), untagged, false);
    }

    /** Quote a string argument, escaping backslash and double quote. */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    /** True if {@code value} is 7-bit text without CR, LF or NUL. */
    public static boolean isQuotable(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == 0 || c == '\r' || c == '\n' || c > 0x7f) {
                return false;
            }
        }
        return true;
    }

    /** Mailbox name as a quoted, modified UTF-7 argument. */
    public static String mailbox(String name) {
        return quote(MailboxNames.encode(name));
    }

    private String send(ImapSession session, boolean detached, String commandTemplate, Object... args) {
        String command = format(commandTemplate, args);
        String verb = verb(command);
        String tag = session.issue(command, verb.toLowerCase(Locale.ROOT), detached);
        if (log.isDebugEnabled()) {
            log.debug("IMAP >> {} {}", tag, "LOGIN".equals(verb) ? maskLogin(command) : command);
        }
        meterRegistry.counter("ninesync.imap.commands", "verb", verb).increment();
        return tag;
    }

    private static String format(String commandTemplate, Object... args) {
        return args.length == 0 ? commandTemplate : String.format(commandTemplate, args);
    }

    static String verb(String command) {
        String[] words = command.trim().split("\\s+", 3);
        String verb = words[0].toUpperCase(Locale.ROOT);
        if ("UID".equals(verb) && words.length > 1) {
            return "UID " + words[1].toUpperCase(Locale.ROOT);
        }
        return verb;
    }

    private static String maskLogin(String command) {
        String[] words = command.split("\\s+", 3);
        return words.length > 1 ? words[0] + " " + words[1] + " ****" : command;
    }

    private static String lastLine(byte[] unit) {
        String text = new String(unit, StandardCharsets.ISO_8859_1).stripTrailing();
        int newline = text.lastIndexOf('\n');
        return newline >= 0 ? text.substring(newline + 1) : text;
    }
}

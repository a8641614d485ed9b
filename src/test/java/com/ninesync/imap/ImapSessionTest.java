package com.ninesync.imap;

import com.ninesync.domain.MailboxState;
import com.ninesync.exception.ImapTransportException;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IMAP client session unit tests
 */
class ImapSessionTest {

    private EmbeddedChannel channel;
    private ImapSession session;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel();
        session = new ImapSession("test", "localhost", 143, TransportKind.PLAIN, LineEnding.AUTO,
                Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
        session.attach(channel);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }

    @Test
    @DisplayName("Initial state: CONNECTING until greeted")
    void testInitialState() {
        assertThat(session.getState()).isEqualTo(ImapState.CONNECTING);
        assertThat(session.isOpen()).isTrue();
        assertThat(session.getSelectedMailbox()).isNull();

        session.onResponseLine(bytes("* OK IMAP4rev1 ready\r\n"));
        session.greeted();

        assertThat(session.getState()).isEqualTo(ImapState.NOT_AUTHENTICATED);
        assertThat(session.getGreeting()).isEqualTo("* OK IMAP4rev1 ready");
    }

    @Test
    @DisplayName("PREAUTH greeting skips login")
    void testPreauth() {
        session.onResponseLine(bytes("* PREAUTH welcome back\r\n"));
        session.greeted();

        assertThat(session.isPreauthenticated()).isTrue();
        assertThat(session.getState()).isEqualTo(ImapState.AUTHENTICATED);
    }

    @Test
    @DisplayName("Line ending follows the greeting when AUTO")
    void testLineEndingDetection() {
        session.onResponseLine(bytes("* OK ready\n"));
        session.issue("NOOP", "noop", false);

        assertThat(session.getLineEnding()).isEqualTo(LineEnding.LF);
        assertThat((String) channel.readOutbound()).isEqualTo("1 NOOP\n");
    }

    @Test
    @DisplayName("N commands get tags k+1..k+N")
    void testSequentialTags() {
        session.onResponseLine(bytes("* OK ready\r\n"));
        session.issue("CAPABILITY", "capability", false);
        long k = session.getSequence();

        List<String> tags = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            tags.add(session.issue("NOOP", "noop", false));
        }

        assertThat(tags).containsExactly(
                String.valueOf(k + 1), String.valueOf(k + 2), String.valueOf(k + 3),
                String.valueOf(k + 4), String.valueOf(k + 5));
        assertThat(session.pendingCount()).isEqualTo(6);
    }

    @Test
    @DisplayName("Completion removes the command from pending and records its status")
    void testCompletion() throws InterruptedException {
        session.onResponseLine(bytes("* OK ready\r\n"));
        String tag = session.issue("NOOP", "noop", false);

        session.onResponseLine(bytes("* 4 EXISTS\r\n"));
        session.onResponseLine(bytes(tag + " OK NOOP completed\r\n"));

        assertThat(session.isPending(tag)).isFalse();
        assertThat(session.completionStatus(tag)).isEqualTo("OK");
        assertThat(session.commandKind(tag)).isEqualTo("noop");
        assertThat(session.awaitTag(tag, Duration.ofSeconds(1), 0)).isTrue();
        assertThat(new String(session.takeResponseUnit(tag), StandardCharsets.ISO_8859_1))
                .isEqualTo("* 4 EXISTS\r\n" + tag + " OK NOOP completed\r\n");
        assertThat(session.completionStatus(tag)).isNull();
    }

    @Test
    @DisplayName("Replies to detached commands are discarded on arrival")
    void testDetached() {
        session.onResponseLine(bytes("* OK ready\r\n"));
        String tag = session.issue("NOOP", "noop", true);

        session.onResponseLine(bytes(tag + " OK NOOP completed\r\n"));

        assertThat(session.completionStatus(tag)).isNull();
        assertThat(session.pendingCount()).isZero();
    }

    @Test
    @DisplayName("awaitTag returns false once the stream closes")
    void testAwaitAfterClose() throws InterruptedException {
        session.onResponseLine(bytes("* OK ready\r\n"));
        String tag = session.issue("NOOP", "noop", false);

        session.onClosed();

        assertThat(session.awaitTag(tag, Duration.ofSeconds(1), 0)).isFalse();
        assertThat(session.getState()).isEqualTo(ImapState.LOGOUT);
        assertThatThrownBy(() -> session.issue("NOOP", "noop", false))
                .isInstanceOf(ImapTransportException.class);
    }

    @Test
    @DisplayName("awaitTag times out with a transport error")
    void testAwaitTimeout() {
        session.onResponseLine(bytes("* OK ready\r\n"));
        String tag = session.issue("NOOP", "noop", false);

        assertThatThrownBy(() -> session.awaitTag(tag, Duration.ofMillis(50), 0))
                .isInstanceOf(ImapTransportException.class)
                .hasMessageContaining("tag " + tag);
    }

    @Test
    @DisplayName("A completion arriving after the timeout is discarded")
    void testLateCompletionDiscarded() {
        session.onResponseLine(bytes("* OK ready\r\n"));
        String tag = session.issue("UID FETCH 1:* (UID FLAGS)", "uid fetch", false);

        assertThatThrownBy(() -> session.awaitTag(tag, Duration.ofMillis(20), 0))
                .isInstanceOf(ImapTransportException.class);
        assertThat(session.isPending(tag)).isFalse();

        session.onResponseLine(bytes("* 1 FETCH (UID 1 FLAGS ())\r\n"));
        session.onResponseLine(bytes(tag + " OK done\r\n"));

        assertThat(session.completionStatus(tag)).isNull();
        assertThat(session.bufferedLines()).isZero();
        assertThat(session.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Continuation requests are not buffered")
    void testContinuationNotBuffered() {
        session.onResponseLine(bytes("* OK ready\r\n"));
        session.onResponseLine(bytes("+ go ahead\r\n"));

        assertThat(session.bufferedLines()).isZero();
    }

    @Test
    @DisplayName("AUTO writes CRLF until the greeting is seen")
    void testTerminatorBeforeGreeting() {
        session.issue("CAPABILITY", "capability", false);

        assertThat((String) channel.readOutbound()).isEqualTo("1 CAPABILITY\r\n");
    }

    @Test
    @DisplayName("A completion delivered by another thread wakes the waiter")
    void testAwaitWakeUp() throws Exception {
        session.onResponseLine(bytes("* OK ready\r\n"));
        String tag = session.issue("NOOP", "noop", false);

        Thread eventLoop = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            session.onResponseLine(bytes(tag + " OK done\r\n"));
        });
        eventLoop.start();

        assertThat(session.awaitTag(tag, Duration.ofSeconds(5), 0)).isTrue();
        eventLoop.join();
    }

    @Test
    @DisplayName("Capabilities are normalized to upper case")
    void testCapabilities() {
        session.setCapabilities(Set.of("imap4rev1", "UidPlus", "STARTTLS"));

        assertThat(session.hasCapability("UIDPLUS")).isTrue();
        assertThat(session.hasCapability("uidplus")).isTrue();
        assertThat(session.hasCapability("QRESYNC")).isFalse();
    }

    @Test
    @DisplayName("Selecting tracks a single mailbox and its state")
    void testSelected() {
        session.authenticated();
        session.mailbox(new MailboxState("INBOX"));
        session.selected("INBOX");

        assertThat(session.getState()).isEqualTo(ImapState.SELECTED);
        assertThat(session.mailbox("INBOX")).isNotNull();

        session.selected("Work");
        assertThat(session.getSelectedMailbox()).isEqualTo("Work");

        session.selected(null);
        assertThat(session.getState()).isEqualTo(ImapState.AUTHENTICATED);
    }

    @Test
    @DisplayName("Idle time is measured from the last command")
    void testIdleTime() {
        session.onResponseLine(bytes("* OK ready\r\n"));
        session.issue("NOOP", "noop", false);

        assertThat(session.idleTime(Instant.parse("2026-01-01T00:15:00Z"))).isEqualTo(Duration.ofMinutes(15));
    }
}

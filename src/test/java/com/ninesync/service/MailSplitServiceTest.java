package com.ninesync.service;

import com.ninesync.config.ClientProperties;
import com.ninesync.domain.ExpungeOutcome;
import com.ninesync.domain.SplitResult;
import com.ninesync.domain.UidRange;
import com.ninesync.imap.CommandDispatcher;
import com.ninesync.imap.ImapSession;
import com.ninesync.imap.ScriptedImapServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MailSplitService unit tests
 */
@ExtendWith(MockitoExtension.class)
class MailSplitServiceTest {

    @Mock
    private MailClassifier classifier;

    private ScriptedImapServer server;
    private MailSplitService splitService;

    @BeforeEach
    void setUp() {
        ClientProperties properties = new ClientProperties();
        ClientProperties.Server entry = new ClientProperties.Server();
        entry.setName("srv");
        entry.setHost("localhost");
        properties.getServers().add(entry);

        CommandDispatcher dispatcher = new CommandDispatcher(properties, new SimpleMeterRegistry());
        server = new ScriptedImapServer();
        splitService = new MailSplitService(properties, dispatcher, new MailboxService(dispatcher),
                new MessageDeletionService(properties, dispatcher), classifier);
    }

    private void scriptInbox() {
        server.on("SELECT", "* 5 EXISTS", "* OK [UIDVALIDITY 1] ok", "* OK [UIDNEXT 6] ok")
                .on("UID FETCH 1:* (UID FLAGS)",
                        "* 1 FETCH (UID 1 FLAGS ())",
                        "* 2 FETCH (UID 2 FLAGS (\\Recent))",
                        "* 3 FETCH (UID 3 FLAGS ())",
                        "* 4 FETCH (UID 4 FLAGS (\\Seen))",
                        "* 5 FETCH (UID 5 FLAGS (\\Deleted))")
                .on("UID FETCH 1:3 ",
                        article(1, "Subject: one"),
                        article(2, "Subject: two"),
                        article(3, "Subject: three"))
                .on("LIST", "* LIST () \"/\" INBOX", "* LIST () \"/\" Work", "* LIST () \"/\" Archive");
    }

    private void classifyBySubject(Classification one, Classification two, Classification three) {
        when(classifier.classify(any())).thenAnswer(invocation -> {
            String raw = new String((byte[]) invocation.getArgument(0), StandardCharsets.ISO_8859_1);
            if (raw.contains("Subject: one")) {
                return one;
            }
            return raw.contains("Subject: two") ? two : three;
        });
    }

    @Test
    @DisplayName("New articles are copied per destination and removed from the inbox")
    void testSplit() {
        scriptInbox();
        classifyBySubject(Classification.to("Work"), Classification.to("Work", "Archive"),
                Classification.discarded());
        ImapSession session = server.connect("srv", "IMAP4rev1", "UIDPLUS");

        SplitResult result = splitService.split(session);

        assertThat(server.commands()).containsExactly(
                "SELECT \"INBOX\"",
                "UID FETCH 1:* (UID FLAGS)",
                "UID FETCH 1:3 (UID BODY.PEEK[HEADER] BODY.PEEK[1])",
                "LIST \"\" \"*\"",
                "UID COPY 1:2 \"Work\"",
                "UID COPY 2 \"Archive\"",
                "UID STORE 1:2 +FLAGS.SILENT (\\Deleted)",
                "UID EXPUNGE 1:2",
                "UID STORE 3 +FLAGS.SILENT (\\Deleted)",
                "UID EXPUNGE 3");
        assertThat(result.candidates()).isEqualTo(UidRange.parse("1:3"));
        assertThat(result.copied()).containsEntry("Work", UidRange.of(1, 2)).containsEntry("Archive", UidRange.of(2));
        assertThat(result.deleted()).isEqualTo(UidRange.of(1, 2));
        assertThat(result.discarded()).isEqualTo(UidRange.of(3));
        assertThat(result.kept().isEmpty()).isTrue();
        assertThat(result.expunge()).isEqualTo(ExpungeOutcome.EXPUNGED);
        assertThat(result.isPartialFailure()).isFalse();
    }

    @Test
    @DisplayName("An article is kept when any of its copies failed")
    void testPartialFailure() {
        server.fail("UID COPY 2 \"Archive\"", "NO", "[OVERQUOTA] quota exceeded");
        scriptInbox();
        classifyBySubject(Classification.to("Work"), Classification.to("Work", "Archive"),
                Classification.none());
        ImapSession session = server.connect("srv", "IMAP4rev1", "UIDPLUS");

        SplitResult result = splitService.split(session);

        assertThat(result.isPartialFailure()).isTrue();
        assertThat(result.failed()).containsEntry("Archive", UidRange.of(2));
        assertThat(result.deleted()).isEqualTo(UidRange.of(1));
        assertThat(result.kept()).isEqualTo(UidRange.of(3));
        assertThat(server.commands())
                .contains("UID STORE 1 +FLAGS.SILENT (\\Deleted)", "UID EXPUNGE 1")
                .noneMatch(command -> command.startsWith("UID STORE 2"))
                .noneMatch(command -> command.startsWith("UID STORE 3"));
    }

    @Test
    @DisplayName("Missing destination mailboxes are created before copying")
    void testCreatesDestination() {
        server.on("SELECT", "* OK [UIDNEXT 2] ok")
                .on("UID FETCH 1:* (UID FLAGS)", "* 1 FETCH (UID 1 FLAGS ())")
                .on("UID FETCH 1 ", article(1, "Subject: one"))
                .on("LIST", "* LIST () \"/\" INBOX");
        classifyBySubject(Classification.to("Lists"), Classification.none(), Classification.none());
        ImapSession session = server.connect("srv", "IMAP4rev1", "UIDPLUS");

        splitService.split(session);

        assertThat(server.commands()).containsSubsequence("LIST \"\" \"*\"", "CREATE \"Lists\"", "UID COPY 1 \"Lists\"");
    }

    @Test
    @DisplayName("A refused CREATE fails only its own destination")
    void testCreateRefused() {
        server.fail("CREATE \"Bad\"", "NO", "permission denied");
        scriptInbox();
        classifyBySubject(Classification.to("Work"), Classification.to("Bad"), Classification.discarded());
        ImapSession session = server.connect("srv", "IMAP4rev1", "UIDPLUS");

        SplitResult result = splitService.split(session);

        assertThat(server.commands())
                .containsSubsequence("CREATE \"Bad\"", "UID COPY 1 \"Work\"",
                        "UID STORE 1 +FLAGS.SILENT (\\Deleted)", "UID EXPUNGE 1",
                        "UID STORE 3 +FLAGS.SILENT (\\Deleted)", "UID EXPUNGE 3")
                .noneMatch(command -> command.startsWith("UID COPY 2"))
                .noneMatch(command -> command.startsWith("UID STORE 2"));
        assertThat(result.copied()).containsOnlyKeys("Work");
        assertThat(result.failed()).containsEntry("Bad", UidRange.of(2));
        assertThat(result.deleted()).isEqualTo(UidRange.of(1));
        assertThat(result.discarded()).isEqualTo(UidRange.of(3));
        assertThat(result.isPartialFailure()).isTrue();
    }

    @Test
    @DisplayName("Nothing is fetched when the inbox has no new articles")
    void testNothingNew() {
        server.on("SELECT", "* 1 EXISTS", "* OK [UIDNEXT 2] ok")
                .on("UID FETCH 1:* (UID FLAGS)", "* 1 FETCH (UID 1 FLAGS (\\Seen))");
        ImapSession session = server.connect("srv", "UIDPLUS");

        SplitResult result = splitService.split(session);

        assertThat(result.candidates().isEmpty()).isTrue();
        assertThat(result.expunge()).isEqualTo(ExpungeOutcome.NOTHING_TO_DELETE);
        assertThat(server.commands()).containsExactly("SELECT \"INBOX\"", "UID FETCH 1:* (UID FLAGS)");
        verify(classifier, never()).classify(any());
    }

    private static String article(long uid, String header) {
        String headerBlock = header + "\r\nFrom: someone@example.com\r\n\r\n";
        String body = "text of " + uid + "\r\n";
        return "* " + uid + " FETCH (UID " + uid
                + " BODY[HEADER] {" + headerBlock.length() + "}\r\n" + headerBlock
                + " BODY[1] {" + body.length() + "}\r\n" + body + ")";
    }
}

package com.ninesync.imap.reply;

import com.ninesync.exception.ImapParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Reply tokenizer unit tests
 */
class ReplyParserTest {

    @Test
    @DisplayName("Literal payload becomes one quoted atom with the exact bytes")
    void testLiteralUnfolding() {
        byte[] unit = "* 1 FETCH (UID 5 BODY[1] {11}\r\nhello world)\r\n".getBytes(StandardCharsets.ISO_8859_1);

        ReplyTree reply = ReplyParser.parseUnit(unit).get(0);

        assertThat(reply.keyword()).isEqualTo("FETCH");
        ListNode items = reply.list(3);
        assertThat(items.atomValueOf("UID").orElseThrow().value()).isEqualTo("5");
        Atom body = items.atomValueOf("BODY[1]").orElseThrow();
        assertThat(body.quoted()).isTrue();
        assertThat(body.bytes()).isEqualTo("hello world".getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("Literal bytes containing quotes, parentheses and line breaks survive unfolding")
    void testLiteralWithSpecialCharacters() {
        String payload = "a \"q\" (x)\r\n\\ b";
        byte[] unit = ("* 2 FETCH (BODY[HEADER] {" + payload.length() + "}\r\n" + payload + " UID 9)\r\n")
                .getBytes(StandardCharsets.ISO_8859_1);

        ListNode items = ReplyParser.parseUnit(unit).get(0).list(3);

        assertThat(new String(items.atomValueOf("BODY[HEADER]").orElseThrow().bytes(), StandardCharsets.ISO_8859_1))
                .isEqualTo(payload);
        assertThat(items.atomValueOf("UID").orElseThrow().longValue()).isEqualTo(9);
    }

    @Test
    @DisplayName("unfoldLiterals escapes backslash and quote")
    void testUnfoldEscapes() {
        String text = ReplyParser.unfoldLiterals("* X {3}\r\na\"\\\r\n".getBytes(StandardCharsets.ISO_8859_1));

        assertThat(text).isEqualTo("* X \"a\\\"\\\\\"\r\n");
    }

    @Test
    @DisplayName("Bracketed response code is split into atoms")
    void testAttrList() {
        ReplyTree reply = ReplyParser.parseReply("* OK [PERMANENTFLAGS (\\Seen \\Deleted \\*)] Limited");

        assertThat(reply.status()).isEqualTo("OK");
        AttrList code = reply.responseCode().orElseThrow();
        assertThat(code.code()).isEqualTo("PERMANENTFLAGS");
        assertThat(code.atoms()).containsExactly("PERMANENTFLAGS", "\\Seen", "\\Deleted", "\\*");
        assertThat(reply.statusText()).isEqualTo("Limited");
    }

    @Test
    @DisplayName("Nested lists parse recursively")
    void testNestedLists() {
        ReplyTree reply = ReplyParser.parseReply(
                "* 1 FETCH (BODYSTRUCTURE ((\"text\" \"plain\" NIL NIL NIL \"7bit\" 3 1)(\"image\" \"png\" NIL NIL NIL \"base64\" 10) \"mixed\"))");

        ListNode structure = reply.list(3).listValueOf("BODYSTRUCTURE").orElseThrow();
        assertThat(structure.list(0).text(1)).isEqualTo("plain");
        assertThat(structure.list(1).text(0)).isEqualTo("image");
        assertThat(structure.text(2)).isEqualTo("mixed");
    }

    @Test
    @DisplayName("Tagged completion exposes tag, status and text")
    void testTaggedCompletion() {
        ReplyTree reply = ReplyParser.parseReply("7 NO [TRYCREATE] Mailbox doesn't exist");

        assertThat(reply.tag()).isEqualTo("7");
        assertThat(reply.isUntagged()).isFalse();
        assertThat(reply.status()).isEqualTo("NO");
        assertThat(reply.responseCode().orElseThrow().code()).isEqualTo("TRYCREATE");
        assertThat(reply.statusText()).isEqualTo("Mailbox doesn't exist");
    }

    @Test
    @DisplayName("A whole unit yields one tree per line")
    void testUnit() {
        byte[] unit = "* 3 EXISTS\r\n* FLAGS (\\Seen)\r\n4 OK done\r\n".getBytes(StandardCharsets.US_ASCII);

        List<ReplyTree> replies = ReplyParser.parseUnit(unit);

        assertThat(replies).hasSize(3);
        assertThat(replies.get(0).keyword()).isEqualTo("EXISTS");
        assertThat(replies.get(1).keyword()).isEqualTo("FLAGS");
        assertThat(replies.get(2).status()).isEqualTo("OK");
    }

    @Test
    @DisplayName("Unbalanced structure is a parse error")
    void testMalformed() {
        assertThatThrownBy(() -> ReplyParser.parseReply("* 1 FETCH (UID 5"))
                .isInstanceOf(ImapParseException.class);
        assertThatThrownBy(() -> ReplyParser.parseReply("* OK [UIDNEXT 5 text"))
                .isInstanceOf(ImapParseException.class);
        assertThatThrownBy(() -> ReplyParser.parseUnit("* 1 FETCH (BODY[] {20}\r\nshort)\r\n".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(ImapParseException.class);
    }
}

package com.ninesync.imap;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IMAP response framing tests
 */
class ImapResponseDecoderTest {

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel(new ImapResponseDecoder(1024));
    }

    private void feed(String data) {
        channel.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.ISO_8859_1));
    }

    private String next() {
        byte[] line = channel.readInbound();
        return line == null ? null : new String(line, StandardCharsets.ISO_8859_1);
    }

    @Test
    @DisplayName("Plain lines are emitted one by one with their terminators")
    void testSimpleLines() {
        feed("* OK ready\r\n1 OK done\n");

        assertThat(next()).isEqualTo("* OK ready\r\n");
        assertThat(next()).isEqualTo("1 OK done\n");
        assertThat(next()).isNull();
    }

    @Test
    @DisplayName("A literal split across reads is assembled into one logical line")
    void testSplitLiteral() {
        feed("* 1 FETCH (UID 5 BODY[1] {11}\r\nhel");
        assertThat(next()).isNull();
        feed("lo wor");
        assertThat(next()).isNull();
        feed("ld)\r\n2 OK FETCH done\r\n");

        assertThat(next()).isEqualTo("* 1 FETCH (UID 5 BODY[1] {11}\r\nhello world)\r\n");
        assertThat(next()).isEqualTo("2 OK FETCH done\r\n");
    }

    @Test
    @DisplayName("Literal payload containing line breaks is not split")
    void testLiteralWithNewlines() {
        feed("* 2 FETCH (BODY[HEADER] {8}\r\nA: b\r\n\r\n UID 2)\r\n");

        assertThat(next()).isEqualTo("* 2 FETCH (BODY[HEADER] {8}\r\nA: b\r\n\r\n UID 2)\r\n");
        assertThat(next()).isNull();
    }

    @Test
    @DisplayName("Several literals on one logical line")
    void testMultipleLiterals() {
        feed("* 3 FETCH (BODY[1] {2}\r\nab BODY[2] {3}\r\ncde)\r\n");

        assertThat(next()).isEqualTo("* 3 FETCH (BODY[1] {2}\r\nab BODY[2] {3}\r\ncde)\r\n");
    }

    @Test
    @DisplayName("Overlong line is rejected")
    void testTooLong() {
        StringBuilder sb = new StringBuilder("* ");
        for (int i = 0; i < 1100; i++) {
            sb.append('x');
        }
        sb.append("\r\n");

        assertThatThrownBy(() -> feed(sb.toString()))
                .isInstanceOf(DecoderException.class)
                .isInstanceOf(TooLongFrameException.class);
    }
}

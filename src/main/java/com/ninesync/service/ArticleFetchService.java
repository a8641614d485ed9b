package com.ninesync.service;

import com.ninesync.domain.BodyPart;
import com.ninesync.domain.PartSelection;
import com.ninesync.exception.ImapParseException;
import com.ninesync.exception.ImapProtocolException;
import com.ninesync.imap.CommandDispatcher;
import com.ninesync.imap.CommandResult;
import com.ninesync.imap.ImapSession;
import com.ninesync.imap.reply.Atom;
import com.ninesync.imap.reply.ListNode;
import com.ninesync.imap.reply.ReplyTree;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetHeaders;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Retrieves articles from the selected mailbox, whole or as a reduced MIME
 * message holding only the wanted leaves.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleFetchService {

    private static final String CRLF = "\r\n";

    private final CommandDispatcher dispatcher;

    /**
     * Raw bytes of the whole article, or empty when the server has no such UID.
     */
    public Optional<byte[]> fetchWhole(ImapSession session, long uid) {
        CommandResult result = dispatcher.runChecked(session, "UID FETCH %d BODY.PEEK[]", uid);
        return section(result, uid, "BODY[]");
    }

    /**
     * BODYSTRUCTURE of the article, or empty when the server has no such UID.
     *
     * @throws ImapParseException when the structure is malformed
     */
    public Optional<BodyPart> fetchStructure(ImapSession session, long uid) {
        CommandResult result = dispatcher.runChecked(session, "UID FETCH %d (UID BODYSTRUCTURE)", uid);
        for (ReplyTree reply : result.untagged("FETCH")) {
            ListNode items = reply.list(3);
            if (items == null || !matchesUid(items, uid)) {
                continue;
            }
            Optional<ListNode> structure = items.listValueOf("BODYSTRUCTURE");
            if (structure.isPresent()) {
                return Optional.of(BodyStructureParser.parse(structure.get()));
            }
        }
        log.debug("No BODYSTRUCTURE for UID {} on {}", uid, session.getServerName());
        return Optional.empty();
    }

    /**
     * Leaf part ids wanted under {@code policy}, in depth-first order.
     */
    public Set<String> selectWantedParts(BodyPart structure, PartSelection policy) {
        Set<String> wanted = new LinkedHashSet<>();
        collectWanted(structure, policy, wanted);
        return wanted;
    }

    /**
     * Fetch the header block and each wanted part (pipelined), then rebuild a
     * MIME message following {@code structure}: every leaf keeps its headers,
     * only wanted leaves keep their body.
     *
     * <p>Every sent command is collected before any failure is reported, so
     * the session is left without outstanding replies.</p>
     */
    public byte[] fetchPartial(ImapSession session, long uid, BodyPart structure, Set<String> wanted) {
        String headerTag = dispatcher.send(session, "UID FETCH %d BODY.PEEK[HEADER]", uid);
        Map<String, String> partTags = new LinkedHashMap<>();
        for (String part : wanted) {
            partTags.put(part, dispatcher.send(session, "UID FETCH %d BODY.PEEK[%s]", uid, part));
        }

        CommandResult headerResult = dispatcher.collect(session, headerTag);
        Map<String, CommandResult> partResults = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : partTags.entrySet()) {
            partResults.put(entry.getKey(), dispatcher.collect(session, entry.getValue()));
        }

        byte[] header = section(checked(session, headerResult), uid, "BODY[HEADER]")
                .orElseThrow(() -> new ImapParseException("No header returned for UID " + uid));
        Map<String, byte[]> bodies = new LinkedHashMap<>();
        for (Map.Entry<String, CommandResult> entry : partResults.entrySet()) {
            String part = entry.getKey();
            section(checked(session, entry.getValue()), uid, "BODY[" + part + "]")
                    .ifPresent(bytes -> bodies.put(part, bytes));
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, stripContentHeaders(header));
        writeNode(out, structure, bodies);
        log.debug("Rebuilt UID {} from {} of its parts ({} bytes)", uid, bodies.size(), out.size());
        return out.toByteArray();
    }

    private static CommandResult checked(ImapSession session, CommandResult result) {
        if (!result.ok()) {
            throw new ImapProtocolException(session.getServerName(), "UID FETCH", result.status(), result.statusText());
        }
        return result;
    }

    private static void collectWanted(BodyPart node, PartSelection policy, Set<String> wanted) {
        if (node.isMultipart()) {
            for (BodyPart child : node.children()) {
                collectWanted(child, policy, wanted);
            }
        } else if (policy.wants(node)) {
            wanted.add(node.partId());
        }
    }

    /** Content headers of a node followed by the blank line and its body. */
    private static void writeNode(ByteArrayOutputStream out, BodyPart node, Map<String, byte[]> bodies) {
        if (node.isMultipart()) {
            String boundary = node.boundary();
            if (boundary == null) {
                throw new ImapParseException("multipart/" + node.subtype() + " without boundary");
            }
            write(out, "Content-type: multipart/" + node.subtype() + "; boundary=\"" + boundary + "\"" + CRLF + CRLF);
            for (BodyPart child : node.children()) {
                write(out, "--" + boundary + CRLF);
                writeNode(out, child, bodies);
                write(out, CRLF);
            }
            write(out, "--" + boundary + "--" + CRLF);
            return;
        }
        StringBuilder headers = new StringBuilder("Content-type: ").append(node.contentType());
        if (node.charset() != null) {
            headers.append("; charset=").append(node.charset());
        }
        headers.append(CRLF);
        if (node.encoding() != null) {
            headers.append("Content-transfer-encoding: ").append(node.encoding()).append(CRLF);
        }
        headers.append(CRLF);
        write(out, headers.toString());
        byte[] body = bodies.get(node.partId());
        if (body != null) {
            out.writeBytes(body);
        }
    }

    /**
     * Header block without Content-Type and Content-Transfer-Encoding and
     * without its terminating blank line. Folded lines are kept folded.
     */
    static String stripContentHeaders(byte[] header) {
        InternetHeaders headers;
        try {
            headers = new InternetHeaders(new ByteArrayInputStream(header));
        } catch (MessagingException e) {
            throw new ImapParseException("Unreadable header block: " + e.getMessage(), e);
        }
        headers.removeHeader("Content-Type");
        headers.removeHeader("Content-Transfer-Encoding");

        StringBuilder out = new StringBuilder(header.length);
        Enumeration<String> lines = headers.getAllHeaderLines();
        while (lines.hasMoreElements()) {
            out.append(lines.nextElement()).append(CRLF);
        }
        return out.toString();
    }

    private static Optional<byte[]> section(CommandResult result, long uid, String section) {
        for (ReplyTree reply : result.untagged("FETCH")) {
            ListNode items = reply.list(3);
            if (items == null || !matchesUid(items, uid)) {
                continue;
            }
            Optional<Atom> value = items.atomValueOf(section);
            if (value.isPresent() && !value.get().isNil()) {
                return Optional.of(value.get().bytes());
            }
        }
        return Optional.empty();
    }

    /** FETCH items without a UID item are accepted; UID FETCH always returns it. */
    private static boolean matchesUid(ListNode items, long uid) {
        Optional<Atom> uidAtom = items.atomValueOf("UID");
        return uidAtom.isEmpty() || !uidAtom.get().isNumber() || uidAtom.get().longValue() == uid;
    }

    private static void write(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.ISO_8859_1));
    }
}

package com.ninesync.service;

import com.ninesync.domain.BodyPart;
import com.ninesync.exception.ImapParseException;
import com.ninesync.imap.reply.Atom;
import com.ninesync.imap.reply.ListNode;
import com.ninesync.imap.reply.ReplyToken;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a {@link BodyPart} tree from a parsed BODYSTRUCTURE list, numbering
 * leaves the way part specifiers are addressed in FETCH.
 */
final class BodyStructureParser {

    private BodyStructureParser() {}

    static BodyPart parse(ListNode structure) {
        if (isMultipart(structure)) {
            return multipart(structure, "");
        }
        return leaf(structure, "1");
    }

    private static boolean isMultipart(ListNode node) {
        return node.size() > 0 && node.get(0) instanceof ListNode;
    }

    private static BodyPart multipart(ListNode node, String id) {
        List<BodyPart> children = new ArrayList<>();
        int i = 0;
        while (i < node.size() && node.get(i) instanceof ListNode child) {
            String childId = id.isEmpty() ? String.valueOf(i + 1) : id + "." + (i + 1);
            children.add(isMultipart(child) ? multipart(child, childId) : leaf(child, childId));
            i++;
        }
        Atom subtype = node.atom(i);
        if (subtype == null) {
            throw new ImapParseException("BODYSTRUCTURE multipart without subtype: " + node);
        }
        Map<String, String> params = params(node.get(i + 1));
        return new BodyPart(id, "multipart", subtype.value().toLowerCase(Locale.ROOT), params, null, children);
    }

    private static BodyPart leaf(ListNode node, String id) {
        Atom type = node.atom(0);
        Atom subtype = node.atom(1);
        if (type == null || subtype == null || node.size() < 7) {
            throw new ImapParseException("Malformed BODYSTRUCTURE part " + id + ": " + node);
        }
        Atom encoding = node.atom(5);
        return new BodyPart(id,
                type.value().toLowerCase(Locale.ROOT),
                subtype.value().toLowerCase(Locale.ROOT),
                params(node.get(2)),
                encoding == null || encoding.isNil() ? null : encoding.value().toLowerCase(Locale.ROOT),
                List.of());
    }

    private static Map<String, String> params(ReplyToken token) {
        Map<String, String> params = new LinkedHashMap<>();
        if (!(token instanceof ListNode list)) {
            return params;
        }
        for (int i = 0; i + 1 < list.size(); i += 2) {
            String name = list.text(i);
            String value = list.text(i + 1);
            if (name != null && value != null) {
                params.put(name.toLowerCase(Locale.ROOT), value);
            }
        }
        return params;
    }
}

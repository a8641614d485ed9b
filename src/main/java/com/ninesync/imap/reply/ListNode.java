package com.ninesync.imap.reply;

import java.util.List;

/**
 * Parenthesized list; nested lists are parsed by the same rules.
 */
public record ListNode(List<ReplyToken> tokens) implements ReplyToken, TokenSequence {

    public ListNode {
        tokens = List.copyOf(tokens);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(tokens.get(i));
        }
        return sb.append(')').toString();
    }
}

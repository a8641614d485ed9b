package com.ninesync.imap.reply;

/**
 * One token of a parsed server reply.
 */
public sealed interface ReplyToken permits Atom, ListNode, AttrList {
}

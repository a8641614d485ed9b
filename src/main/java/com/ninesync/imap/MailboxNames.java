package com.ninesync.imap;

import org.eclipse.angus.mail.imap.protocol.BASE64MailboxDecoder;
import org.eclipse.angus.mail.imap.protocol.BASE64MailboxEncoder;

/**
 * Modified UTF-7 (RFC 3501 5.1.3) conversion of mailbox names.
 */
public final class MailboxNames {

    public static final String INBOX = "INBOX";

    private MailboxNames() {}

    public static String encode(String name) {
        if (INBOX.equalsIgnoreCase(name)) {
            return INBOX;
        }
        return BASE64MailboxEncoder.encode(name);
    }

    public static String decode(String wireName) {
        if (INBOX.equalsIgnoreCase(wireName)) {
            return INBOX;
        }
        return BASE64MailboxDecoder.decode(wireName);
    }
}

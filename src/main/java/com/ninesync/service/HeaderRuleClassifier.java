package com.ninesync.service;

import com.ninesync.config.ClientProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetHeaders;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies by matching configured regular expressions against header values.
 * Rules are tried in order and the first match wins; the mailbox name
 * {@code discard} drops the message.
 */
@Slf4j
@Component
public class HeaderRuleClassifier implements MailClassifier {

    static final String DISCARD = "discard";

    private record CompiledRule(String header, Pattern pattern, String mailbox) {
    }

    private final List<CompiledRule> rules = new ArrayList<>();

    public HeaderRuleClassifier(ClientProperties properties) {
        for (ClientProperties.Rule rule : properties.getSplit().getRules()) {
            rules.add(new CompiledRule(rule.getHeader(),
                    Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE), rule.getMailbox()));
        }
        log.info("Mail classifier loaded with {} rule(s)", rules.size());
    }

    @Override
    public Classification classify(byte[] rawMessage) {
        InternetHeaders headers;
        try (InputStream is = new ByteArrayInputStream(rawMessage)) {
            headers = new InternetHeaders(is);
        } catch (MessagingException | IOException e) {
            log.warn("Unparseable message header, leaving message in place: {}", e.getMessage());
            return Classification.none();
        }

        for (CompiledRule rule : rules) {
            String[] values = headers.getHeader(rule.header());
            if (values == null) {
                continue;
            }
            for (String value : values) {
                if (rule.pattern().matcher(decode(value)).find()) {
                    return DISCARD.equalsIgnoreCase(rule.mailbox())
                            ? Classification.discarded()
                            : Classification.to(rule.mailbox());
                }
            }
        }
        return Classification.none();
    }

    private static String decode(String value) {
        try {
            return MimeUtility.decodeText(MimeUtility.unfold(value));
        } catch (UnsupportedEncodingException e) {
            return value;
        }
    }
}

package com.ninesync.config;

import com.ninesync.imap.LineEnding;
import com.ninesync.imap.TransportKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * NineSync client configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "ninesync")
public class ClientProperties {

    private Imap imap = new Imap();
    private List<Server> servers = new ArrayList<>();
    private Split split = new Split();
    private Tls tls = new Tls();

    public Optional<Server> server(String name) {
        return servers.stream()
                .filter(s -> s.getName().equals(name))
                .findFirst();
    }

    @Data
    public static class Imap {
        private long connectTimeout = 30000L;
        private long commandTimeout = 120000L;
        private int maxLineLength = 65536;
        /** 0 = rescan the whole buffer for completions; otherwise trailing bytes searched */
        private int searchWindow = 0;
        private long keepaliveInterval = 900000L;
        private long keepaliveIdle = 840000L;
    }

    @Data
    public static class Server {
        private String name;
        private String host;
        private int port = 143;
        private TransportKind transport = TransportKind.PLAIN;
        /** Opportunistic STARTTLS for PLAIN transport */
        private boolean upgrade = true;
        private LineEnding lineEnding = LineEnding.AUTO;
        private String user;
        private String password;
        /** Allow a mailbox-wide EXPUNGE when UID EXPUNGE is unavailable */
        private boolean allowUnscopedExpunge = false;
        private String inbox = "INBOX";
        /** Articles below the stored high mark re-fetched on partial sync; 0 = always full */
        private int resyncOverlap = 0;
    }

    @Data
    public static class Split {
        private boolean enabled = false;
        private List<Rule> rules = new ArrayList<>();
    }

    @Data
    public static class Rule {
        private String header;
        private String pattern;
        /** Destination mailbox, or "discard" */
        private String mailbox;
    }

    @Data
    public static class Tls {
        /** Accept any server certificate; test servers only */
        private boolean trustAll = false;
    }
}

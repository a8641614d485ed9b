package com.ninesync.service;

import com.ninesync.config.ClientProperties;
import com.ninesync.imap.TransportKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credentials from the configured server entries. A forgotten host/port stays
 * suppressed until restart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredCredentialStore implements CredentialStore {

    private final ClientProperties properties;
    private final Set<String> forgotten = ConcurrentHashMap.newKeySet();

    @Override
    public Optional<Credentials> lookup(String host, List<String> ports) {
        for (ClientProperties.Server server : properties.getServers()) {
            if (server.getHost() == null || !server.getHost().equalsIgnoreCase(host)) {
                continue;
            }
            if (!matchesPort(server, ports) || server.getUser() == null) {
                continue;
            }
            if (forgotten.contains(key(host, server.getPort()))) {
                log.debug("Credentials for {}:{} were invalidated", host, server.getPort());
                continue;
            }
            return Optional.of(new Credentials(server.getUser(),
                    server.getPassword() != null ? server.getPassword() : ""));
        }
        return Optional.empty();
    }

    @Override
    public void forget(String host, int port) {
        if (forgotten.add(key(host, port))) {
            log.info("Invalidated stored credentials for {}:{}", host, port);
        }
    }

    private static boolean matchesPort(ClientProperties.Server server, List<String> ports) {
        if (ports == null || ports.isEmpty()) {
            return true;
        }
        String service = server.getTransport() == TransportKind.TLS ? "imaps" : "imap";
        for (String port : ports) {
            if (port.equals(String.valueOf(server.getPort())) || port.equalsIgnoreCase(service)) {
                return true;
            }
        }
        return false;
    }

    private static String key(String host, int port) {
        return host.toLowerCase(Locale.ROOT) + ":" + port;
    }
}

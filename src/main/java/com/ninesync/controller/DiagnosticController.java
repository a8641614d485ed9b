package com.ninesync.controller;

import com.ninesync.config.ClientProperties;
import com.ninesync.imap.ImapSession;
import com.ninesync.service.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client diagnostic endpoint: configured servers and live sessions.
 * Hit GET /api/diagnostic.
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
@RequiredArgsConstructor
public class DiagnosticController {

    private final ClientProperties properties;
    private final SessionRegistry registry;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> diagnostic() {
        Map<String, Object> result = new LinkedHashMap<>();

        // Configured servers (no credentials)
        List<Map<String, Object>> servers = new ArrayList<>();
        for (ClientProperties.Server server : properties.getServers()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", server.getName());
            entry.put("host", server.getHost());
            entry.put("port", server.getPort());
            entry.put("transport", server.getTransport());
            entry.put("upgrade", server.isUpgrade());
            entry.put("allowUnscopedExpunge", server.isAllowUnscopedExpunge());
            servers.add(entry);
        }
        result.put("servers", servers);

        // Live sessions
        List<Map<String, Object>> sessions = new ArrayList<>();
        for (ImapSession session : registry.sessions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("server", session.getServerName());
            entry.put("transport", session.getTransport());
            entry.put("tls", session.isTlsActive());
            entry.put("state", session.getState());
            entry.put("capabilities", session.getCapabilities());
            entry.put("selectedMailbox", session.getSelectedMailbox());
            entry.put("lastCommandTime", String.valueOf(session.getLastCommandTime()));
            entry.put("pendingCommands", session.pendingCount());
            entry.put("bufferedLines", session.bufferedLines());
            sessions.add(entry);
        }
        result.put("sessions", sessions);

        result.put("imap", Map.of(
                "commandTimeout", properties.getImap().getCommandTimeout(),
                "searchWindow", properties.getImap().getSearchWindow(),
                "keepaliveIdle", properties.getImap().getKeepaliveIdle()));

        log.info("Diagnostic check performed");
        return result;
    }
}

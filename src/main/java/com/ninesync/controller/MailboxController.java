package com.ninesync.controller;

import com.ninesync.config.ClientProperties;
import com.ninesync.domain.BodyPart;
import com.ninesync.domain.ExpungeOutcome;
import com.ninesync.domain.MailboxInfo;
import com.ninesync.domain.Mark;
import com.ninesync.domain.PartSelection;
import com.ninesync.domain.SplitResult;
import com.ninesync.domain.UidRange;
import com.ninesync.exception.ImapAuthenticationException;
import com.ninesync.exception.ImapClientException;
import com.ninesync.exception.ImapProtocolException;
import com.ninesync.imap.ImapSession;
import com.ninesync.service.ArticleFetchService;
import com.ninesync.service.MailSplitService;
import com.ninesync.service.MailboxInfoStore;
import com.ninesync.service.MailboxService;
import com.ninesync.service.MailboxSyncService;
import com.ninesync.service.MessageDeletionService;
import com.ninesync.service.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.PatternSyntaxException;

/**
 * Mailbox operations REST API
 * - Sync mailbox marks (POST /api/servers/{server}/mailboxes/{mailbox}/sync)
 * - Stored mailbox info (GET /api/servers/{server}/mailboxes, GET /api/servers/{server}/mailboxes/{mailbox})
 * - Forget stored mailbox info (DELETE /api/servers/{server}/mailboxes/{mailbox})
 * - Fetch an article (GET /api/servers/{server}/mailboxes/{mailbox}/articles/{uid}?parts=text/plain)
 * - Delete articles (DELETE /api/servers/{server}/mailboxes/{mailbox}/messages?uids=1:5,7)
 * - Split the inbox (POST /api/servers/{server}/split)
 */
@Slf4j
@RestController
@RequestMapping("/api/servers/{server}")
@RequiredArgsConstructor
public class MailboxController {

    private final ClientProperties properties;
    private final SessionManager sessionManager;
    private final MailboxService mailboxService;
    private final MailboxSyncService syncService;
    private final MailboxInfoStore store;
    private final ArticleFetchService fetchService;
    private final MessageDeletionService deletionService;
    private final MailSplitService splitService;

    // One operation at a time per server: operations share the selected mailbox
    private final Map<String, Object> serverLocks = new ConcurrentHashMap<>();

    @PostMapping("/mailboxes/{mailbox}/sync")
    public ResponseEntity<?> sync(@PathVariable String server, @PathVariable String mailbox) {
        return withSession(server, session -> {
            MailboxInfo info = syncService.sync(session, mailbox);
            return ResponseEntity.ok(describe(info));
        });
    }

    @GetMapping("/mailboxes")
    public ResponseEntity<?> infos(@PathVariable String server) {
        if (properties.server(server).isEmpty()) {
            return errorResponse(HttpStatus.NOT_FOUND, "Unknown server: " + server);
        }
        List<Map<String, Object>> mailboxes = new ArrayList<>();
        for (MailboxInfo info : store.loadAll(server)) {
            mailboxes.add(describe(info));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("server", server);
        response.put("mailboxes", mailboxes);
        return ResponseEntity.ok(response);
    }

    /**
     * Drop the stored info; the next sync of the mailbox starts from scratch.
     */
    @DeleteMapping("/mailboxes/{mailbox}")
    public ResponseEntity<Map<String, Object>> forget(@PathVariable String server, @PathVariable String mailbox) {
        if (store.load(server, mailbox).isEmpty()) {
            return errorResponse(HttpStatus.NOT_FOUND, "No stored info for " + server + "/" + mailbox);
        }
        store.delete(server, mailbox);
        log.info("Forgot stored info for {}/{}", server, mailbox);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("server", server);
        response.put("mailbox", mailbox);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/mailboxes/{mailbox}")
    public ResponseEntity<Map<String, Object>> info(@PathVariable String server, @PathVariable String mailbox) {
        return store.load(server, mailbox)
                .map(info -> ResponseEntity.ok(describe(info)))
                .orElseGet(() -> errorResponse(HttpStatus.NOT_FOUND, "No stored info for " + server + "/" + mailbox));
    }

    /**
     * Raw article. With {@code parts} (a content type pattern) or
     * {@code firstPart=true} only the matching leaves keep their bodies.
     */
    @GetMapping("/mailboxes/{mailbox}/articles/{uid}")
    public ResponseEntity<?> article(@PathVariable String server,
                                     @PathVariable String mailbox,
                                     @PathVariable long uid,
                                     @RequestParam(required = false) String parts,
                                     @RequestParam(defaultValue = "false") boolean firstPart) {
        PartSelection selection = null;
        try {
            if (firstPart) {
                selection = PartSelection.firstPartOnly();
            } else if (parts != null) {
                selection = PartSelection.contentType(parts);
            }
        } catch (PatternSyntaxException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        PartSelection wanted = selection;
        return withSession(server, session -> {
            mailboxService.select(session, mailbox, true);
            byte[] body;
            if (wanted == null) {
                Optional<byte[]> whole = fetchService.fetchWhole(session, uid);
                if (whole.isEmpty()) {
                    return errorResponse(HttpStatus.NOT_FOUND, "No article " + uid + " in " + mailbox);
                }
                body = whole.get();
            } else {
                Optional<BodyPart> found = fetchService.fetchStructure(session, uid);
                if (found.isEmpty()) {
                    return errorResponse(HttpStatus.NOT_FOUND, "No article " + uid + " in " + mailbox);
                }
                BodyPart structure = found.get();
                body = fetchService.fetchPartial(session, uid, structure,
                        fetchService.selectWantedParts(structure, wanted));
            }
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType("message/rfc822"))
                    .body(body);
        });
    }

    @DeleteMapping("/mailboxes/{mailbox}/messages")
    public ResponseEntity<?> delete(@PathVariable String server,
                                    @PathVariable String mailbox,
                                    @RequestParam String uids) {
        UidRange range;
        try {
            range = UidRange.parse(uids);
        } catch (IllegalArgumentException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return withSession(server, session -> {
            mailboxService.select(session, mailbox, false);
            ExpungeOutcome outcome = deletionService.delete(session, range);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "success");
            response.put("uids", range.toString());
            response.put("outcome", outcome);
            return ResponseEntity.ok(response);
        });
    }

    @PostMapping("/split")
    public ResponseEntity<?> split(@PathVariable String server) {
        if (!properties.getSplit().isEnabled()) {
            return errorResponse(HttpStatus.CONFLICT, "Mail splitting is disabled (ninesync.split.enabled)");
        }
        return withSession(server, session -> {
            SplitResult result = splitService.split(session);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", result.isPartialFailure() ? "partial" : "success");
            response.put("inbox", result.inbox());
            response.put("candidates", result.candidates().toString());
            response.put("copied", stringify(result.copied()));
            response.put("failed", stringify(result.failed()));
            response.put("deleted", result.deleted().toString());
            response.put("discarded", result.discarded().toString());
            response.put("kept", result.kept().toString());
            response.put("expunge", result.expunge());
            return ResponseEntity.ok(response);
        });
    }

    private ResponseEntity<?> withSession(String server, Function<ImapSession, ResponseEntity<?>> action) {
        if (properties.server(server).isEmpty()) {
            return errorResponse(HttpStatus.NOT_FOUND, "Unknown server: " + server);
        }
        try {
            synchronized (serverLocks.computeIfAbsent(server, name -> new Object())) {
                return action.apply(sessionManager.open(server));
            }
        } catch (ImapAuthenticationException e) {
            return errorResponse(HttpStatus.UNAUTHORIZED, e.getMessage());
        } catch (ImapProtocolException e) {
            return errorResponse(HttpStatus.CONFLICT, e.getMessage());
        } catch (ImapClientException e) {
            log.error("IMAP operation on {} failed: {}", server, e.getMessage());
            return errorResponse(HttpStatus.BAD_GATEWAY, e.getMessage());
        }
    }

    private static Map<String, Object> describe(MailboxInfo info) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("server", info.getServer());
        response.put("mailbox", info.getMailbox());
        response.put("uidValidity", info.getUidValidity());
        if (info.getActive() != null) {
            response.put("active", Map.of("low", info.getActive().low(), "high", info.getActive().high()));
        }
        response.put("read", info.getRead().toString());
        Map<String, String> marks = new LinkedHashMap<>();
        for (Map.Entry<Mark, UidRange> entry : info.getMarks().entrySet()) {
            marks.put(entry.getKey().label(), entry.getValue().toString());
        }
        response.put("marks", marks);
        return response;
    }

    private static Map<String, String> stringify(Map<String, UidRange> ranges) {
        Map<String, String> result = new LinkedHashMap<>();
        ranges.forEach((name, range) -> result.put(name, range.toString()));
        return result;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}

package com.incoresoft.timeAttendance.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.incoresoft.timeAttendance.domain.sync.dto.AgentSyncRequest;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncFailureEvent;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncResult;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncStatus;
import com.incoresoft.timeAttendance.domain.sync.service.DeviceSyncService;
import com.incoresoft.timeAttendance.domain.sync.service.SyncFailureService;
import com.incoresoft.timeAttendance.domain.sync.service.SyncSignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {
    static final String SIGNATURE_HEADER = "X-Sync-Signature";

    private final DeviceSyncService syncService;
    private final SyncFailureService failureService;
    private final SyncSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    /**
     * POST http://localhost:8080/api/sync
     * 200 on success, 409 when a sync is already running, 502 on device/config errors.
     */
    @PostMapping
    public ResponseEntity<SyncResult> sync() {
        SyncResult result = syncService.sync();
        HttpStatus status = switch (result.getStatus()) {
            case SUCCESS -> HttpStatus.OK;
            case ALREADY_RUNNING -> HttpStatus.CONFLICT;
            case ERROR -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", syncService.getState());
        body.put("running", syncService.isRunning());
        syncService.getLastResult().ifPresent(r -> body.put("last_result", r));
        return body;
    }

    /**
     * Push from the on-site agent. The raw body must be signed with the shared secret:
     * X-Sync-Signature: hex(HMAC-SHA256(secret, body)).
     */
    @PostMapping(path = "/logs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> agentLogs(@RequestBody String raw,
                                            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature) {
        if (!signatureVerifier.isValid(raw.getBytes(StandardCharsets.UTF_8), signature)) {
            log.warn("[SYNC] Rejected agent push with missing or bad signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(GlobalExceptionHandler.errorBody("invalid_signature", "Missing or invalid " + SIGNATURE_HEADER));
        }
        AgentSyncRequest request;
        try {
            request = objectMapper.readValue(raw, AgentSyncRequest.class);
        } catch (IOException e) {
            return ResponseEntity.badRequest().body(GlobalExceptionHandler.errorBody("bad_request", e.getMessage()));
        }
        SyncResult result = syncService.acceptAgentPush(request);
        return ResponseEntity.status(result.getStatus() == SyncStatus.SUCCESS
                ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR).body(result);
    }

    /**
     * GET http://localhost:8080/api/sync/failures?from=2025-01-01&to=2025-01-31&resolved=false
     */
    @GetMapping("/failures")
    public List<SyncFailureEvent> failures(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) Boolean resolved
    ) {
        return failureService.find(from, to, resolved);
    }

    @PostMapping("/failures/{id}/resolve")
    public SyncFailureEvent resolve(@PathVariable Long id, @RequestBody(required = false) Map<String, String> body) {
        String note = body == null ? null : body.get("resolution_note");
        return failureService.resolve(id, note, false);
    }
}

package com.incoresoft.timeAttendance.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.incoresoft.timeAttendance.config.DeviceProps;
import com.incoresoft.timeAttendance.domain.shared.NotFoundException;
import com.incoresoft.timeAttendance.domain.sync.dto.AgentSyncRequest;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncResult;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncState;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncStatus;
import com.incoresoft.timeAttendance.domain.sync.service.DeviceSyncService;
import com.incoresoft.timeAttendance.domain.sync.service.SyncFailureService;
import com.incoresoft.timeAttendance.domain.sync.service.SyncSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SyncControllerTest {
    private static final String SECRET = "agent-secret";

    private DeviceSyncService syncService;
    private SyncFailureService failureService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        syncService = mock(DeviceSyncService.class);
        failureService = mock(SyncFailureService.class);
        DeviceProps props = new DeviceProps();
        props.setAgentSecret(SECRET);
        SyncController controller = new SyncController(syncService, failureService,
                new SyncSignatureVerifier(props), new ObjectMapper().findAndRegisterModules());
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void successfulSyncIsOk() throws Exception {
        when(syncService.sync()).thenReturn(SyncResult.builder().status(SyncStatus.SUCCESS).recordsAdded(4).build());

        mvc.perform(post("/api/sync"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.records_added").value(4));
    }

    @Test
    void runningSyncIsConflict() throws Exception {
        when(syncService.sync()).thenReturn(SyncResult.alreadyRunning());

        mvc.perform(post("/api/sync"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("already_running"));
    }

    @Test
    void deviceFailureIsBadGateway() throws Exception {
        when(syncService.sync()).thenReturn(SyncResult.error("No active device configured"));

        mvc.perform(post("/api/sync"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errors[0]").value("No active device configured"));
    }

    @Test
    void statusReportsStateAndLastResult() throws Exception {
        when(syncService.getState()).thenReturn(SyncState.IDLE);
        when(syncService.getLastResult()).thenReturn(Optional.of(SyncResult.alreadyRunning()));

        mvc.perform(get("/api/sync/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("IDLE"))
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.last_result.status").value("already_running"));
    }

    @Test
    void unsignedAgentPushIsRejected() throws Exception {
        mvc.perform(post("/api/sync/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"device_id\":\"gate-1\",\"logs\":[]}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("invalid_signature"));

        verify(syncService, never()).acceptAgentPush(any());
    }

    @Test
    void signedAgentPushIsIngested() throws Exception {
        String body = "{\"device_id\":\"gate-1\",\"logs\":[{\"user_id\":\"7\",\"timestamp\":\"2025-01-13T09:00:00\",\"punch\":0}]}";
        String signature = SyncSignatureVerifier.signHex(SECRET, body.getBytes(StandardCharsets.UTF_8));
        when(syncService.acceptAgentPush(any())).thenReturn(SyncResult.builder().status(SyncStatus.SUCCESS).recordsAdded(1).build());

        mvc.perform(post("/api/sync/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Sync-Signature", signature)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records_added").value(1));

        ArgumentCaptor<AgentSyncRequest> captor = ArgumentCaptor.forClass(AgentSyncRequest.class);
        verify(syncService).acceptAgentPush(captor.capture());
        assertThat(captor.getValue().getDeviceId()).isEqualTo("gate-1");
        assertThat(captor.getValue().getLogs()).hasSize(1);
    }

    @Test
    void resolvingUnknownFailureIsNotFound() throws Exception {
        when(failureService.resolve(eq(404L), any(), anyBoolean())).thenThrow(new NotFoundException("Sync failure 404 not found"));

        mvc.perform(post("/api/sync/failures/404/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution_note\":\"checked\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }
}

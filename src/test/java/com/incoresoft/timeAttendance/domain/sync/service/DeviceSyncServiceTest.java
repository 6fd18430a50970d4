package com.incoresoft.timeAttendance.domain.sync.service;

import com.incoresoft.timeAttendance.config.DeviceProps;
import com.incoresoft.timeAttendance.domain.attendance.dto.BatchReconciliationResult;
import com.incoresoft.timeAttendance.domain.attendance.dto.EmployeeDay;
import com.incoresoft.timeAttendance.domain.attendance.service.DailyReconciler;
import com.incoresoft.timeAttendance.domain.scan.dto.IngestionResult;
import com.incoresoft.timeAttendance.domain.scan.dto.TerminalRecordDto;
import com.incoresoft.timeAttendance.domain.scan.service.ScanIngestionService;
import com.incoresoft.timeAttendance.domain.sync.dto.AgentSyncRequest;
import com.incoresoft.timeAttendance.domain.sync.dto.DeviceSettings;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncErrorKind;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncResult;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncState;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncStatus;
import com.incoresoft.timeAttendance.repository.DeviceSettingsRepository;
import com.incoresoft.timeAttendance.repository.TerminalApiRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class DeviceSyncServiceTest {
    private static final String ADDRESS = "http://192.168.11.253:4370";

    private DeviceSettingsRepository deviceRepository;
    private TerminalApiRepository terminal;
    private ScanIngestionService ingestion;
    private DailyReconciler reconciler;
    private SyncFailureService failureService;
    private DeviceSyncService service;
    private DeviceSettings device;

    @BeforeEach
    void setUp() {
        deviceRepository = mock(DeviceSettingsRepository.class);
        terminal = mock(TerminalApiRepository.class);
        ingestion = mock(ScanIngestionService.class);
        reconciler = mock(DailyReconciler.class);
        failureService = mock(SyncFailureService.class);

        RetryTemplate retry = RetryTemplate.builder()
                .maxAttempts(3)
                .noBackoff()
                .retryOn(ResourceAccessException.class)
                .build();
        service = new DeviceSyncService(deviceRepository, terminal, retry, ingestion, reconciler, failureService, new DeviceProps());

        device = new DeviceSettings();
        device.setId(1L);
        device.setDeviceAddress(ADDRESS);
        device.setLastSyncAt(LocalDateTime.of(2025, 1, 13, 8, 0));
        when(reconciler.reconcileDays(anyCollection())).thenReturn(new BatchReconciliationResult());
    }

    private static IngestionResult ingested(int added, LocalDateTime newest) {
        IngestionResult r = new IngestionResult();
        r.setRecordsAdded(added);
        if (newest != null) r.seen(newest);
        return r;
    }

    @Test
    void missingDeviceIsConfigError() {
        when(deviceRepository.findFirstByActiveTrueOrderByIdAsc()).thenReturn(Optional.empty());

        SyncResult result = service.sync();

        assertThat(result.getStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(service.getState()).isEqualTo(SyncState.FAILED);
        verify(failureService).record(eq(SyncErrorKind.CONFIG_ERROR), anyString(), isNull(), isNull(), isNull());
        verifyNoInteractions(terminal, ingestion);
    }

    @Test
    void unreachableDeviceIsRetriedThenConnectionError() {
        when(deviceRepository.findFirstByActiveTrueOrderByIdAsc()).thenReturn(Optional.of(device));
        when(terminal.getAllAttendanceSince(eq(ADDRESS), any(), anyInt()))
                .thenThrow(new ResourceAccessException("Connection refused"));

        SyncResult result = service.sync();

        assertThat(result.getStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(result.getErrors()).hasSize(1);
        verify(terminal, times(3)).getAllAttendanceSince(eq(ADDRESS), any(), anyInt());
        verify(failureService).record(eq(SyncErrorKind.CONNECTION_ERROR), anyString(), eq(ADDRESS), isNull(), isNull());
        verifyNoInteractions(ingestion);
        assertThat(device.getLastSyncAt()).isEqualTo(LocalDateTime.of(2025, 1, 13, 8, 0));
    }

    @Test
    void successfulSyncAdvancesWatermarkAndReconcilesTouchedDays() {
        LocalDateTime newest = LocalDateTime.of(2025, 1, 13, 18, 5);
        List<TerminalRecordDto> records = List.of(new TerminalRecordDto("7", newest, 1));
        when(deviceRepository.findFirstByActiveTrueOrderByIdAsc()).thenReturn(Optional.of(device));
        when(terminal.getAllAttendanceSince(ADDRESS, device.getLastSyncAt(), 500)).thenReturn(records);
        IngestionResult ingestionResult = ingested(1, newest);
        ingestionResult.getTouchedDays().add(new EmployeeDay(3L, LocalDate.of(2025, 1, 13)));
        when(ingestion.ingest(ADDRESS, records)).thenReturn(ingestionResult);
        BatchReconciliationResult reconciliation = new BatchReconciliationResult();
        reconciliation.setReconciled(1);
        when(reconciler.reconcileDays(ingestionResult.getTouchedDays())).thenReturn(reconciliation);

        SyncResult result = service.sync();

        assertThat(result.getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(result.getRecordsAdded()).isEqualTo(1);
        assertThat(result.getDaysReconciled()).isEqualTo(1);
        assertThat(device.getLastSyncAt()).isEqualTo(newest);
        verify(deviceRepository).save(device);
        assertThat(service.getState()).isEqualTo(SyncState.IDLE);
        assertThat(service.getLastResult()).contains(result);
    }

    @Test
    void failedBatchKeepsWatermark() {
        LocalDateTime newest = LocalDateTime.of(2025, 1, 13, 18, 5);
        when(deviceRepository.findFirstByActiveTrueOrderByIdAsc()).thenReturn(Optional.of(device));
        when(terminal.getAllAttendanceSince(eq(ADDRESS), any(), anyInt())).thenReturn(List.of());
        IngestionResult ingestionResult = ingested(0, newest);
        ingestionResult.getErrors().add("Batch of 100 scans starting at offset 0 failed: db down");
        when(ingestion.ingest(eq(ADDRESS), any())).thenReturn(ingestionResult);

        SyncResult result = service.sync();

        assertThat(result.getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(result.getErrors()).hasSize(1);
        assertThat(device.getLastSyncAt()).isEqualTo(LocalDateTime.of(2025, 1, 13, 8, 0));
        verify(deviceRepository, never()).save(any());
    }

    @Test
    void reconciliationFailuresAreRecordedAndReported() {
        when(deviceRepository.findFirstByActiveTrueOrderByIdAsc()).thenReturn(Optional.of(device));
        when(terminal.getAllAttendanceSince(eq(ADDRESS), any(), anyInt())).thenReturn(List.of());
        when(ingestion.ingest(eq(ADDRESS), any())).thenReturn(ingested(0, null));
        BatchReconciliationResult reconciliation = new BatchReconciliationResult();
        reconciliation.fail(new EmployeeDay(3L, LocalDate.of(2025, 1, 13)), "lock timeout");
        when(reconciler.reconcileDays(anyCollection())).thenReturn(reconciliation);

        SyncResult result = service.sync();

        assertThat(result.getErrors()).singleElement().asString().contains("employee 3");
        verify(failureService).record(eq(SyncErrorKind.RECONCILIATION_ERROR), anyString(), eq(ADDRESS), eq("3"), isNull());
    }

    @Test
    void concurrentSyncReturnsAlreadyRunning() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(deviceRepository.findFirstByActiveTrueOrderByIdAsc()).thenReturn(Optional.of(device));
        when(terminal.getAllAttendanceSince(eq(ADDRESS), any(), anyInt())).thenAnswer(inv -> {
            fetching.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        when(ingestion.ingest(eq(ADDRESS), any())).thenReturn(ingested(0, null));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SyncResult> first = executor.submit(service::sync);
            assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(service.isRunning()).isTrue();
            SyncResult second = service.sync();
            assertThat(second.getStatus()).isEqualTo(SyncStatus.ALREADY_RUNNING);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(SyncStatus.SUCCESS);
        } finally {
            executor.shutdownNow();
        }
        assertThat(service.isRunning()).isFalse();
        verify(terminal, times(1)).getAllAttendanceSince(eq(ADDRESS), any(), anyInt());
    }

    @Test
    void agentPushIsIngestedUnderAgentAddress() {
        AgentSyncRequest request = new AgentSyncRequest();
        request.setDeviceId("gate-1");
        request.setLogs(List.of(new TerminalRecordDto("7", LocalDateTime.of(2025, 1, 13, 9, 0), 0)));
        when(ingestion.ingest("agent:gate-1", request.getLogs())).thenReturn(ingested(1, null));

        SyncResult result = service.acceptAgentPush(request);

        assertThat(result.getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(result.getRecordsAdded()).isEqualTo(1);
        verifyNoInteractions(terminal);
        assertThat(service.getState()).isEqualTo(SyncState.IDLE);
    }

    @Test
    void scheduledSyncSkipsWhenAutoSyncDisabled() {
        DeviceProps props = new DeviceProps();
        props.setAutoSync(false);
        DeviceSyncService manualOnly = new DeviceSyncService(deviceRepository, terminal, RetryTemplate.defaultInstance(),
                ingestion, reconciler, failureService, props);

        manualOnly.scheduledSync();

        verifyNoInteractions(deviceRepository);
    }
}

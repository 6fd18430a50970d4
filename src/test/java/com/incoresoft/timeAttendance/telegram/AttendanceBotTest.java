package com.incoresoft.timeAttendance.telegram;

import com.incoresoft.timeAttendance.config.NotificationProps;
import com.incoresoft.timeAttendance.domain.report.dto.EmployeeReport;
import com.incoresoft.timeAttendance.domain.report.dto.SummaryMetrics;
import com.incoresoft.timeAttendance.domain.report.service.ReportAggregator;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncResult;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncStatus;
import com.incoresoft.timeAttendance.domain.sync.service.DeviceSyncService;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AttendanceBotTest {

    @Test
    void parsesSummaryCommand() {
        assertThat(AttendanceBot.parseSummaryCommand("/summary 12 01/01/2025 01/31/2025"))
                .contains(new AttendanceBot.SummaryCommand(12L, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)));
    }

    @Test
    void rejectsMalformedSummaryCommands() {
        assertThat(AttendanceBot.parseSummaryCommand("/summary 12 2025-01-01 2025-01-31")).isEmpty();
        assertThat(AttendanceBot.parseSummaryCommand("/summary 12 02/30/2025 03/01/2025")).isEmpty();
        assertThat(AttendanceBot.parseSummaryCommand("/summary 12 01/31/2025 01/01/2025")).isEmpty();
        assertThat(AttendanceBot.parseSummaryCommand("/summary abc 01/01/2025 01/31/2025")).isEmpty();
        assertThat(AttendanceBot.parseSummaryCommand("/summary 12 01/01/2025")).isEmpty();
        assertThat(AttendanceBot.parseSummaryCommand(null)).isEmpty();
    }

    @Test
    void formatsSummary() {
        SummaryMetrics metrics = new SummaryMetrics(31, 24, 20, 2, 3, 1, 1, 2.5, 0, 1, 83.3, -1.5);
        EmployeeReport report = new EmployeeReport(12L, "Asha Rao",
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), metrics, List.of());

        String text = AttendanceBot.formatSummary(report);

        assertThat(text).startsWith("Asha Rao\n01/01/2025 - 01/31/2025");
        assertThat(text).contains("Present: 20 / 24 working days (83.3%)");
        assertThat(text).contains("Leave: annual 3, unpaid 1, paid 1");
        assertThat(text).contains("Permission: 2.50 h");
        assertThat(text).endsWith("Extra time: -1.5 h");
    }

    @Test
    void formatsSyncResult() {
        SyncResult result = SyncResult.builder()
                .status(SyncStatus.SUCCESS)
                .recordsAdded(5)
                .duplicates(1)
                .unmatched(2)
                .error("batch failed")
                .build();

        assertThat(AttendanceBot.formatSync(result))
                .isEqualTo("Status: success\nAdded: 5, duplicates: 1, unmatched: 2\nErrors: 1");
    }

    private static Update message(long chatId, String text) {
        Chat chat = new Chat();
        chat.setId(chatId);
        Message message = new Message();
        message.setChat(chat);
        message.setText(text);
        Update update = new Update();
        update.setMessage(message);
        return update;
    }

    @Test
    void ignoresCommandsFromNonAdminChats() throws Exception {
        DeviceSyncService syncService = mock(DeviceSyncService.class);
        NotificationProps props = new NotificationProps();
        props.setAdminChatIds(List.of(10L));
        AttendanceBot bot = spy(new AttendanceBot(syncService, mock(ReportAggregator.class), props));
        doNothing().when(bot).sendText(anyLong(), anyString());

        bot.onUpdateReceived(message(99L, "/sync"));

        verifyNoInteractions(syncService);
        verify(bot).sendText(eq(99L), contains("restricted"));
    }

    @Test
    void adminCanRunSync() throws Exception {
        DeviceSyncService syncService = mock(DeviceSyncService.class);
        when(syncService.sync()).thenReturn(SyncResult.alreadyRunning());
        NotificationProps props = new NotificationProps();
        props.setAdminChatIds(List.of(10L));
        AttendanceBot bot = spy(new AttendanceBot(syncService, mock(ReportAggregator.class), props));
        doNothing().when(bot).sendText(anyLong(), anyString());

        bot.onUpdateReceived(message(10L, "/sync"));

        verify(syncService).sync();
        verify(bot).sendText(eq(10L), contains("already_running"));
    }
}

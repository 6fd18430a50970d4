package com.incoresoft.timeAttendance.telegram;

import com.incoresoft.timeAttendance.config.NotificationProps;
import com.incoresoft.timeAttendance.domain.report.dto.EmployeeReport;
import com.incoresoft.timeAttendance.domain.report.dto.SummaryMetrics;
import com.incoresoft.timeAttendance.domain.report.service.ReportAggregator;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncResult;
import com.incoresoft.timeAttendance.domain.sync.service.DeviceSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * Admin bot: runs syncs, shows sync state, prints summaries, and is the sink for
 * failure alerts. Only chats listed in notification.admin-chat-ids are served.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "telegram.bot.enabled", havingValue = "true")
public class AttendanceBot extends TelegramLongPollingBot {

    @Value("${telegram.bot.username}")
    private String botUsername;

    @Value("${telegram.bot.token}")
    private String botToken;

    private final DeviceSyncService syncService;
    private final ReportAggregator reportAggregator;
    private final NotificationProps notificationProps;

    private static final DateTimeFormatter MM_DD_YYYY =
            DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT);

    private static final String HELP = """
            Commands:
            /sync - pull new scans from the terminal
            /status - current sync state
            /summary <employeeId> <MM/DD/YYYY> <MM/DD/YYYY> - attendance summary
            """;

    /** Parsed /summary arguments. */
    public record SummaryCommand(Long employeeId, LocalDate start, LocalDate end) {
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update == null || !update.hasMessage() || !update.getMessage().hasText()) return;
        Long chatId = update.getMessage().getChatId();
        String text = update.getMessage().getText().trim();
        try {
            if (!notificationProps.getAdminChatIds().contains(chatId)) {
                log.warn("Ignoring message from non-admin chat {}", chatId);
                sendText(chatId, "This bot is restricted to administrators.");
                return;
            }
            handleCommand(chatId, text);
        } catch (Exception ex) {
            log.error("Error processing update: {}", ex.getMessage(), ex);
        }
    }

    private void handleCommand(Long chatId, String text) throws TelegramApiException {
        String command = text.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        switch (command) {
            case "/sync" -> {
                sendText(chatId, "Sync started. Wait a minute.");
                sendText(chatId, formatSync(syncService.sync()));
            }
            case "/status" -> {
                String last = syncService.getLastResult().map(AttendanceBot::formatSync).orElse("No sync yet.");
                sendText(chatId, "State: " + syncService.getState() + "\nLast result:\n" + last);
            }
            case "/summary" -> {
                Optional<SummaryCommand> parsed = parseSummaryCommand(text);
                if (parsed.isEmpty()) {
                    sendText(chatId, "Usage: /summary <employeeId> <MM/DD/YYYY> <MM/DD/YYYY>");
                    return;
                }
                SummaryCommand cmd = parsed.get();
                try {
                    EmployeeReport report = reportAggregator.aggregate(cmd.employeeId(), cmd.start(), cmd.end());
                    sendText(chatId, formatSummary(report));
                } catch (Exception ex) {
                    log.error("Summary for employee {} failed: {}", cmd.employeeId(), ex.getMessage(), ex);
                    sendText(chatId, "Failed to build summary: " + ex.getMessage());
                }
            }
            default -> sendText(chatId, HELP);
        }
    }

    public void sendText(Long chatId, String text) throws TelegramApiException {
        execute(new SendMessage(chatId.toString(), text));
    }

    /** Accepts "/summary 12 01/01/2025 01/31/2025" with dates only as MM/DD/YYYY. */
    public static Optional<SummaryCommand> parseSummaryCommand(String text) {
        if (text == null) return Optional.empty();
        String[] parts = text.trim().split("\\s+");
        if (parts.length != 4 || !"/summary".equalsIgnoreCase(parts[0])) return Optional.empty();
        try {
            Long employeeId = Long.valueOf(parts[1]);
            LocalDate start = LocalDate.parse(parts[2], MM_DD_YYYY);
            LocalDate end = LocalDate.parse(parts[3], MM_DD_YYYY);
            if (start.isAfter(end)) return Optional.empty();
            return Optional.of(new SummaryCommand(employeeId, start, end));
        } catch (RuntimeException ex) {
            return Optional.empty();
        }
    }

    public static String formatSummary(EmployeeReport report) {
        SummaryMetrics m = report.summary();
        String name = report.employeeName() != null ? report.employeeName() : ("Employee " + report.employeeId());
        return String.format(Locale.ROOT, """
                        %s
                        %s - %s
                        Present: %d / %d working days (%.1f%%)
                        Absent: %d
                        Leave: annual %d, unpaid %d, paid %d
                        Permission: %.2f h
                        Days off: %d
                        Incomplete days: %d
                        Extra time: %+.1f h""",
                name,
                report.startDate().format(MM_DD_YYYY), report.endDate().format(MM_DD_YYYY),
                m.presentDays(), m.totalWorkingDays(), m.attendancePercentage(),
                m.absentDays(),
                m.annualLeaveDays(), m.unpaidLeaveDays(), m.paidLeaveDays(),
                m.permissionHours(),
                m.dayOffDays(),
                m.incompleteDays(),
                m.extraTimeHours());
    }

    static String formatSync(SyncResult result) {
        StringBuilder sb = new StringBuilder()
                .append("Status: ").append(result.getStatus().code())
                .append("\nAdded: ").append(result.getRecordsAdded())
                .append(", duplicates: ").append(result.getDuplicates())
                .append(", unmatched: ").append(result.getUnmatched());
        if (result.getMessage() != null) sb.append("\n").append(result.getMessage());
        if (!result.getErrors().isEmpty()) sb.append("\nErrors: ").append(result.getErrors().size());
        return sb.toString();
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public String getBotToken() {
        return botToken;
    }
}

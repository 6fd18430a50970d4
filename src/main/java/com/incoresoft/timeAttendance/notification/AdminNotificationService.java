package com.incoresoft.timeAttendance.notification;

import com.incoresoft.timeAttendance.config.NotificationProps;
import com.incoresoft.timeAttendance.telegram.AttendanceBot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * Sends operational alerts to administrators over Telegram. Without a bot the alert is
 * only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminNotificationService {
    private final NotificationProps props;
    private final ObjectProvider<AttendanceBot> bot;

    public void notifyAdmins(String message) {
        notify(props.getAdminChatIds(), message);
    }

    public void notify(Collection<Long> chatIds, String message) {
        AttendanceBot sink = bot.getIfAvailable();
        if (sink == null || chatIds == null || chatIds.isEmpty()) {
            log.warn("[NOTIFY] No admin chat configured, alert not delivered: {}", message);
            return;
        }
        for (Long chatId : chatIds) {
            try {
                sink.sendText(chatId, message);
            } catch (Exception ex) {
                log.error("[NOTIFY] Failed to alert chat {}: {}", chatId, ex.getMessage(), ex);
            }
        }
    }
}

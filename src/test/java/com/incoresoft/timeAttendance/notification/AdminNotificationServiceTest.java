package com.incoresoft.timeAttendance.notification;

import com.incoresoft.timeAttendance.config.NotificationProps;
import com.incoresoft.timeAttendance.telegram.AttendanceBot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AdminNotificationServiceTest {

    @SuppressWarnings("unchecked")
    private static ObjectProvider<AttendanceBot> provider(AttendanceBot bot) {
        ObjectProvider<AttendanceBot> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(bot);
        return provider;
    }

    private static NotificationProps admins(Long... chatIds) {
        NotificationProps props = new NotificationProps();
        props.setAdminChatIds(List.of(chatIds));
        return props;
    }

    @Test
    void sendsToEveryAdminChat() throws Exception {
        AttendanceBot bot = mock(AttendanceBot.class);

        new AdminNotificationService(admins(10L, 20L), provider(bot)).notifyAdmins("Device unreachable");

        verify(bot).sendText(10L, "Device unreachable");
        verify(bot).sendText(20L, "Device unreachable");
    }

    @Test
    void failingChatDoesNotStopOthers() throws Exception {
        AttendanceBot bot = mock(AttendanceBot.class);
        doThrow(new TelegramApiException("blocked")).when(bot).sendText(10L, "alert");

        new AdminNotificationService(admins(10L, 20L), provider(bot)).notifyAdmins("alert");

        verify(bot).sendText(20L, "alert");
    }

    @Test
    void withoutBotOrChatsNothingIsSent() throws Exception {
        AttendanceBot bot = mock(AttendanceBot.class);

        new AdminNotificationService(admins(), provider(bot)).notifyAdmins("alert");
        new AdminNotificationService(admins(10L), provider(null)).notifyAdmins("alert");

        verify(bot, never()).sendText(anyLong(), anyString());
    }
}

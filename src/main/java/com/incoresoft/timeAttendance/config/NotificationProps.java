package com.incoresoft.timeAttendance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "notification")
public class NotificationProps {
    /**
     * Telegram chats that receive sync failure alerts and may run admin commands.
     */
    private List<Long> adminChatIds = new ArrayList<>();
}

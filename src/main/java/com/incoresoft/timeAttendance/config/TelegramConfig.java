package com.incoresoft.timeAttendance.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.util.List;

// Registers every long-polling bot bean. Disabled unless telegram.bot.enabled=true.
@Configuration
@ConditionalOnProperty(name = "telegram.bot.enabled", havingValue = "true")
public class TelegramConfig {
    @Bean
    public TelegramBotsApi telegramBotsApi(List<TelegramLongPollingBot> bots) throws TelegramApiException {
        TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
        for (TelegramLongPollingBot bot : bots) {
            api.registerBot(bot);
        }
        return api;
    }
}

package org.moviebot.config;

import lombok.extern.slf4j.Slf4j;
import org.moviebot.service.TelegramBotService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Connects the bot to Telegram on startup, by webhook or by long polling depending on
 * {@code bot.webhook.enabled}.
 */
@Slf4j
@Configuration
public class BotRegistrationConfig {

    @Bean
    CommandLineRunner registerBot(TelegramBotService telegramBotService, BotProperties botProperties) {
        return args -> {
            if (botProperties.getToken() == null || botProperties.getToken().isBlank()) {
                log.error("No bot token configured, the bot will not receive updates");
                return;
            }
            try {
                if (botProperties.getWebhook().isEnabled()) {
                    telegramBotService.registerWebhook();
                } else {
                    TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
                    botsApi.registerBot(telegramBotService);
                    log.info("Bot {} started with long polling", botProperties.getUsername());
                }
            } catch (TelegramApiException e) {
                log.error("Failed to register the bot with Telegram: {}", e.getMessage(), e);
            }
        };
    }

    /**
     * Runs webhook updates off the request thread. A saturated pool falls back to the caller.
     */
    @Bean("updateExecutor")
    @ConditionalOnProperty(prefix = "bot.webhook", name = "enabled", havingValue = "true")
    TaskExecutor updateExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("bot-update-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}

package org.moviebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviebot.config.BotProperties;
import org.moviebot.model.BroadcastResult;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

/**
 * Sends one admin message to every known user. A recipient that cannot be reached is counted and
 * skipped, the rest still get the message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastService {

    private final UserService userService;
    private final BotProperties botProperties;

    @FunctionalInterface
    public interface RecipientSender {
        void send(Long chatId, String text) throws TelegramApiException;
    }

    public List<Long> recipients() {
        return userService.getAllUserIds();
    }

    public BroadcastResult broadcast(List<Long> recipients, String text, RecipientSender sender) {
        int success = 0;
        int failures = 0;
        for (Long chatId : recipients) {
            try {
                sender.send(chatId, text);
                success++;
            } catch (TelegramApiException | RuntimeException e) {
                log.warn("Failed to send broadcast to user {}: {}", chatId, e.getMessage());
                failures++;
            }
            pause();
        }
        log.info("Broadcast finished: {} sent, {} failed", success, failures);
        return new BroadcastResult(success, failures);
    }

    private void pause() {
        long delay = botProperties.getBroadcastDelay().toMillis();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Broadcast interrupted", e);
        }
    }
}

package org.moviebot.controller;

import lombok.extern.slf4j.Slf4j;
import org.moviebot.config.BotProperties;
import org.moviebot.service.TelegramBotService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Receives pushed updates when the bot runs in webhook mode. Updates are acknowledged at once and
 * handled on the update executor, since Telegram redelivers an update whose request runs too long.
 */
@Slf4j
@RestController
@ConditionalOnProperty(prefix = "bot.webhook", name = "enabled", havingValue = "true")
public class WebhookController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final TelegramBotService telegramBotService;
    private final BotProperties botProperties;
    private final TaskExecutor updateExecutor;

    public WebhookController(TelegramBotService telegramBotService,
                             BotProperties botProperties,
                             @Qualifier("updateExecutor") TaskExecutor updateExecutor) {
        this.telegramBotService = telegramBotService;
        this.botProperties = botProperties;
        this.updateExecutor = updateExecutor;
    }

    @PostMapping("${bot.webhook.path:/webhook}")
    public ResponseEntity<Void> onUpdate(@RequestBody Update update,
                                         @RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        String expected = botProperties.getWebhook().getSecret();
        if (!expected.isBlank() && !expected.equals(secret)) {
            log.warn("Rejected webhook call {} with a wrong secret token", update.getUpdateId());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        updateExecutor.execute(() -> telegramBotService.onUpdateReceived(update));
        return ResponseEntity.ok().build();
    }
}

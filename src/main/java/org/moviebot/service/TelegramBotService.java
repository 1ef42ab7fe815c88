package org.moviebot.service;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviebot.config.BotProperties;
import org.moviebot.model.BotAction;
import org.moviebot.model.BotReply;
import org.moviebot.model.BroadcastResult;
import org.moviebot.model.CallbackAnswer;
import org.moviebot.model.MovieSummary;
import org.moviebot.util.MessageFormatter;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.AnswerInlineQuery;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageReplyMarkup;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.inlinequery.InlineQuery;
import org.telegram.telegrambots.meta.api.objects.inlinequery.inputmessagecontent.InputTextMessageContent;
import org.telegram.telegrambots.meta.api.objects.inlinequery.result.InlineQueryResult;
import org.telegram.telegrambots.meta.api.objects.inlinequery.result.InlineQueryResultArticle;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Telegram front end: turns updates into calls on {@link CommandProcessingService} and sends the
 * answers back. Every handler absorbs its own failures so one bad update never stops the bot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramBotService extends TelegramLongPollingBot {

    private final CommandProcessingService commandProcessingService;
    private final UserService userService;
    private final BroadcastService broadcastService;
    private final MessageFormatter messageFormatter;
    private final BotProperties botProperties;

    private final Map<String, Consumer<Message>> commandHandlers = new HashMap<>();

    @PostConstruct
    public void init() {
        log.info("Bot username: {}", botProperties.getUsername());

        register("start", message -> sendReply(message.getChatId(), commandProcessingService.start()));
        register("help", message -> sendReply(message.getChatId(), commandProcessingService.start()));
        register("contactus", message -> sendReply(message.getChatId(), commandProcessingService.contact()));
        register("search", message -> sendReply(message.getChatId(),
                commandProcessingService.searchMovie(message.getFrom().getId(), argument(message))));
        register("id", message -> sendReply(message.getChatId(),
                commandProcessingService.searchById(message.getFrom().getId(), argument(message))));
        register("trending", message -> sendReply(message.getChatId(), commandProcessingService.trending()));
        register("popular", message -> sendReply(message.getChatId(), commandProcessingService.popular()));
        register("favorites", message -> sendReply(message.getChatId(),
                commandProcessingService.favorites(message.getFrom().getId())));
        register("stats", message -> sendReply(message.getChatId(),
                commandProcessingService.statistics(message.getFrom().getId())));
        register("broadcast", this::handleBroadcastCommand);
    }

    @Override
    public String getBotUsername() {
        return botProperties.getUsername();
    }

    @Override
    public String getBotToken() {
        return botProperties.getToken();
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update.hasInlineQuery()) {
            handleInlineQuery(update.getInlineQuery());
        } else if (update.hasCallbackQuery()) {
            handleCallbackQuery(update.getCallbackQuery());
        } else if (update.hasMessage() && update.getMessage().hasText()) {
            handleCommand(update.getMessage());
        }
    }

    /**
     * Points Telegram at our webhook endpoint instead of long polling.
     */
    public void registerWebhook() throws TelegramApiException {
        BotProperties.Webhook webhook = botProperties.getWebhook();
        SetWebhook setWebhook = SetWebhook.builder()
                .url(webhook.getEndpoint())
                .secretToken(webhook.getSecret().isBlank() ? null : webhook.getSecret())
                .build();
        execute(setWebhook);
        log.info("Webhook registered at {}", webhook.getEndpoint());
    }

    private void register(String command, Consumer<Message> handler) {
        commandHandlers.put(command, handler);
    }

    private void handleCommand(Message message) {
        String text = message.getText().trim();
        if (!text.startsWith("/")) {
            return;
        }
        String command = commandName(text);
        Consumer<Message> handler = commandHandlers.get(command);
        if (handler == null) {
            log.debug("Ignoring unknown command {}", command);
            return;
        }

        try {
            if (message.getFrom() != null) {
                userService.registerUser(message.getFrom());
            }
            handler.accept(message);
        } catch (Exception e) {
            log.error("Error in /{} for user {}: {}", command, userId(message.getFrom()), e.getMessage(), e);
            sendResponse(message.getChatId(), MessageFormatter.GENERIC_ERROR, null);
        }
    }

    private void handleBroadcastCommand(Message message) {
        Long chatId = message.getChatId();
        if (!userService.isAdmin(message.getFrom().getId())) {
            log.warn("User {} tried to broadcast without admin rights", message.getFrom().getId());
            sendResponse(chatId, MessageFormatter.ADMIN_ONLY, null);
            return;
        }

        String text = argument(message);
        if (text.isEmpty()) {
            sendResponse(chatId, messageFormatter.broadcastUsage(), null);
            return;
        }

        List<Long> recipients = broadcastService.recipients();
        sendResponse(chatId, messageFormatter.broadcastStarted(recipients.size()), null);
        BroadcastResult result = broadcastService.broadcast(recipients, messageFormatter.broadcastEnvelope(text),
                (recipient, envelope) -> execute(markdownMessage(recipient, envelope, null)));
        sendResponse(chatId, messageFormatter.broadcastFinished(result.getSuccess(), result.getFailures()), null);
    }

    private void handleCallbackQuery(CallbackQuery query) {
        String data = query.getData() == null ? "" : query.getData();
        Long userId = query.getFrom().getId();
        try {
            if (data.startsWith(MessageFormatter.FAVORITE_PREFIX)) {
                answer(query, commandProcessingService.addFavorite(userId, data.substring(MessageFormatter.FAVORITE_PREFIX.length())));
            } else if (data.startsWith(MessageFormatter.REMOVE_PREFIX)) {
                CallbackAnswer answer = commandProcessingService.removeFavorite(userId, data.substring(MessageFormatter.REMOVE_PREFIX.length()));
                if (answer.replacesKeyboard() && query.getMessage() != null) {
                    replaceKeyboard(query.getMessage().getChatId(), query.getMessage().getMessageId(),
                            answer.getReplacementActions());
                }
                answer(query, answer);
            } else if (data.startsWith(MessageFormatter.VIEW_PREFIX)) {
                handleViewFavorite(query, data.substring(MessageFormatter.VIEW_PREFIX.length()));
            } else {
                log.debug("Ignoring callback data {}", data);
            }
        } catch (Exception e) {
            log.error("Error in callback {} for user {}: {}", data, userId, e.getMessage(), e);
            answer(query, CallbackAnswer.alert("❌ Error processing your request"));
        }
    }

    private void handleViewFavorite(CallbackQuery query, String movieId) {
        commandProcessingService.viewFavorite(movieId).ifPresentOrElse(
                reply -> {
                    answer(query, null);
                    if (query.getMessage() != null) {
                        sendReply(query.getMessage().getChatId(), reply);
                    } else {
                        sendReply(query.getFrom().getId(), reply);
                    }
                },
                () -> answer(query, CallbackAnswer.alert("Movie Not Found!")));
    }

    private void handleInlineQuery(InlineQuery inlineQuery) {
        try {
            List<MovieSummary> movies = commandProcessingService.inlineSearch(inlineQuery.getQuery());
            if (movies.isEmpty()) {
                return;
            }

            List<InlineQueryResult> results = movies.stream()
                    .map(movie -> (InlineQueryResult) InlineQueryResultArticle.builder()
                            .id(String.valueOf(movie.getId()))
                            .title(messageFormatter.inlineTitle(movie))
                            .description(messageFormatter.inlineDescription(movie))
                            .inputMessageContent(InputTextMessageContent.builder()
                                    .messageText(messageFormatter.inlineMessage(movie))
                                    .parseMode(ParseMode.MARKDOWN)
                                    .build())
                            .build())
                    .toList();

            execute(AnswerInlineQuery.builder()
                    .inlineQueryId(inlineQuery.getId())
                    .results(results)
                    .build());
        } catch (Exception e) {
            log.error("Error in inline query '{}' from user {}: {}",
                    inlineQuery.getQuery(), userId(inlineQuery.getFrom()), e.getMessage(), e);
        }
    }

    private void sendReply(Long chatId, BotReply reply) {
        InlineKeyboardMarkup keyboard = keyboard(reply.getActions());
        if (reply.hasPhoto()) {
            SendPhoto photo = new SendPhoto();
            photo.setChatId(chatId.toString());
            photo.setPhoto(new InputFile(reply.getPhotoUrl()));
            photo.setCaption(reply.getText());
            photo.setParseMode(ParseMode.MARKDOWN);
            photo.setReplyMarkup(keyboard);
            try {
                execute(photo);
                return;
            } catch (TelegramApiException e) {
                log.warn("Failed to send photo to chat {}, falling back to text: {}", chatId, e.getMessage());
            }
        }
        sendResponse(chatId, reply.getText(), keyboard);
    }

    /**
     * Sends Markdown first. Telegram rejects text with unbalanced entities (a stray {@code _} in a title),
     * so a failed send is repeated once as plain text.
     */
    private void sendResponse(Long chatId, String text, InlineKeyboardMarkup keyboard) {
        try {
            execute(markdownMessage(chatId, text, keyboard));
            return;
        } catch (TelegramApiException e) {
            log.warn("Failed to send Markdown message to chat {}, retrying as plain text: {}", chatId, e.getMessage());
        }
        try {
            execute(textMessage(chatId, text, keyboard, null));
        } catch (TelegramApiException e) {
            log.error("Failed to send message to chat {}: {}", chatId, e.getMessage());
        }
    }

    private void answer(CallbackQuery query, CallbackAnswer answer) {
        AnswerCallbackQuery answerCallbackQuery = new AnswerCallbackQuery();
        answerCallbackQuery.setCallbackQueryId(query.getId());
        if (answer != null) {
            answerCallbackQuery.setText(answer.getText());
            answerCallbackQuery.setShowAlert(true);
        }
        try {
            execute(answerCallbackQuery);
        } catch (TelegramApiException e) {
            log.error("Failed to answer callback {}: {}", query.getId(), e.getMessage());
        }
    }

    private void replaceKeyboard(Long chatId, Integer messageId, List<BotAction> actions) {
        EditMessageReplyMarkup edit = new EditMessageReplyMarkup();
        edit.setChatId(chatId.toString());
        edit.setMessageId(messageId);
        edit.setReplyMarkup(keyboard(actions));
        try {
            execute(edit);
        } catch (TelegramApiException e) {
            log.warn("Failed to update keyboard of message {}: {}", messageId, e.getMessage());
        }
    }

    private static SendMessage markdownMessage(Long chatId, String text, InlineKeyboardMarkup keyboard) {
        return textMessage(chatId, text, keyboard, ParseMode.MARKDOWN);
    }

    private static SendMessage textMessage(Long chatId, String text, InlineKeyboardMarkup keyboard, String parseMode) {
        SendMessage message = new SendMessage();
        message.setChatId(chatId.toString());
        message.setText(text);
        message.setParseMode(parseMode);
        message.setReplyMarkup(keyboard);
        return message;
    }

    private static InlineKeyboardMarkup keyboard(List<BotAction> actions) {
        if (actions == null || actions.isEmpty()) {
            return null;
        }
        // one button per row
        List<List<InlineKeyboardButton>> rows = actions.stream()
                .map(action -> List.of(toButton(action)))
                .toList();
        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        markup.setKeyboard(rows);
        return markup;
    }

    private static InlineKeyboardButton toButton(BotAction action) {
        InlineKeyboardButton button = new InlineKeyboardButton();
        button.setText(action.getLabel());
        if (action.isLink()) {
            button.setUrl(action.getUrl());
        } else {
            button.setCallbackData(action.getCallbackData());
        }
        return button;
    }

    static String commandName(String text) {
        String token = text.split("\\s+", 2)[0].substring(1);
        int mention = token.indexOf('@');
        return (mention >= 0 ? token.substring(0, mention) : token).toLowerCase();
    }

    static String argument(Message message) {
        String[] parts = message.getText().trim().split("\\s+", 2);
        return parts.length > 1 ? parts[1].trim() : "";
    }

    private static Object userId(User user) {
        return user != null ? user.getId() : "unknown";
    }
}

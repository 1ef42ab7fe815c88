package org.moviebot.model;

import lombok.Value;

import java.util.List;

/**
 * Transport-neutral answer to a command. A reply with a photo is sent as a captioned picture,
 * everything else as a Markdown text message.
 */
@Value
public class BotReply {
    String text;
    String photoUrl;
    List<BotAction> actions;

    public static BotReply text(String text) {
        return new BotReply(text, null, List.of());
    }

    public static BotReply text(String text, List<BotAction> actions) {
        return new BotReply(text, null, actions);
    }

    public static BotReply movie(MovieView view, String posterUrl) {
        return new BotReply(view.getText(), posterUrl, view.getActions());
    }

    public boolean hasPhoto() {
        return photoUrl != null;
    }
}

package org.moviebot.model;

import lombok.Value;

/**
 * An inline button: either a callback handled by the bot or a plain link.
 */
@Value
public class BotAction {
    String label;
    String callbackData;
    String url;

    public static BotAction callback(String label, String callbackData) {
        return new BotAction(label, callbackData, null);
    }

    public static BotAction link(String label, String url) {
        return new BotAction(label, null, url);
    }

    public boolean isLink() {
        return url != null;
    }
}

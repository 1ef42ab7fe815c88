package org.moviebot.model;

import lombok.Value;

import java.util.List;

/**
 * Alert shown after a button press, optionally with a new keyboard for the pressed message.
 */
@Value
public class CallbackAnswer {
    String text;
    List<BotAction> replacementActions; // null keeps the current keyboard

    public static CallbackAnswer alert(String text) {
        return new CallbackAnswer(text, null);
    }

    public boolean replacesKeyboard() {
        return replacementActions != null;
    }
}

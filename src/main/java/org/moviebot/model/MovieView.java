package org.moviebot.model;

import lombok.Value;

import java.util.List;

@Value
public class MovieView {
    String text;
    List<BotAction> actions;
}

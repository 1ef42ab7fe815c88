package org.moviebot.model;

import lombok.Value;

@Value
public class BroadcastResult {
    int success;
    int failures;
}

package org.moviebot.model;

import lombok.Value;

@Value
public class RecommendationRef {
    Long id;
    String title;
    String year;
    String thumbnailUrl; // nullable
}

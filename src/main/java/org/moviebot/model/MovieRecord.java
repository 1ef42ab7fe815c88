package org.moviebot.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One movie as the bot shows it, built fresh from a single detail response and never mutated.
 * Display fields already hold their final text, with {@code "N/A"} standing in for missing data.
 */
@Value
@Builder
public class MovieRecord {

    public static final int MAX_RECOMMENDATIONS = 5;

    long id;
    String title;
    String year;
    String runtime;
    String genres;
    String language;
    String rating;
    String overview;

    /** Null when the movie has no poster. */
    String posterUrl;

    /** Null when no YouTube trailer was listed. */
    String trailerUrl;

    String externalLink;

    @Singular
    List<RecommendationRef> recommendations;
}

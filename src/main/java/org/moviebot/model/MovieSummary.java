package org.moviebot.model;

import lombok.Value;

/**
 * Search hit as it comes back from the title search, without a detail fetch.
 */
@Value
public class MovieSummary {
    long id;
    String title;
    String year;
    String overview;
}

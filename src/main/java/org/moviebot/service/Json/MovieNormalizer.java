package org.moviebot.service.Json;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.moviebot.config.TmdbProperties;
import org.moviebot.model.MovieRecord;
import org.moviebot.model.MovieSummary;
import org.moviebot.model.RecommendationRef;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Turns raw TMDB movie JSON into {@link MovieRecord}s. Every field is read with its own default,
 * so an odd nested value degrades to {@code "N/A"} instead of failing the whole record.
 */
@Service
@RequiredArgsConstructor
public class MovieNormalizer {

    public static final String NOT_AVAILABLE = "N/A";
    public static final String NO_OVERVIEW = "No overview available.";

    private static final String YOUTUBE_WATCH_URL = "https://www.youtube.com/watch?v=";

    private final TmdbProperties tmdbProperties;

    /**
     * @return empty when the payload has no id, which covers both "not found" and malformed bodies
     */
    public Optional<MovieRecord> normalize(JsonNode movie) {
        Optional<Long> id = extractId(movie);
        if (id.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(MovieRecord.builder()
                .id(id.get())
                .title(textOrDefault(movie, "title", NOT_AVAILABLE))
                .year(extractYear(movie))
                .runtime(extractRuntime(movie))
                .genres(extractGenres(movie))
                .language(extractLanguage(movie))
                .rating(formatRating(movie.path("vote_average")))
                .overview(textOrDefault(movie, "overview", NO_OVERVIEW))
                .posterUrl(imageUrl(movie, "original"))
                .trailerUrl(extractTrailerUrl(movie))
                .externalLink(movieLink(id.get()))
                .recommendations(extractRecommendations(movie))
                .build());
    }

    public Optional<MovieSummary> summarize(JsonNode movie) {
        return extractId(movie).map(id -> new MovieSummary(
                id,
                textOrDefault(movie, "title", NOT_AVAILABLE),
                extractYear(movie),
                textOrDefault(movie, "overview", "")));
    }

    public String movieLink(Long id) {
        return tmdbProperties.getSiteUrl() + "/movie/" + id;
    }

    public static String deriveYear(String releaseDate) {
        if (releaseDate == null || releaseDate.isEmpty()) {
            return NOT_AVAILABLE;
        }
        return releaseDate.length() > 4 ? releaseDate.substring(0, 4) : releaseDate;
    }

    /**
     * Rounds half up on the decimal text of the value, so 7.05 gives "7.1" and 7.049 gives "7.0".
     * Zero means "no votes" to TMDB and is shown as {@code "N/A"} as well.
     */
    public static String formatRating(JsonNode voteAverage) {
        if (!voteAverage.isNumber() || voteAverage.asDouble() == 0.0) {
            return NOT_AVAILABLE;
        }
        return BigDecimal.valueOf(voteAverage.asDouble())
                .setScale(1, RoundingMode.HALF_UP)
                .toPlainString();
    }

    private Optional<Long> extractId(JsonNode movie) {
        if (movie == null || !movie.isObject()) {
            return Optional.empty();
        }
        JsonNode id = movie.path("id");
        if (id.canConvertToLong() && id.isIntegralNumber()) {
            return Optional.of(id.asLong());
        }
        if (id.isTextual() && id.asText().matches("\\d+")) {
            return Optional.of(Long.parseLong(id.asText()));
        }
        return Optional.empty();
    }

    private String extractYear(JsonNode movie) {
        JsonNode releaseDate = movie.path("release_date");
        return releaseDate.isTextual() ? deriveYear(releaseDate.asText()) : NOT_AVAILABLE;
    }

    private String extractRuntime(JsonNode movie) {
        JsonNode runtime = movie.path("runtime");
        if (!runtime.isNumber() || runtime.asInt() == 0) {
            return NOT_AVAILABLE;
        }
        return runtime.asInt() + " min";
    }

    private String extractGenres(JsonNode movie) {
        JsonNode genres = movie.path("genres");
        if (!genres.isArray()) {
            return NOT_AVAILABLE;
        }
        String joined = StreamSupport.stream(genres.spliterator(), false)
                .map(genre -> genre.path("name"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? NOT_AVAILABLE : joined;
    }

    private String extractLanguage(JsonNode movie) {
        JsonNode language = movie.path("original_language");
        if (!language.isTextual() || language.asText().isBlank()) {
            return NOT_AVAILABLE;
        }
        return language.asText().toUpperCase(Locale.ROOT);
    }

    private String extractTrailerUrl(JsonNode movie) {
        JsonNode videos = movie.path("videos").path("results");
        if (!videos.isArray()) {
            return null;
        }
        for (JsonNode video : videos) {
            if ("Trailer".equals(video.path("type").asText())
                    && "YouTube".equals(video.path("site").asText())
                    && video.path("key").isTextual()) {
                return YOUTUBE_WATCH_URL + video.path("key").asText();
            }
        }
        return null;
    }

    private List<RecommendationRef> extractRecommendations(JsonNode movie) {
        JsonNode results = movie.path("recommendations").path("results");
        List<RecommendationRef> recommendations = new ArrayList<>();
        if (!results.isArray()) {
            return recommendations;
        }
        for (JsonNode recommendation : results) {
            if (recommendations.size() == MovieRecord.MAX_RECOMMENDATIONS) {
                break;
            }
            JsonNode id = recommendation.path("id");
            recommendations.add(new RecommendationRef(
                    id.isIntegralNumber() ? id.asLong() : null,
                    textOrDefault(recommendation, "title", NOT_AVAILABLE),
                    extractYear(recommendation),
                    imageUrl(recommendation, "w200")));
        }
        return recommendations;
    }

    private String imageUrl(JsonNode movie, String size) {
        JsonNode path = movie.path("poster_path");
        if (!path.isTextual() || path.asText().isEmpty()) {
            return null;
        }
        return tmdbProperties.getImageUrl() + "/" + size + path.asText();
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            return defaultValue;
        }
        return value.asText();
    }
}

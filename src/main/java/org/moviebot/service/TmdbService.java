package org.moviebot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.moviebot.config.TmdbProperties;
import org.moviebot.model.MovieRecord;
import org.moviebot.model.MovieSummary;
import org.moviebot.service.Json.MovieNormalizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the handful of TMDB endpoints the bot needs.
 * <p>
 * Every request goes through the retrying executor. A request that still fails is logged and
 * reported as "no data", so none of these methods throw on network trouble. Multi-step lookups
 * (search, then detail) collapse to empty as soon as one step fails.
 */
@Slf4j
@Service
public class TmdbService {

    static final int LIST_LIMIT = 5;

    private final RestTemplate restTemplate;
    private final RetryingExecutor retryingExecutor;
    private final MovieNormalizer movieNormalizer;
    private final TmdbProperties tmdbProperties;

    public TmdbService(@Qualifier("tmdbRestTemplate") RestTemplate restTemplate,
                       @Qualifier("tmdbRetryingExecutor") RetryingExecutor retryingExecutor,
                       MovieNormalizer movieNormalizer,
                       TmdbProperties tmdbProperties) {
        this.restTemplate = restTemplate;
        this.retryingExecutor = retryingExecutor;
        this.movieNormalizer = movieNormalizer;
        this.tmdbProperties = tmdbProperties;
    }

    public Optional<MovieRecord> search(String title, @Nullable String year) {
        log.info("Searching for movie: {} (Year: {})", title, year != null ? year : "N/A");

        UriComponentsBuilder uri = endpoint("/search/movie").queryParam("query", "{query}");
        if (year != null) {
            uri.queryParam("year", year);
        }

        Optional<JsonNode> response = fetch("search", uri, Map.of("query", title));
        if (response.isEmpty()) {
            return Optional.empty();
        }

        JsonNode results = response.get().path("results");
        if (!results.isArray() || results.isEmpty()) {
            log.warn("No results found for movie: {}", title);
            return Optional.empty();
        }

        JsonNode id = results.get(0).path("id");
        if (!id.isIntegralNumber()) {
            log.error("No id in the first search result for: {}", title);
            return Optional.empty();
        }
        return fetchById(id.asLong());
    }

    public Optional<MovieRecord> fetchById(long movieId) {
        log.info("Fetching details for movie ID: {}", movieId);

        UriComponentsBuilder uri = endpoint("/movie/" + movieId)
                .queryParam("append_to_response", "videos,recommendations");

        Optional<MovieRecord> movie = fetch("fetchById", uri, Map.of()).flatMap(movieNormalizer::normalize);
        if (movie.isPresent()) {
            log.info("Successfully fetched details for: {}", movie.get().getTitle());
        } else {
            log.warn("No details found for movie ID: {}", movieId);
        }
        return movie;
    }

    /**
     * Up to five trending titles of the week, each re-fetched in full. An entry whose detail fetch
     * failed is left as {@code null} so the list keeps the API's order.
     */
    public List<MovieRecord> trending() {
        return fetchListWithDetails("trending", "/trending/movie/week");
    }

    /** Same shape as {@link #trending()}. */
    public List<MovieRecord> popular() {
        return fetchListWithDetails("popular", "/movie/popular");
    }

    /**
     * Lightweight search used by inline mode: one request, no detail fetches.
     */
    public List<MovieSummary> searchSummaries(String query) {
        Optional<JsonNode> response = fetch("searchSummaries",
                endpoint("/search/movie").queryParam("query", "{query}"), Map.of("query", query));
        JsonNode results = response.map(body -> body.path("results")).orElse(MissingNode.getInstance());

        List<MovieSummary> summaries = new ArrayList<>();
        if (!results.isArray()) {
            return summaries;
        }
        int inspected = 0;
        for (JsonNode result : results) {
            if (inspected++ == LIST_LIMIT) {
                break;
            }
            movieNormalizer.summarize(result).ifPresent(summaries::add);
        }
        return summaries;
    }

    private List<MovieRecord> fetchListWithDetails(String operation, String path) {
        Optional<JsonNode> response = fetch(operation, endpoint(path), Map.of());
        JsonNode results = response.map(body -> body.path("results")).orElse(MissingNode.getInstance());
        if (!results.isArray() || results.isEmpty()) {
            log.warn("TMDB returned no {} movies", operation);
            return List.of();
        }

        List<MovieRecord> movies = new ArrayList<>();
        for (JsonNode result : results) {
            if (movies.size() == LIST_LIMIT) {
                break;
            }
            JsonNode id = result.path("id");
            movies.add(id.isIntegralNumber() ? fetchById(id.asLong()).orElse(null) : null);
        }
        return movies;
    }

    private UriComponentsBuilder endpoint(String path) {
        return UriComponentsBuilder.fromHttpUrl(tmdbProperties.getApiUrl())
                .path(path)
                .queryParam("api_key", tmdbProperties.getApiKey());
    }

    /**
     * User text goes in through {@code variables}: template values are encoded strictly, so a
     * {@code +} in a title reaches TMDB as {@code %2B} rather than as a space.
     */
    private Optional<JsonNode> fetch(String operation, UriComponentsBuilder uriBuilder, Map<String, ?> variables) {
        URI uri = uriBuilder.encode().buildAndExpand(variables).toUri();
        try {
            JsonNode body = retryingExecutor.execute(operation, () -> restTemplate.getForObject(uri, JsonNode.class));
            return Optional.ofNullable(body);
        } catch (RestClientException e) {
            log.error("TMDB API request {} to {} failed: {}", operation, uri.getPath(), e.getMessage());
            return Optional.empty();
        }
    }
}

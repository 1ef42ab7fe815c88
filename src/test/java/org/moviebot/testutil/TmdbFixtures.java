package org.moviebot.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.moviebot.config.BotProperties;
import org.moviebot.config.TmdbProperties;

import java.util.List;

/**
 * Hand-built TMDB payloads shaped like the real API responses.
 */
public final class TmdbFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private TmdbFixtures() {
    }

    public static TmdbProperties tmdbProperties() {
        TmdbProperties properties = new TmdbProperties();
        properties.setApiKey("test-key");
        return properties;
    }

    public static BotProperties botProperties() {
        BotProperties properties = new BotProperties();
        properties.setUsername("movie_test_bot");
        properties.setContactEmail("support@example.com");
        properties.setChannelLinks(List.of(link("📢 Main", "https://t.me/main"), link("📢 Creator", "https://t.me/creator")));
        return properties;
    }

    public static BotProperties.Link link(String label, String url) {
        BotProperties.Link link = new BotProperties.Link();
        link.setLabel(label);
        link.setUrl(url);
        return link;
    }

    public static ObjectNode avatarDetails() {
        ObjectNode movie = MAPPER.createObjectNode();
        movie.put("id", 19995);
        movie.put("title", "Avatar");
        movie.put("release_date", "2009-12-15");
        movie.put("runtime", 162);
        movie.put("original_language", "en");
        movie.put("vote_average", 7.586);
        movie.put("overview", "In the 22nd century, a paraplegic Marine is dispatched to the moon Pandora.");
        movie.put("poster_path", "/kyeqWdyUXW608qlYkRqosgbbJyK.jpg");

        ArrayNode genres = movie.putArray("genres");
        genres.addObject().put("id", 28).put("name", "Action");
        genres.addObject().put("id", 12).put("name", "Adventure");

        ArrayNode videos = movie.putObject("videos").putArray("results");
        videos.addObject().put("type", "Teaser").put("site", "YouTube").put("key", "teaser1");
        videos.addObject().put("type", "Trailer").put("site", "Vimeo").put("key", "vimeo1");
        videos.addObject().put("type", "Trailer").put("site", "YouTube").put("key", "5PSNL1qE6VY");
        videos.addObject().put("type", "Trailer").put("site", "YouTube").put("key", "later");

        ArrayNode recommendations = movie.putObject("recommendations").putArray("results");
        recommendations.add(recommendation(76600, "Avatar: The Way of Water", "2022-12-14", "/t6HIqrRAclMCA60NsSmeqe9RmNV.jpg"));
        recommendations.add(recommendation(285, "Pirates of the Caribbean: At World's End", "2007-05-19", null));
        return movie;
    }

    public static ObjectNode movieDetails(long id, String title, String releaseDate) {
        ObjectNode movie = MAPPER.createObjectNode();
        movie.put("id", id);
        movie.put("title", title);
        movie.put("release_date", releaseDate);
        movie.put("runtime", 120);
        movie.put("vote_average", 6.5);
        return movie;
    }

    public static ObjectNode recommendation(long id, String title, String releaseDate, String posterPath) {
        ObjectNode recommendation = MAPPER.createObjectNode();
        recommendation.put("id", id);
        recommendation.put("title", title);
        recommendation.put("release_date", releaseDate);
        if (posterPath != null) {
            recommendation.put("poster_path", posterPath);
        }
        return recommendation;
    }

    /**
     * A search or list response whose results carry only the given ids.
     */
    public static ObjectNode results(long... ids) {
        ObjectNode response = MAPPER.createObjectNode();
        ArrayNode results = response.putArray("results");
        for (long id : ids) {
            results.addObject().put("id", id).put("title", "Movie " + id).put("release_date", "2020-01-01");
        }
        return response;
    }
}

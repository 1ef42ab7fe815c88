package org.moviebot.util;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviebot.config.BotProperties;
import org.moviebot.entity.Favorite;
import org.moviebot.model.BotAction;
import org.moviebot.model.MovieRecord;
import org.moviebot.model.MovieSummary;
import org.moviebot.model.MovieView;
import org.moviebot.model.RecommendationRef;
import org.moviebot.service.Json.MovieNormalizer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageFormatter {

    public static final String FORMAT_ERROR = "Error formatting movie information.";
    public static final String NOT_FOUND = "❌ Movie not found. Please check the name or ID and try again.";
    public static final String GENERIC_ERROR = "❌ An error occurred while processing your request. Please try again.";
    public static final String ADMIN_ONLY = "❌ This command is for admins only.";

    public static final String FAVORITE_PREFIX = "fav_";
    public static final String REMOVE_PREFIX = "remove_";
    public static final String VIEW_PREFIX = "view_";

    static final int FAVORITES_SHOWN = 10;
    private static final int INLINE_OVERVIEW_LENGTH = 200;
    private static final int INLINE_DESCRIPTION_LENGTH = 100;

    private final BotProperties botProperties;
    private final MovieNormalizer movieNormalizer;

    /**
     * Full movie card plus its buttons. The primary button saves the movie, or removes it when the
     * card was opened from the favorites list; the configured channel links follow.
     */
    public MovieView renderDetail(MovieRecord movie, boolean fromFavorites) {
        String text;
        try {
            text = detailText(movie);
        } catch (RuntimeException e) {
            log.error("Error formatting movie message: {}", e.getMessage(), e);
            text = FORMAT_ERROR;
        }

        List<BotAction> actions = new ArrayList<>();
        actions.add(primaryAction(movie, fromFavorites));
        actions.addAll(channelActions());
        return new MovieView(text, actions);
    }

    public String renderList(List<MovieRecord> movies, String heading) {
        StringBuilder text = new StringBuilder("*").append(heading).append("*\n\n");
        for (MovieRecord movie : movies) {
            if (movie == null) {
                continue;
            }
            text.append(String.format("🎬 [%s (%s)](%s)\n", movie.getTitle(), movie.getYear(), movie.getExternalLink()));
            text.append(String.format("⭐ %s/10 | ⏳ %s\n\n", movie.getRating(), movie.getRuntime()));
        }
        return text.toString();
    }

    public BotAction favoriteAction(long movieId) {
        return BotAction.callback("❤️ Save To Favorites", FAVORITE_PREFIX + movieId);
    }

    public List<BotAction> channelActions() {
        return botProperties.getChannelLinks().stream()
                .map(link -> BotAction.link(link.getLabel(), link.getUrl()))
                .toList();
    }

    public String getHelpMessage() {
        return """
                🎬 *TMDB Movie Bot*

                I can fetch movie details from *TMDB* and keep your favorites.

                🔍 *Search commands*
                `/search <movie name> [year]` - search by name
                `/id <tmdb_id>` - search by TMDB id
                `/trending` - currently trending movies
                `/popular` - most popular movies

                💖 *Favorites*
                `/favorites` - your saved movies

                ✨ *Inline search*
                Type `@%s <movie name>` in any chat, then use `/id` with the id from the result.
                """.formatted(botProperties.getUsername());
    }

    public String getContactMessage() {
        return """
                📞 *Contact us*

                📧 Email: `%s`

                For issues, business or other inquiries, please reach out.

                ❗ *Only for business and help, don't spam!*""".formatted(botProperties.getContactEmail());
    }

    public String searchUsage() {
        return "Please provide a movie name. Example:\n`/search Avatar 2009`";
    }

    public String idUsage() {
        return "Please provide a valid TMDB id. Example:\n`/id 27205`";
    }

    public String broadcastUsage() {
        return "Please provide a message to broadcast. Example:\n`/broadcast Hello users!`";
    }

    public String listUnavailable(String what) {
        return "❌ Could not fetch " + what + " movies. Please try again later.";
    }

    public String noFavorites() {
        return "You haven't saved any favorites yet. Use the ❤️ button after searching for a movie to save it.";
    }

    public String favoritesHeader(int total) {
        String text = "⭐ Your favorite movies:\n\n";
        if (total > FAVORITES_SHOWN) {
            text += String.format("Showing %d of %d favorites\n", FAVORITES_SHOWN, total);
        }
        return text;
    }

    public List<BotAction> favoriteButtons(List<Favorite> favorites) {
        return favorites.stream()
                .limit(FAVORITES_SHOWN)
                .map(favorite -> BotAction.callback("🎬 " + favorite.getMovieTitle(), VIEW_PREFIX + favorite.getMovieId()))
                .toList();
    }

    /**
     * @param topMovies movie id to search count, in ranking order
     * @param titles    resolved titles; ids missing here are shown as raw ids
     */
    public String statistics(long userCount, long totalSearches, Map<Long, Long> topMovies, Map<Long, String> titles) {
        StringBuilder text = new StringBuilder("📊 *Bot Statistics*\n\n")
                .append("👥 Total users: ").append(userCount).append('\n')
                .append("🔍 Total searches: ").append(totalSearches).append("\n\n")
                .append("🎥 *Top 10 most searched movies:*\n");
        topMovies.forEach((movieId, count) -> {
            String title = titles.get(movieId);
            text.append("- ")
                    .append(title != null ? title : "ID " + movieId)
                    .append(": ").append(count).append(" searches\n");
        });
        return text.toString();
    }

    public String broadcastEnvelope(String message) {
        return "📢 *Announcement from admin:*\n\n" + message;
    }

    public String broadcastStarted(int recipients) {
        return "📢 Starting broadcast to " + recipients + " users...";
    }

    public String broadcastFinished(int success, int failures) {
        return String.format("📢 Broadcast completed!\n✅ Success: %d\n❌ Failures: %d", success, failures);
    }

    public String inlineTitle(MovieSummary movie) {
        return movie.getTitle() + " (" + movie.getYear() + ")";
    }

    public String inlineDescription(MovieSummary movie) {
        if (movie.getOverview().isEmpty()) {
            return "No overview";
        }
        return truncate(movie.getOverview(), INLINE_DESCRIPTION_LENGTH) + "...";
    }

    public String inlineMessage(MovieSummary movie) {
        return String.format("🎬 *%s* (%s)\n\n📖 %s...\n\n🔎 Use `/id %d` for full details",
                movie.getTitle(), movie.getYear(), truncate(movie.getOverview(), INLINE_OVERVIEW_LENGTH), movie.getId());
    }

    private String detailText(MovieRecord movie) {
        StringBuilder text = new StringBuilder(String.format("""
                        🎬 *%s* (%s)
                        ⭐ Rating: %s/10
                        ⏳ Runtime: %s
                        📌 Genres: %s
                        🌐 Language: %s

                        📖 *Overview:*
                        %s

                        🔗 [More Info on TMDB](%s)""",
                movie.getTitle(),
                movie.getYear(),
                movie.getRating(),
                movie.getRuntime(),
                movie.getGenres(),
                movie.getLanguage(),
                movie.getOverview(),
                movie.getExternalLink()));

        if (movie.getTrailerUrl() != null) {
            text.append("\n🎥 [Watch Trailer](").append(movie.getTrailerUrl()).append(')');
        }

        if (!movie.getRecommendations().isEmpty()) {
            text.append("\n\n🎥 *You Might Also Like:*");
            for (RecommendationRef recommendation : movie.getRecommendations()) {
                text.append(String.format("\n• [%s (%s)](%s)",
                        recommendation.getTitle(),
                        recommendation.getYear(),
                        movieNormalizer.movieLink(recommendation.getId())));
            }
        }
        return text.toString();
    }

    private BotAction primaryAction(MovieRecord movie, boolean fromFavorites) {
        long movieId = movie != null ? movie.getId() : 0L;
        if (fromFavorites) {
            return BotAction.callback("❌ Remove From Favorites", REMOVE_PREFIX + movieId);
        }
        return favoriteAction(movieId);
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }
}

package org.moviebot.service;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.moviebot.config.BotProperties;
import org.moviebot.entity.Favorite;
import org.moviebot.model.BotAction;
import org.moviebot.model.BotReply;
import org.moviebot.model.CallbackAnswer;
import org.moviebot.model.MovieRecord;
import org.moviebot.model.MovieSummary;
import org.moviebot.util.MessageFormatter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What each command does, independent of how Telegram delivers it. Every method answers with a
 * ready-to-send reply; a movie that cannot be resolved becomes the neutral not-found text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandProcessingService {

    static final int TOP_SEARCHED_LIMIT = 10;

    private final TmdbService tmdbService;
    private final FavoriteService favoriteService;
    private final SearchLogService searchLogService;
    private final UserService userService;
    private final MessageFormatter messageFormatter;
    private final BotProperties botProperties;

    public BotReply start() {
        return BotReply.text(messageFormatter.getHelpMessage(), messageFormatter.channelActions());
    }

    public BotReply contact() {
        String contactUrl = botProperties.getContactUrl();
        List<BotAction> actions = contactUrl == null || contactUrl.isBlank()
                ? List.of()
                : List.of(BotAction.link("📩 Message Admin", contactUrl));
        return BotReply.text(messageFormatter.getContactMessage(), actions);
    }

    public BotReply searchMovie(Long userId, String argument) {
        if (argument.isBlank()) {
            return BotReply.text(messageFormatter.searchUsage());
        }
        SearchQuery query = SearchQuery.parse(argument);
        log.info("Received search query: {} from user {}", argument, userId);

        Optional<MovieRecord> movie = tmdbService.search(query.getTitle(), query.getYear());
        searchLogService.logSearch(userId, argument, movie.map(MovieRecord::getId).orElse(null));
        return movieReply(movie, false);
    }

    public BotReply searchById(Long userId, String argument) {
        if (!argument.matches("\\d+")) {
            return BotReply.text(messageFormatter.idUsage());
        }
        log.info("Received ID search: {} from user {}", argument, userId);

        Optional<MovieRecord> movie = parseMovieId(argument).flatMap(tmdbService::fetchById);
        searchLogService.logSearch(userId, "ID:" + argument, movie.map(MovieRecord::getId).orElse(null));
        return movieReply(movie, false);
    }

    public BotReply trending() {
        List<MovieRecord> movies = tmdbService.trending();
        if (movies.isEmpty()) {
            return BotReply.text(messageFormatter.listUnavailable("trending"));
        }
        return BotReply.text(messageFormatter.renderList(movies, "🔥 Currently Trending Movies"));
    }

    public BotReply popular() {
        List<MovieRecord> movies = tmdbService.popular();
        if (movies.isEmpty()) {
            return BotReply.text(messageFormatter.listUnavailable("popular"));
        }
        return BotReply.text(messageFormatter.renderList(movies, "🌟 Most Popular Movies"));
    }

    public BotReply favorites(Long userId) {
        List<Favorite> favorites = favoriteService.getFavorites(userId);
        if (favorites.isEmpty()) {
            return BotReply.text(messageFormatter.noFavorites());
        }
        return BotReply.text(messageFormatter.favoritesHeader(favorites.size()), messageFormatter.favoriteButtons(favorites));
    }

    public BotReply statistics(Long userId) {
        if (!userService.isAdmin(userId)) {
            log.warn("User {} requested statistics without admin rights", userId);
            return BotReply.text(MessageFormatter.ADMIN_ONLY);
        }

        Map<Long, Long> topMovies = searchLogService.getTopSearchedMovies(TOP_SEARCHED_LIMIT);
        Map<Long, String> titles = new HashMap<>();
        topMovies.keySet().forEach(movieId ->
                tmdbService.fetchById(movieId).ifPresent(movie -> titles.put(movieId, movie.getTitle())));

        return BotReply.text(messageFormatter.statistics(
                userService.getUserCount(), searchLogService.getTotalSearches(), topMovies, titles));
    }

    public Optional<BotReply> viewFavorite(String movieIdText) {
        return parseMovieId(movieIdText)
                .flatMap(tmdbService::fetchById)
                .map(movie -> movieReply(Optional.of(movie), true));
    }

    public CallbackAnswer addFavorite(Long userId, String movieIdText) {
        Optional<Long> movieId = parseMovieId(movieIdText);
        Optional<MovieRecord> movie = movieId.flatMap(tmdbService::fetchById);
        if (movie.isEmpty()) {
            return CallbackAnswer.alert("Movie Not Found!");
        }

        String title = movie.get().getTitle();
        if (favoriteService.addFavorite(userId, movieId.get(), title)) {
            return CallbackAnswer.alert("❤️ " + title + " added to favorites!");
        }
        return CallbackAnswer.alert("❤️ " + title + " is already in favorites!");
    }

    public CallbackAnswer removeFavorite(Long userId, String movieIdText) {
        Optional<Long> movieId = parseMovieId(movieIdText);
        Optional<MovieRecord> movie = movieId.flatMap(tmdbService::fetchById);
        if (movie.isEmpty()) {
            return CallbackAnswer.alert("Movie Not Found!");
        }

        String title = movie.get().getTitle();
        if (!favoriteService.removeFavorite(userId, movieId.get())) {
            return CallbackAnswer.alert(title + " wasn't in your favorites!");
        }

        List<BotAction> keyboard = new ArrayList<>();
        keyboard.add(messageFormatter.favoriteAction(movieId.get()));
        keyboard.addAll(messageFormatter.channelActions());
        return new CallbackAnswer("❌ " + title + " removed from favorites!", keyboard);
    }

    public List<MovieSummary> inlineSearch(String query) {
        if (query.isBlank()) {
            return List.of();
        }
        return tmdbService.searchSummaries(query.trim());
    }

    private BotReply movieReply(Optional<MovieRecord> movie, boolean fromFavorites) {
        return movie
                .map(found -> BotReply.movie(messageFormatter.renderDetail(found, fromFavorites), found.getPosterUrl()))
                .orElseGet(() -> BotReply.text(MessageFormatter.NOT_FOUND));
    }

    private static Optional<Long> parseMovieId(String text) {
        try {
            return Optional.of(Long.parseLong(text.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed movie id '{}'", text);
            return Optional.empty();
        }
    }

    /**
     * "Avatar 2009" splits into title and year; a last word that is not all digits stays in the title.
     */
    @Value
    static class SearchQuery {
        String title;
        String year;

        static SearchQuery parse(String argument) {
            String trimmed = argument.trim();
            int lastSpace = trimmed.lastIndexOf(' ');
            if (lastSpace > 0) {
                String candidate = trimmed.substring(lastSpace + 1);
                if (candidate.matches("\\d+")) {
                    return new SearchQuery(trimmed.substring(0, lastSpace).trim(), candidate);
                }
            }
            return new SearchQuery(trimmed, null);
        }
    }
}

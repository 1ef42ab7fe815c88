package org.moviebot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.moviebot.model.BotAction;
import org.moviebot.model.BotReply;
import org.moviebot.model.CallbackAnswer;
import org.moviebot.model.MovieRecord;
import org.moviebot.service.CommandProcessingService.SearchQuery;
import org.moviebot.service.Json.MovieNormalizer;
import org.moviebot.testutil.TmdbFixtures;
import org.moviebot.util.MessageFormatter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommandProcessingServiceTest {

    @Mock
    private TmdbService tmdbService;

    @Mock
    private FavoriteService favoriteService;

    @Mock
    private SearchLogService searchLogService;

    @Mock
    private UserService userService;

    private MovieNormalizer movieNormalizer;
    private CommandProcessingService service;

    @BeforeEach
    void setUp() {
        movieNormalizer = new MovieNormalizer(TmdbFixtures.tmdbProperties());
        MessageFormatter formatter = new MessageFormatter(TmdbFixtures.botProperties(), movieNormalizer);
        service = new CommandProcessingService(tmdbService, favoriteService, searchLogService, userService,
                formatter, TmdbFixtures.botProperties());
    }

    @Test
    void searchQuery_takesTrailingDigitsAsYear() {
        assertThat(SearchQuery.parse("Avatar 2009")).isEqualTo(new SearchQuery("Avatar", "2009"));
        assertThat(SearchQuery.parse("  The Matrix   1999 ")).isEqualTo(new SearchQuery("The Matrix", "1999"));
        assertThat(SearchQuery.parse("Blade Runner 2049x")).isEqualTo(new SearchQuery("Blade Runner 2049x", null));
        assertThat(SearchQuery.parse("1917")).isEqualTo(new SearchQuery("1917", null));
    }

    @Test
    void searchMovie_logsAndRendersFoundMovie() {
        when(tmdbService.search("Avatar", "2009")).thenReturn(avatar());

        BotReply reply = service.searchMovie(7L, "Avatar 2009");

        verify(searchLogService).logSearch(7L, "Avatar 2009", 19995L);
        assertThat(reply.getText()).contains("*Avatar* (2009)");
        assertThat(reply.getPhotoUrl()).isEqualTo("https://image.tmdb.org/t/p/original/kyeqWdyUXW608qlYkRqosgbbJyK.jpg");
        assertThat(reply.getActions().get(0).getCallbackData()).isEqualTo("fav_19995");
    }

    @Test
    void searchMovie_answersNotFound_andLogsQueryWithoutMovie() {
        when(tmdbService.search("Nonexistent", null)).thenReturn(Optional.empty());

        BotReply reply = service.searchMovie(7L, "Nonexistent");

        assertThat(reply.getText()).isEqualTo(MessageFormatter.NOT_FOUND);
        assertThat(reply.hasPhoto()).isFalse();
        verify(searchLogService).logSearch(7L, "Nonexistent", null);
    }

    @Test
    void searchMovie_showsUsage_forEmptyInput() {
        assertThat(service.searchMovie(7L, "").getText()).startsWith("Please provide a movie name");
        verifyNoInteractions(tmdbService, searchLogService);
    }

    @Test
    void searchById_rejectsNonNumericId() {
        assertThat(service.searchById(7L, "abc").getText()).startsWith("Please provide a valid TMDB id");
        verifyNoInteractions(tmdbService, searchLogService);
    }

    @Test
    void searchById_logsUnknownIdWithoutMovie() {
        when(tmdbService.fetchById(999999999L)).thenReturn(Optional.empty());

        assertThat(service.searchById(7L, "999999999").getText()).isEqualTo(MessageFormatter.NOT_FOUND);

        verify(searchLogService).logSearch(7L, "ID:999999999", null);
    }

    @Test
    void searchById_logsWithIdPrefix() {
        when(tmdbService.fetchById(19995L)).thenReturn(avatar());

        service.searchById(7L, "19995");

        verify(searchLogService).logSearch(7L, "ID:19995", 19995L);
    }

    @Test
    void trending_reportsUnavailable_whenListIsEmpty() {
        when(tmdbService.trending()).thenReturn(List.of());

        assertThat(service.trending().getText()).isEqualTo("❌ Could not fetch trending movies. Please try again later.");
    }

    @Test
    void statistics_deniesNonAdmins_withoutTouchingData() {
        when(userService.isAdmin(7L)).thenReturn(false);

        BotReply reply = service.statistics(7L);

        assertThat(reply.getText()).isEqualTo(MessageFormatter.ADMIN_ONLY);
        verifyNoInteractions(tmdbService, searchLogService);
        verify(userService, never()).getUserCount();
    }

    @Test
    void statistics_resolvesTitles_andKeepsUnknownIds() {
        Map<Long, Long> top = new LinkedHashMap<>();
        top.put(19995L, 3L);
        top.put(1L, 1L);
        when(userService.isAdmin(1L)).thenReturn(true);
        when(userService.getUserCount()).thenReturn(2L);
        when(searchLogService.getTotalSearches()).thenReturn(5L);
        when(searchLogService.getTopSearchedMovies(CommandProcessingService.TOP_SEARCHED_LIMIT)).thenReturn(top);
        when(tmdbService.fetchById(19995L)).thenReturn(avatar());
        when(tmdbService.fetchById(1L)).thenReturn(Optional.empty());

        String text = service.statistics(1L).getText();

        assertThat(text).contains("- Avatar: 3 searches", "- ID 1: 1 searches", "👥 Total users: 2");
    }

    @Test
    void addFavorite_reportsAddedThenAlreadyPresent() {
        when(tmdbService.fetchById(19995L)).thenReturn(avatar());
        when(favoriteService.addFavorite(7L, 19995L, "Avatar")).thenReturn(true, false);

        assertThat(service.addFavorite(7L, "19995").getText()).isEqualTo("❤️ Avatar added to favorites!");
        assertThat(service.addFavorite(7L, "19995").getText()).isEqualTo("❤️ Avatar is already in favorites!");
    }

    @Test
    void addFavorite_answersNotFound_forUnknownMovie() {
        when(tmdbService.fetchById(anyLong())).thenReturn(Optional.empty());

        CallbackAnswer answer = service.addFavorite(7L, "404");

        assertThat(answer.getText()).isEqualTo("Movie Not Found!");
        assertThat(answer.replacesKeyboard()).isFalse();
        verifyNoInteractions(favoriteService);
    }

    @Test
    void removeFavorite_swapsKeyboardBackToSave() {
        when(tmdbService.fetchById(19995L)).thenReturn(avatar());
        when(favoriteService.removeFavorite(7L, 19995L)).thenReturn(true);

        CallbackAnswer answer = service.removeFavorite(7L, "19995");

        assertThat(answer.getText()).isEqualTo("❌ Avatar removed from favorites!");
        assertThat(answer.replacesKeyboard()).isTrue();
        assertThat(answer.getReplacementActions()).extracting(BotAction::getCallbackData)
                .containsExactly("fav_19995", null, null);
    }

    @Test
    void removeFavorite_keepsKeyboard_whenNothingWasRemoved() {
        when(tmdbService.fetchById(19995L)).thenReturn(avatar());
        when(favoriteService.removeFavorite(any(), any())).thenReturn(false);

        CallbackAnswer answer = service.removeFavorite(7L, "19995");

        assertThat(answer.getText()).isEqualTo("Avatar wasn't in your favorites!");
        assertThat(answer.replacesKeyboard()).isFalse();
    }

    @Test
    void viewFavorite_rendersRemoveAction() {
        when(tmdbService.fetchById(19995L)).thenReturn(avatar());

        Optional<BotReply> reply = service.viewFavorite("19995");

        assertThat(reply).isPresent();
        assertThat(reply.get().getActions().get(0).getCallbackData()).isEqualTo("remove_19995");
    }

    @Test
    void inlineSearch_ignoresBlankQuery() {
        assertThat(service.inlineSearch("   ")).isEmpty();
        verifyNoInteractions(tmdbService);
    }

    private Optional<MovieRecord> avatar() {
        return movieNormalizer.normalize(TmdbFixtures.avatarDetails());
    }
}

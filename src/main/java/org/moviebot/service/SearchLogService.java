package org.moviebot.service;

import lombok.RequiredArgsConstructor;
import org.moviebot.entity.SearchLog;
import org.moviebot.repository.SearchLogRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class SearchLogService {

    private final SearchLogRepository searchLogRepository;

    public void logSearch(Long userId, String query, @Nullable Long movieId) {
        SearchLog searchLog = new SearchLog();
        searchLog.setUserId(userId);
        searchLog.setQuery(query);
        searchLog.setMovieId(movieId);
        searchLog.setSearchDate(LocalDateTime.now());
        searchLogRepository.save(searchLog);
    }

    public long getTotalSearches() {
        return searchLogRepository.count();
    }

    /**
     * Movie id to number of searches, most searched first.
     */
    public Map<Long, Long> getTopSearchedMovies(int limit) {
        Map<Long, Long> top = new LinkedHashMap<>();
        searchLogRepository.findTopSearchedMovies(PageRequest.of(0, limit))
                .forEach(row -> top.put(row.getMovieId(), row.getSearches()));
        return top;
    }
}

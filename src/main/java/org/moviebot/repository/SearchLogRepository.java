package org.moviebot.repository;

import org.moviebot.entity.SearchLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface SearchLogRepository extends JpaRepository<SearchLog, Long> {

    @Query("""
            select s.movieId as movieId, count(s) as searches
            from SearchLog s
            where s.movieId is not null
            group by s.movieId
            order by count(s) desc
            """)
    List<MovieSearchCount> findTopSearchedMovies(Pageable pageable);

    interface MovieSearchCount {
        Long getMovieId();

        Long getSearches();
    }
}

package org.moviebot.repository;

import org.moviebot.entity.Favorite;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FavoriteRepository extends JpaRepository<Favorite, Long> {

    List<Favorite> findByUserIdOrderByAddDateDesc(Long userId);

    boolean existsByUserIdAndMovieId(Long userId, Long movieId);

    long deleteByUserIdAndMovieId(Long userId, Long movieId);
}

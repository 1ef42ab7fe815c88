package org.moviebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviebot.entity.Favorite;
import org.moviebot.repository.FavoriteRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FavoriteService {

    private final FavoriteRepository favoriteRepository;

    /**
     * @return false when the movie is already among the user's favorites
     */
    public boolean addFavorite(Long userId, Long movieId, String movieTitle) {
        if (favoriteRepository.existsByUserIdAndMovieId(userId, movieId)) {
            return false;
        }
        try {
            favoriteRepository.saveAndFlush(new Favorite(null, userId, movieId, movieTitle, LocalDateTime.now()));
            return true;
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent insert of the same pair
            log.warn("Favorite {} for user {} was added concurrently", movieId, userId);
            return false;
        }
    }

    /**
     * @return false when there was nothing to remove
     */
    @Transactional
    public boolean removeFavorite(Long userId, Long movieId) {
        return favoriteRepository.deleteByUserIdAndMovieId(userId, movieId) > 0;
    }

    public List<Favorite> getFavorites(Long userId) {
        return favoriteRepository.findByUserIdOrderByAddDateDesc(userId);
    }
}

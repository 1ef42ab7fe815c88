package org.moviebot.repository;

import org.moviebot.entity.BotUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface BotUserRepository extends JpaRepository<BotUser, Long> {
    Optional<BotUser> findByUserId(Long userId);

    @Query("select u.userId from BotUser u")
    List<Long> findAllUserIds();
}

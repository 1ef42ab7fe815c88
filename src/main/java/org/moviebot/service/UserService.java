package org.moviebot.service;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviebot.config.BotProperties;
import org.moviebot.entity.Admin;
import org.moviebot.entity.BotUser;
import org.moviebot.repository.AdminRepository;
import org.moviebot.repository.BotUserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final BotUserRepository botUserRepository;
    private final AdminRepository adminRepository;
    private final BotProperties botProperties;

    /**
     * Fills the admins table from the configured allow-list, but only the first time.
     */
    @PostConstruct
    public void seedAdmins() {
        if (adminRepository.count() == 0 && !botProperties.getAdminIds().isEmpty()) {
            botProperties.getAdminIds().forEach(adminId -> adminRepository.save(new Admin(adminId)));
            log.info("Seeded {} admin(s) from configuration", botProperties.getAdminIds().size());
        }
    }

    @Transactional
    public BotUser registerUser(User telegramUser) {
        LocalDateTime now = LocalDateTime.now();
        BotUser user = botUserRepository.findByUserId(telegramUser.getId()).orElseGet(() -> {
            BotUser newUser = new BotUser();
            newUser.setUserId(telegramUser.getId());
            newUser.setJoinDate(now);
            log.info("Registering new user {}", telegramUser.getId());
            return newUser;
        });
        user.setUsername(telegramUser.getUserName());
        user.setFirstName(telegramUser.getFirstName());
        user.setLastName(telegramUser.getLastName());
        user.setLastSeen(now);
        return botUserRepository.save(user);
    }

    public boolean isAdmin(Long userId) {
        return botProperties.getAdminIds().contains(userId) || adminRepository.existsById(userId);
    }

    public long getUserCount() {
        return botUserRepository.count();
    }

    public List<Long> getAllUserIds() {
        return botUserRepository.findAllUserIds();
    }
}

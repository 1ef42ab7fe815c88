package org.moviebot;

import org.junit.jupiter.api.Test;
import org.moviebot.service.CommandProcessingService;
import org.moviebot.service.TelegramBotService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:movie_bot;MODE=MySQL",
        "bot.token=",
        "bot.admin-ids=1,2"
})
class MovieBotApplicationTest {

    @Autowired
    private TelegramBotService telegramBotService;

    @Autowired
    private CommandProcessingService commandProcessingService;

    @Test
    void contextLoads_withoutBotToken() {
        assertThat(telegramBotService.getBotUsername()).isEqualTo("movie_bot");
        assertThat(commandProcessingService.start().getActions()).hasSize(2);
    }
}

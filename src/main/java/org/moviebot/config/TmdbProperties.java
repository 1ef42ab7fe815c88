package org.moviebot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "tmdb")
public class TmdbProperties {

    private String apiKey;

    private String apiUrl = "https://api.themoviedb.org/3";

    private String imageUrl = "https://image.tmdb.org/t/p";

    private String siteUrl = "https://www.themoviedb.org";

    private Duration requestTimeout = Duration.ofSeconds(10);

    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration delay = Duration.ofSeconds(5);
    }
}

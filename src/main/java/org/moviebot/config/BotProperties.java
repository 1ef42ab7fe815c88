package org.moviebot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Telegram side of the bot: credentials, admin allow-list, transport mode and the channel links
 * attached under every movie card.
 */
@Data
@ConfigurationProperties(prefix = "bot")
public class BotProperties {

    private String token;

    private String username;

    /** User ids seeded into the admins table when it is empty. */
    private List<Long> adminIds = new ArrayList<>();

    private Webhook webhook = new Webhook();

    /** Buttons appended after the favorite action, in this order. */
    private List<Link> channelLinks = new ArrayList<>();

    private String contactEmail;

    private String contactUrl;

    /** Pause between two recipients of a broadcast. */
    private Duration broadcastDelay = Duration.ofMillis(100);

    @Data
    public static class Webhook {
        private boolean enabled;
        private String url = "";
        private String path = "/webhook";
        private String secret = "";

        public String getEndpoint() {
            return url + path;
        }
    }

    @Data
    public static class Link {
        private String label;
        private String url;
    }
}

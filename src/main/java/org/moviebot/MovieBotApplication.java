package org.moviebot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MovieBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(MovieBotApplication.class, args);
    }
}

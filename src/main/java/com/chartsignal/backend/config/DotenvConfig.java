package com.chartsignal.backend.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Pushes entries of an optional {@code .env} file in front of the other
 * property sources, so a line such as {@code bybit.api.testnet=true}
 * overrides application.properties.
 */
@Configuration
public class DotenvConfig {

    @Bean
    public Dotenv dotenv(ConfigurableEnvironment environment) {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, Object> entries = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(entry -> entries.put(entry.getKey(), entry.getValue()));

        if (!entries.isEmpty()) {
            environment.getPropertySources().addFirst(new MapPropertySource("dotenv", entries));
        }
        return dotenv;
    }
}

package uk.gegc.trivia.shared.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * CORS settings for the quiz client. Defaults allow any origin with the methods and headers
 * the client uses; everything is overridable under {@code trivia.cors}.
 */
@Configuration
@RequiredArgsConstructor
public class CorsConfig {

    private final TriviaProperties triviaProperties;

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        TriviaProperties.Cors cors = triviaProperties.getCors();

        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(cors.getAllowedOrigins());
        configuration.setAllowedMethods(cors.getAllowedMethods());
        configuration.setAllowedHeaders(cors.getAllowedHeaders());
        // wildcard origin is not allowed together with credentials
        configuration.setAllowCredentials(false);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}

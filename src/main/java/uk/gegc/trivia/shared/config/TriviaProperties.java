package uk.gegc.trivia.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Type-safe configuration for the trivia API.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "trivia")
public class TriviaProperties {

    /**
     * Number of questions returned by one page of {@code GET /questions}.
     */
    @Min(value = 1, message = "Property trivia.questions-per-page must be at least 1")
    private int questionsPerPage = 10;

    @Valid
    private Seed seed = new Seed();

    @Valid
    private Cors cors = new Cors();

    @Data
    public static class Seed {

        /**
         * Insert the default categories on startup when the categories table is empty.
         */
        private boolean enabled = true;
    }

    @Data
    public static class Cors {

        @NotEmpty
        private List<String> allowedOrigins = List.of("*");

        @NotEmpty
        private List<String> allowedMethods = List.of("GET", "POST", "PATCH", "DELETE", "OPTIONS");

        @NotEmpty
        private List<String> allowedHeaders = List.of("Content-Type");
    }
}

package uk.gegc.trivia.shared.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI triviaOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Trivia API")
                        .description("Questions, categories and quiz play for the trivia client")
                        .version("v1"));
    }

    @Bean
    public GroupedOpenApi questionsGroup() {
        return GroupedOpenApi.builder()
                .group("questions")
                .displayName("Questions & Categories")
                .pathsToMatch("/questions/**", "/categories/**")
                .build();
    }

    @Bean
    public GroupedOpenApi quizzesGroup() {
        return GroupedOpenApi.builder()
                .group("quizzes")
                .displayName("Quiz Play")
                .pathsToMatch("/quizzes/**")
                .build();
    }
}

package uk.gegc.trivia.features.quiz.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@Schema(description = "Request for the next quiz question")
public record QuizRequest(
        @JsonProperty("previous_questions")
        @Schema(description = "Ids of questions already shown in this quiz", example = "[2, 16]")
        List<Long> previousQuestions,

        @JsonProperty("quiz_category")
        @Schema(description = "Category to draw from")
        @NotNull(message = "Quiz category is required")
        @Valid
        QuizCategoryRef quizCategory
) {

    public List<Long> previousQuestionsOrEmpty() {
        return previousQuestions != null ? previousQuestions : List.of();
    }
}

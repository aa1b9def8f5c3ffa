package uk.gegc.trivia.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(description = "Category a quiz is played in")
public record QuizCategoryRef(
        @Schema(description = "Category id, 0 for all categories", example = "0")
        @NotNull(message = "Quiz category id is required")
        @PositiveOrZero(message = "Quiz category id must not be negative")
        Long id,

        @Schema(description = "Category label, informational only", example = "Science")
        String type
) {

    public static final long ALL_CATEGORIES = 0L;
}

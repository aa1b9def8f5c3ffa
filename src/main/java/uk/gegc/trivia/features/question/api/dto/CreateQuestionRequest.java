package uk.gegc.trivia.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Numeric fields accept JSON numbers and numeric strings. Zero counts as missing.
 */
@Schema(description = "Request payload for creating a new question")
public record CreateQuestionRequest(
        @Schema(description = "Question text", example = "What is the heaviest organ in the human body?")
        @NotEmpty(message = "Question text must not be empty")
        @Size(max = 1000, message = "Question text must be at most 1000 characters")
        String question,

        @Schema(description = "Answer text", example = "The Liver")
        @NotEmpty(message = "Answer must not be empty")
        @Size(max = 1000, message = "Answer must be at most 1000 characters")
        String answer,

        @Schema(description = "Difficulty level, 1 or higher", example = "4")
        @NotNull(message = "Difficulty is required")
        @Positive(message = "Difficulty must be a positive integer")
        Integer difficulty,

        @Schema(description = "Id of an existing category", example = "1")
        @NotNull(message = "Category is required")
        @Positive(message = "Category must be a positive id")
        Long category
) {
}

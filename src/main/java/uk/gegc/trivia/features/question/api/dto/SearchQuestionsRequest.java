package uk.gegc.trivia.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Free-text question search")
public record SearchQuestionsRequest(
        @Schema(description = "Substring to look for in question text, case-insensitive. Missing matches everything.",
                example = "title")
        String searchTerm
) {
}

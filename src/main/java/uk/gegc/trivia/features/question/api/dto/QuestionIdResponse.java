package uk.gegc.trivia.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Id of the question that was created or deleted")
public record QuestionIdResponse(
        boolean success,

        @Schema(example = "24")
        Long id
) {

    public static QuestionIdResponse of(Long id) {
        return new QuestionIdResponse(true, id);
    }
}

package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Questions matching a search or a category")
public record QuestionListResponse(
        boolean success,

        List<QuestionDto> questions,

        @JsonProperty("total_questions")
        @Schema(description = "Number of questions in the list", example = "3")
        int totalQuestions,

        @JsonProperty("current_category")
        @Schema(description = "Category the list is filtered by, null for searches", nullable = true, example = "1")
        Long currentCategory
) {

    public static QuestionListResponse of(List<QuestionDto> questions, Long currentCategory) {
        return new QuestionListResponse(true, questions, questions.size(), currentCategory);
    }
}

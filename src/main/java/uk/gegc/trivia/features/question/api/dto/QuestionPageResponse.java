package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.trivia.features.question.application.dto.QuestionPage;

import java.util.List;
import java.util.Map;

@Schema(description = "One page of questions together with every category")
public record QuestionPageResponse(
        boolean success,

        @JsonProperty("total_questions")
        @Schema(description = "Number of questions across all pages", example = "19")
        long totalQuestions,

        List<QuestionDto> questions,

        @Schema(description = "Category type labels keyed by category id")
        Map<Long, String> categories,

        @JsonProperty("current_category")
        @Schema(description = "Always null for the unfiltered listing", nullable = true)
        Long currentCategory
) {

    public static QuestionPageResponse of(QuestionPage page) {
        return new QuestionPageResponse(true, page.totalQuestions(), page.questions(), page.categories(), null);
    }
}

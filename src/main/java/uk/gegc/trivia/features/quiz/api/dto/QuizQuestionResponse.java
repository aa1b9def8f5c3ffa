package uk.gegc.trivia.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;

@Schema(description = "Next quiz question, null once every eligible question has been played")
public record QuizQuestionResponse(
        boolean success,

        @Schema(nullable = true)
        QuestionDto question
) {

    public static QuizQuestionResponse of(QuestionDto question) {
        return new QuizQuestionResponse(true, question);
    }
}

package uk.gegc.trivia.features.question.application.dto;

import uk.gegc.trivia.features.question.api.dto.QuestionDto;

import java.util.List;
import java.util.Map;

public record QuestionPage(
        List<QuestionDto> questions,
        long totalQuestions,
        Map<Long, String> categories
) {
}

package uk.gegc.trivia.features.question.application;

import uk.gegc.trivia.features.question.api.dto.CreateQuestionRequest;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.application.dto.QuestionPage;

import java.util.List;

public interface QuestionService {

    /**
     * @param page 1-based page number
     */
    QuestionPage listQuestions(int page);

    Long createQuestion(CreateQuestionRequest request);

    Long deleteQuestion(Long questionId);

    List<QuestionDto> searchQuestions(String searchTerm);

    List<QuestionDto> listQuestionsByCategory(Long categoryId);
}

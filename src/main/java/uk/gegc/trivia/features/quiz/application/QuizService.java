package uk.gegc.trivia.features.quiz.application;

import uk.gegc.trivia.features.question.api.dto.QuestionDto;

import java.util.Collection;
import java.util.Optional;

public interface QuizService {

    /**
     * Picks a random question of the category that has not been played yet.
     *
     * @param categoryId        category to draw from, {@code 0} for every category
     * @param previousQuestions ids already shown in this quiz
     * @return the next question, or empty when the pool is exhausted
     */
    Optional<QuestionDto> nextQuestion(long categoryId, Collection<Long> previousQuestions);
}

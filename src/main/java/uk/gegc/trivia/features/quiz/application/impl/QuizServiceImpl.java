package uk.gegc.trivia.features.quiz.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.question.domain.repository.QuestionRepository;
import uk.gegc.trivia.features.question.infra.mapping.QuestionMapper;
import uk.gegc.trivia.features.quiz.api.dto.QuizCategoryRef;
import uk.gegc.trivia.features.quiz.application.QuizService;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;

@Slf4j
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class QuizServiceImpl implements QuizService {

    private final QuestionRepository questionRepository;
    private final RandomGenerator randomGenerator;

    @Override
    public Optional<QuestionDto> nextQuestion(long categoryId, Collection<Long> previousQuestions) {
        List<Question> pool = categoryId == QuizCategoryRef.ALL_CATEGORIES
                ? questionRepository.findAll(Sort.by("id").ascending())
                : questionRepository.findAllByCategory_IdOrderByIdAsc(categoryId);

        Set<Long> played = new HashSet<>(previousQuestions);
        List<Question> unplayed = pool.stream()
                .filter(question -> !played.contains(question.getId()))
                .toList();

        if (unplayed.isEmpty()) {
            log.debug("Quiz in category {} exhausted after {} questions", categoryId, played.size());
            return Optional.empty();
        }

        Question next = unplayed.get(randomGenerator.nextInt(unplayed.size()));
        return Optional.of(QuestionMapper.toDto(next));
    }
}

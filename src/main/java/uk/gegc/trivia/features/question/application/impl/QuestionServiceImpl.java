package uk.gegc.trivia.features.question.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.category.application.CategoryService;
import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;
import uk.gegc.trivia.features.question.api.dto.CreateQuestionRequest;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.application.QuestionService;
import uk.gegc.trivia.features.question.application.dto.QuestionPage;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.question.domain.repository.QuestionRepository;
import uk.gegc.trivia.features.question.infra.mapping.QuestionMapper;
import uk.gegc.trivia.shared.config.TriviaProperties;
import uk.gegc.trivia.shared.exception.ResourceNotFoundException;
import uk.gegc.trivia.shared.exception.UnprocessableEntityException;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@Transactional
public class QuestionServiceImpl implements QuestionService {

    private final QuestionRepository questionRepository;
    private final CategoryRepository categoryRepository;
    private final CategoryService categoryService;
    private final int questionsPerPage;

    public QuestionServiceImpl(QuestionRepository questionRepository,
                               CategoryRepository categoryRepository,
                               CategoryService categoryService,
                               TriviaProperties triviaProperties) {
        this.questionRepository = questionRepository;
        this.categoryRepository = categoryRepository;
        this.categoryService = categoryService;
        this.questionsPerPage = triviaProperties.getQuestionsPerPage();
    }

    @Override
    @Transactional(readOnly = true)
    public QuestionPage listQuestions(int page) {
        // PageRequest rejects offsets beyond Integer.MAX_VALUE
        if (page < 1 || (long) (page - 1) * questionsPerPage > Integer.MAX_VALUE) {
            throw new ResourceNotFoundException("Page " + page + " does not exist");
        }

        Page<Question> retrievedPage = questionRepository.findAll(
                PageRequest.of(page - 1, questionsPerPage, Sort.by("id").ascending()));
        if (retrievedPage.isEmpty()) {
            throw new ResourceNotFoundException("Page " + page + " has no questions");
        }

        Map<Long, String> categories = categoryService.getCategoryTypes();
        log.debug("Listed page {} with {} of {} questions", page, retrievedPage.getNumberOfElements(),
                retrievedPage.getTotalElements());

        return new QuestionPage(
                QuestionMapper.toDtos(retrievedPage.getContent()),
                retrievedPage.getTotalElements(),
                categories
        );
    }

    @Override
    public Long createQuestion(CreateQuestionRequest request) {
        Category category = categoryRepository.findById(request.category())
                .orElseThrow(() -> new UnprocessableEntityException(
                        "Category " + request.category() + " does not exist"));

        Question question = QuestionMapper.toEntity(request, category);
        questionRepository.save(question);

        log.info("Created question {} in category {}", question.getId(), category.getId());
        return question.getId();
    }

    @Override
    public Long deleteQuestion(Long questionId) {
        Question question = questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question " + questionId + " not found"));
        questionRepository.delete(question);

        log.info("Deleted question {}", questionId);
        return questionId;
    }

    @Override
    @Transactional(readOnly = true)
    public List<QuestionDto> searchQuestions(String searchTerm) {
        String term = searchTerm != null ? searchTerm : "";
        List<Question> matches = questionRepository.findAllByQuestionContainingIgnoreCaseOrderByIdAsc(term);
        log.debug("Search for '{}' matched {} questions", term, matches.size());
        return QuestionMapper.toDtos(matches);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QuestionDto> listQuestionsByCategory(Long categoryId) {
        List<Question> questions = questionRepository.findAllByCategory_IdOrderByIdAsc(categoryId);
        if (questions.isEmpty()) {
            throw new ResourceNotFoundException("No questions found for category " + categoryId);
        }
        return QuestionMapper.toDtos(questions);
    }
}

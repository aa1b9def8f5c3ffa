package uk.gegc.trivia.features.question.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import uk.gegc.trivia.BaseUnitTest;
import uk.gegc.trivia.features.category.application.CategoryService;
import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;
import uk.gegc.trivia.features.question.api.dto.CreateQuestionRequest;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.application.dto.QuestionPage;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.question.domain.repository.QuestionRepository;
import uk.gegc.trivia.shared.config.TriviaProperties;
import uk.gegc.trivia.shared.exception.ResourceNotFoundException;
import uk.gegc.trivia.shared.exception.UnprocessableEntityException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static uk.gegc.trivia.testsupport.TriviaFixtures.category;
import static uk.gegc.trivia.testsupport.TriviaFixtures.question;

@DisplayName("QuestionServiceImpl Unit Tests")
class QuestionServiceImplTest extends BaseUnitTest {

    private static final int PAGE_SIZE = 3;

    @Mock
    private QuestionRepository questionRepository;
    @Mock
    private CategoryRepository categoryRepository;
    @Mock
    private CategoryService categoryService;

    private QuestionServiceImpl service;
    private Category science;

    @BeforeEach
    void setUp() {
        TriviaProperties properties = new TriviaProperties();
        properties.setQuestionsPerPage(PAGE_SIZE);
        service = new QuestionServiceImpl(questionRepository, categoryRepository, categoryService, properties);
        science = category(1L, "Science");
    }

    @Test
    @DisplayName("listQuestions: requests the configured page size, 0-based and ordered by id")
    void listQuestions_usesConfiguredPageSize() {
        Pageable expected = PageRequest.of(1, PAGE_SIZE, Sort.by("id").ascending());
        List<Question> content = List.of(question(4L, "Q4", science), question(5L, "Q5", science));
        when(questionRepository.findAll(expected)).thenReturn(new PageImpl<>(content, expected, 5));
        when(categoryService.getCategoryTypes()).thenReturn(Map.of(1L, "Science"));

        QuestionPage page = service.listQuestions(2);

        assertEquals(5, page.totalQuestions());
        assertThat(page.questions()).extracting(QuestionDto::getId).containsExactly(4L, 5L);
        assertThat(page.categories()).containsEntry(1L, "Science");
        verify(questionRepository).findAll(expected);
    }

    @Test
    @DisplayName("listQuestions: page past the end throws NOT_FOUND without loading categories")
    void listQuestions_emptyPage_throws() {
        when(questionRepository.findAll(any(Pageable.class))).thenReturn(Page.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.listQuestions(7));
        verifyNoInteractions(categoryService);
    }

    @Test
    @DisplayName("listQuestions: page below 1 throws NOT_FOUND without querying")
    void listQuestions_pageBelowOne_throws() {
        assertThrows(ResourceNotFoundException.class, () -> service.listQuestions(0));
        verifyNoInteractions(questionRepository, categoryService);
    }

    @Test
    @DisplayName("listQuestions: page whose offset overflows an int throws NOT_FOUND without querying")
    void listQuestions_offsetOverflow_throws() {
        assertThrows(ResourceNotFoundException.class, () -> service.listQuestions(300_000_000));
        verifyNoInteractions(questionRepository, categoryService);
    }

    @Test
    @DisplayName("listQuestions: no categories propagates NOT_FOUND")
    void listQuestions_noCategories_throws() {
        Pageable expected = PageRequest.of(0, PAGE_SIZE, Sort.by("id").ascending());
        when(questionRepository.findAll(expected))
                .thenReturn(new PageImpl<>(List.of(question(1L, "Q1", science)), expected, 1));
        when(categoryService.getCategoryTypes()).thenThrow(new ResourceNotFoundException("No categories found"));

        assertThrows(ResourceNotFoundException.class, () -> service.listQuestions(1));
    }

    @Test
    @DisplayName("createQuestion: resolves the category, saves and returns the generated id")
    void createQuestion_savesAndReturnsId() {
        CreateQuestionRequest request = new CreateQuestionRequest("Why?", "Because", 3, 1L);
        when(categoryRepository.findById(1L)).thenReturn(Optional.of(science));
        when(questionRepository.save(any(Question.class))).thenAnswer(invocation -> {
            Question saved = invocation.getArgument(0);
            saved.setId(42L);
            return saved;
        });

        Long id = service.createQuestion(request);

        assertEquals(42L, id);
        ArgumentCaptor<Question> captor = ArgumentCaptor.forClass(Question.class);
        verify(questionRepository).save(captor.capture());
        Question saved = captor.getValue();
        assertEquals("Why?", saved.getQuestion());
        assertEquals("Because", saved.getAnswer());
        assertEquals(3, saved.getDifficulty());
        assertEquals(science, saved.getCategory());
    }

    @Test
    @DisplayName("createQuestion: unknown category throws UNPROCESSABLE_ENTITY and saves nothing")
    void createQuestion_unknownCategory_throws() {
        when(categoryRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(UnprocessableEntityException.class,
                () -> service.createQuestion(new CreateQuestionRequest("Why?", "Because", 3, 99L)));
        verify(questionRepository, never()).save(any());
    }

    @Test
    @DisplayName("deleteQuestion: deletes the found entity and returns its id")
    void deleteQuestion_found() {
        Question existing = question(8L, "Q8", science);
        when(questionRepository.findById(8L)).thenReturn(Optional.of(existing));

        assertEquals(8L, service.deleteQuestion(8L));
        verify(questionRepository).delete(existing);
    }

    @Test
    @DisplayName("deleteQuestion: missing question throws NOT_FOUND")
    void deleteQuestion_notFound() {
        when(questionRepository.findById(8L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.deleteQuestion(8L));
        verify(questionRepository, never()).delete(any());
    }

    @Test
    @DisplayName("searchQuestions: empty result is returned, not thrown")
    void searchQuestions_noMatches() {
        when(questionRepository.findAllByQuestionContainingIgnoreCaseOrderByIdAsc("zzz")).thenReturn(List.of());

        assertThat(service.searchQuestions("zzz")).isEmpty();
    }

    @Test
    @DisplayName("searchQuestions: null term searches with the empty string")
    void searchQuestions_nullTerm() {
        when(questionRepository.findAllByQuestionContainingIgnoreCaseOrderByIdAsc(""))
                .thenReturn(List.of(question(1L, "Q1", science)));

        assertThat(service.searchQuestions(null)).hasSize(1);
    }

    @Test
    @DisplayName("listQuestionsByCategory: maps questions and keeps category id")
    void listQuestionsByCategory_found() {
        when(questionRepository.findAllByCategory_IdOrderByIdAsc(1L))
                .thenReturn(List.of(question(1L, "Q1", science), question(2L, "Q2", science)));

        List<QuestionDto> result = service.listQuestionsByCategory(1L);

        assertThat(result).extracting(QuestionDto::getCategory).containsOnly(1L);
    }

    @Test
    @DisplayName("listQuestionsByCategory: no questions throws NOT_FOUND")
    void listQuestionsByCategory_empty() {
        when(questionRepository.findAllByCategory_IdOrderByIdAsc(3L)).thenReturn(List.of());

        assertThrows(ResourceNotFoundException.class, () -> service.listQuestionsByCategory(3L));
    }
}

package uk.gegc.trivia.features.question.domain.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.question.domain.model.Question;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class QuestionRepositoryTest {

    @Autowired
    private QuestionRepository questionRepository;

    @Autowired
    private TestEntityManager em;

    private Category science;
    private Category history;
    private Question atom;
    private Question cell;
    private Question rome;

    @BeforeEach
    void setUp() {
        science = em.persist(new Category("Science"));
        history = em.persist(new Category("History"));
        atom = em.persist(new Question("What is the smallest unit of an ELEMENT?", "Atom", 2, science));
        cell = em.persist(new Question("What is the basic unit of life?", "Cell", 1, science));
        rome = em.persist(new Question("In which year was Rome founded, by legend?", "753 BC", 5, history));
        em.flush();
        em.clear();
    }

    @Test
    @DisplayName("findAllByCategory_IdOrderByIdAsc: returns only the category's questions in id order")
    void findAllByCategory() {
        List<Question> result = questionRepository.findAllByCategory_IdOrderByIdAsc(science.getId());

        assertThat(result).extracting(Question::getId).containsExactly(atom.getId(), cell.getId());
    }

    @Test
    @DisplayName("findAllByCategory_IdOrderByIdAsc: unknown category yields nothing")
    void findAllByCategory_unknown() {
        assertThat(questionRepository.findAllByCategory_IdOrderByIdAsc(-1L)).isEmpty();
    }

    @Test
    @DisplayName("search: matches substrings regardless of case")
    void search_caseInsensitive() {
        assertThat(questionRepository.findAllByQuestionContainingIgnoreCaseOrderByIdAsc("element"))
                .extracting(Question::getId)
                .containsExactly(atom.getId());
        assertThat(questionRepository.findAllByQuestionContainingIgnoreCaseOrderByIdAsc("UNIT"))
                .extracting(Question::getId)
                .containsExactly(atom.getId(), cell.getId());
    }

    @Test
    @DisplayName("search: empty term matches every question")
    void search_emptyTerm() {
        assertThat(questionRepository.findAllByQuestionContainingIgnoreCaseOrderByIdAsc(""))
                .extracting(Question::getId)
                .containsExactly(atom.getId(), cell.getId(), rome.getId());
    }

    @Test
    @DisplayName("search: underscore is not a wildcard")
    void search_underscoreLiteral() {
        assertThat(questionRepository.findAllByQuestionContainingIgnoreCaseOrderByIdAsc("_")).isEmpty();
    }
}

package uk.gegc.trivia.features.question.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.trivia.features.question.domain.model.Question;

import java.util.List;

@Repository
public interface QuestionRepository extends JpaRepository<Question, Long> {

    List<Question> findAllByCategory_IdOrderByIdAsc(Long categoryId);

    /**
     * Case-insensitive substring match on the question text. LIKE wildcards in the term
     * are escaped by Spring Data, so {@code %} and {@code _} match literally.
     */
    List<Question> findAllByQuestionContainingIgnoreCaseOrderByIdAsc(String term);
}

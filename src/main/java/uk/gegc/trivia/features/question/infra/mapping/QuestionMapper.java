package uk.gegc.trivia.features.question.infra.mapping;

import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.question.api.dto.CreateQuestionRequest;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.domain.model.Question;

import java.util.List;

public final class QuestionMapper {

    private QuestionMapper() {
    }

    public static QuestionDto toDto(Question question) {
        QuestionDto dto = new QuestionDto();
        dto.setId(question.getId());
        dto.setQuestion(question.getQuestion());
        dto.setAnswer(question.getAnswer());
        dto.setDifficulty(question.getDifficulty());
        // id access does not initialize the lazy proxy
        dto.setCategory(question.getCategory() != null ? question.getCategory().getId() : null);
        return dto;
    }

    public static List<QuestionDto> toDtos(List<Question> questions) {
        return questions.stream()
                .map(QuestionMapper::toDto)
                .toList();
    }

    public static Question toEntity(CreateQuestionRequest request, Category category) {
        return new Question(
                request.question(),
                request.answer(),
                request.difficulty(),
                category
        );
    }
}

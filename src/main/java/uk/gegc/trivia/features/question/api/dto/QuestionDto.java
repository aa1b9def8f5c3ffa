package uk.gegc.trivia.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Schema(
        name = "QuestionDto",
        description = "A trivia question as served to the client"
)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuestionDto {

    @Schema(description = "Question id", example = "5")
    private Long id;

    @Schema(description = "Question text", example = "Whose autobiography is entitled 'I Know Why the Caged Bird Sings'?")
    private String question;

    @Schema(description = "Answer text", example = "Maya Angelou")
    private String answer;

    @Schema(description = "Difficulty level", example = "2")
    private Integer difficulty;

    @Schema(description = "Id of the category the question belongs to", example = "4")
    private Long category;
}

package uk.gegc.trivia.features.quiz.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.trivia.features.quiz.api.dto.QuizQuestionResponse;
import uk.gegc.trivia.features.quiz.api.dto.QuizRequest;
import uk.gegc.trivia.features.quiz.application.QuizService;
import uk.gegc.trivia.shared.api.dto.ErrorResponse;

@Tag(
        name = "Quizzes",
        description = "Quiz play: draw the next unplayed question"
)
@RestController
@RequestMapping("/quizzes")
@RequiredArgsConstructor
public class QuizController {

    private final QuizService quizService;

    @Operation(
            summary = "Next quiz question",
            description = """
                    Returns a random question from the selected category (id 0 for all categories)
                    that is not listed in previous_questions. When every eligible question has been
                    played, or the category has none, question is null and the quiz is over.
                    """,
            tags = {"Quizzes"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Next question returned, or null when the quiz is complete"),
            @ApiResponse(responseCode = "400", description = "Quiz category missing",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping
    public ResponseEntity<QuizQuestionResponse> playQuiz(@RequestBody @Valid QuizRequest request) {
        return ResponseEntity.ok(QuizQuestionResponse.of(
                quizService.nextQuestion(request.quizCategory().id(), request.previousQuestionsOrEmpty())
                        .orElse(null)
        ));
    }
}

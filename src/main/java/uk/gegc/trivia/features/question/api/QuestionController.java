package uk.gegc.trivia.features.question.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.trivia.features.question.api.dto.*;
import uk.gegc.trivia.features.question.application.QuestionService;
import uk.gegc.trivia.shared.api.dto.ErrorResponse;

import java.util.List;

@Tag(
        name = "Questions",
        description = "Listing, creating, deleting and searching trivia questions"
)
@RestController
@RequestMapping("/questions")
@RequiredArgsConstructor
public class QuestionController {

    private final QuestionService questionService;

    @Operation(
            summary = "List questions",
            description = "Get one page of questions ordered by id, together with every category",
            tags = {"Questions"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of questions returned"),
            @ApiResponse(responseCode = "404", description = "Page is empty or no categories exist",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping
    public ResponseEntity<QuestionPageResponse> getQuestions(
            @Parameter(
                    in = ParameterIn.QUERY,
                    description = "Page number (1-based)",
                    example = "1"
            )
            @RequestParam(defaultValue = "1") int page
    ) {
        return ResponseEntity.ok(QuestionPageResponse.of(questionService.listQuestions(page)));
    }

    @Operation(
            summary = "Create a question",
            description = "Add a new question to an existing category",
            tags = {"Questions"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question created"),
            @ApiResponse(responseCode = "400", description = "A field is missing or empty",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "Category does not exist",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @io.swagger.v3.oas.annotations.parameters.RequestBody(
            description = "Question to create",
            required = true,
            content = @Content(schema = @Schema(implementation = CreateQuestionRequest.class))
    )
    @PostMapping
    public ResponseEntity<QuestionIdResponse> createQuestion(@RequestBody @Valid CreateQuestionRequest request) {
        return ResponseEntity.ok(QuestionIdResponse.of(questionService.createQuestion(request)));
    }

    @Operation(
            summary = "Delete a question",
            description = "Permanently remove a question by its id",
            tags = {"Questions"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question deleted"),
            @ApiResponse(responseCode = "404", description = "Question not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<QuestionIdResponse> deleteQuestion(
            @Parameter(description = "Id of the question", required = true)
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(QuestionIdResponse.of(questionService.deleteQuestion(id)));
    }

    @Operation(
            summary = "Search questions",
            description = "Case-insensitive substring search on question text. An empty result is not an error.",
            tags = {"Questions"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching questions returned, possibly none")
    })
    @PostMapping("/search")
    public ResponseEntity<QuestionListResponse> searchQuestions(@RequestBody SearchQuestionsRequest request) {
        List<QuestionDto> questions = questionService.searchQuestions(request.searchTerm());
        return ResponseEntity.ok(QuestionListResponse.of(questions, null));
    }
}

package uk.gegc.trivia.features.category.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.trivia.features.category.api.dto.CategoriesResponse;
import uk.gegc.trivia.features.category.application.CategoryService;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.api.dto.QuestionListResponse;
import uk.gegc.trivia.features.question.application.QuestionService;
import uk.gegc.trivia.shared.api.dto.ErrorResponse;

import java.util.List;

@Tag(
        name = "Categories",
        description = "Read-only access to question categories"
)
@RestController
@RequestMapping("/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;
    private final QuestionService questionService;

    @Operation(
            summary = "List categories",
            description = "Get every category as a map from id to type label",
            tags = {"Categories"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Categories returned"),
            @ApiResponse(responseCode = "404", description = "No categories exist",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping
    public ResponseEntity<CategoriesResponse> getCategories() {
        return ResponseEntity.ok(CategoriesResponse.of(categoryService.getCategoryTypes()));
    }

    @Operation(
            summary = "List questions in a category",
            description = "Get every question of the category, ordered by id",
            tags = {"Categories"}
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Questions returned"),
            @ApiResponse(responseCode = "404", description = "No question belongs to the category",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{categoryId}/questions")
    public ResponseEntity<QuestionListResponse> getQuestionsByCategory(
            @Parameter(description = "Id of the category", required = true)
            @PathVariable Long categoryId
    ) {
        List<QuestionDto> questions = questionService.listQuestionsByCategory(categoryId);
        return ResponseEntity.ok(QuestionListResponse.of(questions, categoryId));
    }
}

package uk.gegc.trivia.features.category.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "All categories keyed by id")
public record CategoriesResponse(
        @Schema(example = "true")
        boolean success,

        @Schema(description = "Category type labels keyed by category id", example = "{\"1\": \"Science\", \"2\": \"Art\"}")
        Map<Long, String> categories
) {

    public static CategoriesResponse of(Map<Long, String> categories) {
        return new CategoriesResponse(true, categories);
    }
}

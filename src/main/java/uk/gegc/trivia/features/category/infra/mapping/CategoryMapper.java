package uk.gegc.trivia.features.category.infra.mapping;

import uk.gegc.trivia.features.category.domain.model.Category;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class CategoryMapper {

    private CategoryMapper() {
    }

    /**
     * Flattens categories into the {@code id -> type} map the client renders, keeping input order.
     */
    public static Map<Long, String> toTypeMap(List<Category> categories) {
        Map<Long, String> types = new LinkedHashMap<>();
        for (Category category : categories) {
            types.put(category.getId(), category.getType());
        }
        return types;
    }
}

package uk.gegc.trivia.features.category.application;

import java.util.Map;

public interface CategoryService {

    /**
     * @return every category as {@code id -> type}, ordered by id
     * @throws uk.gegc.trivia.shared.exception.ResourceNotFoundException when no category exists
     */
    Map<Long, String> getCategoryTypes();
}

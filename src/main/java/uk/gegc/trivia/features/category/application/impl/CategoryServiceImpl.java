package uk.gegc.trivia.features.category.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.category.application.CategoryService;
import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;
import uk.gegc.trivia.features.category.infra.mapping.CategoryMapper;
import uk.gegc.trivia.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class CategoryServiceImpl implements CategoryService {

    private final CategoryRepository categoryRepository;

    @Override
    public Map<Long, String> getCategoryTypes() {
        List<Category> categories = categoryRepository.findAllByOrderByIdAsc();
        if (categories.isEmpty()) {
            throw new ResourceNotFoundException("No categories found");
        }
        log.debug("Loaded {} categories", categories.size());
        return CategoryMapper.toTypeMap(categories);
    }
}

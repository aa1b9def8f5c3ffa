package uk.gegc.trivia.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    static final List<String> DEFAULT_CATEGORY_TYPES = List.of(
            "Science", "Art", "Geography", "History", "Entertainment", "Sports"
    );

    private final CategoryRepository categoryRepository;
    private final TriviaProperties triviaProperties;

    @Override
    @Transactional
    public void run(String... args) {
        if (!triviaProperties.getSeed().isEnabled()) {
            log.debug("Category seeding disabled");
            return;
        }

        try {
            ensureDefaultCategoriesPresent();
        } catch (RuntimeException e) {
            log.error("Error during data initialization: {}", e.getMessage(), e);
            throw e;
        }
    }

    protected void ensureDefaultCategoriesPresent() {
        long existing = categoryRepository.count();
        if (existing > 0) {
            log.debug("Found {} categories, skipping seed", existing);
            return;
        }

        List<Category> defaults = DEFAULT_CATEGORY_TYPES.stream()
                .map(Category::new)
                .toList();
        categoryRepository.saveAll(defaults);
        log.info("Seeded {} default categories", defaults.size());
    }
}

package email.labeler.app.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Loaded category configuration. Categories keep the order in which they appear in the
 * configuration document; rule scoring resolves ties by that order.
 */
@Getter
public class CategoryConfigStore {
    private final List<CategoryConfig> categories;
    private final GlobalSettings globalSettings;
    private final ScoringWeights scoringWeights;

    public CategoryConfigStore(List<CategoryConfig> categories, GlobalSettings globalSettings, ScoringWeights scoringWeights) {
        this.categories = Collections.unmodifiableList(List.copyOf(categories));
        this.globalSettings = globalSettings;
        this.scoringWeights = scoringWeights;
    }

    public List<String> getCategoryNames() {
        return categories.stream().map(CategoryConfig::getName).collect(Collectors.toList());
    }

    public Optional<CategoryConfig> findCategory(String name) {
        return categories.stream().filter(c -> c.getName().equals(name)).findFirst();
    }
}

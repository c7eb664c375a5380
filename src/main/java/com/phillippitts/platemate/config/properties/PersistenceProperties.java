package com.phillippitts.platemate.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for persisted assistant state.
 *
 * @param stateFile         JSON file holding history, preferences, favorites and recent searches
 * @param maxHistory        number of most recent messages kept when state is loaded
 * @param maxRecentSearches size of the recent-search list
 */
@Validated
@ConfigurationProperties(prefix = "persistence")
public record PersistenceProperties(
        @NotBlank
        @DefaultValue("data/platemate-state.json")
        String stateFile,

        @Positive
        @DefaultValue("50")
        int maxHistory,

        @Positive
        @DefaultValue("10")
        int maxRecentSearches
) {
}

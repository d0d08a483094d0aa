package io.devdash.dashboard.navigation;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.devdash.common.model.NavigationSection;

import java.util.List;

public record NavigationResult(
        List<NavigationSection> sections,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> failedModules
) {
    public NavigationResult {
        sections = sections == null ? List.of() : List.copyOf(sections);
        failedModules = failedModules == null ? List.of() : List.copyOf(failedModules);
    }
}

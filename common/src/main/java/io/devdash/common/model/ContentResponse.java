package io.devdash.common.model;

import java.util.List;

public record ContentResponse(
        String title,
        List<ContentView> views
) {
    public ContentResponse {
        views = views == null ? List.of() : List.copyOf(views);
    }

    public static ContentResponse of(String title, ContentView... views) {
        return new ContentResponse(title, List.of(views));
    }
}

package io.devdash.common.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A renderable piece of content. {@code type} tells the client which component renders {@code data}.
 */
public record ContentView(
        String type,
        String title,
        Object data
) {
    public static final String TABLE = "table";
    public static final String SUMMARY = "summary";

    public static ContentView table(String title, List<String> columns, List<Map<String, Object>> rows) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("columns", List.copyOf(columns));
        data.put("rows", List.copyOf(rows));
        return new ContentView(TABLE, title, data);
    }

    public static ContentView summary(String title, Map<String, Object> items) {
        return new ContentView(SUMMARY, title, new LinkedHashMap<>(items));
    }
}

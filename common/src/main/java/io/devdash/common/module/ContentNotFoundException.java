package io.devdash.common.module;

public class ContentNotFoundException extends RuntimeException {
    public ContentNotFoundException() {
        super();
    }

    public ContentNotFoundException(String path) {
        super("Content not found: " + path);
    }
}

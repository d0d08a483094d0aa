package io.devdash.dashboard.registry;

public class DuplicateContentPathException extends RuntimeException {
    private final String contentPath;

    public DuplicateContentPathException(String contentPath, String registeredModule, String rejectedModule) {
        super("Content path " + contentPath + " is already registered by module " + registeredModule
                + ", cannot register module " + rejectedModule);
        this.contentPath = contentPath;
    }

    public String contentPath() {
        return contentPath;
    }
}

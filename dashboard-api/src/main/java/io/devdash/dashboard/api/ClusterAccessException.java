package io.devdash.dashboard.api;

/**
 * A cluster collaborator call failed. The message is what the client sees; the cause is only logged.
 */
public class ClusterAccessException extends RuntimeException {
    public ClusterAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.devdash.dashboard.api;

/**
 * Body of every failure response: {@code {"error":{"code":404,"message":"not found"}}}.
 */
public record ErrorResponse(ErrorMessage error) {

    public record ErrorMessage(int code, String message) {
    }

    public static ErrorResponse of(int code, String message) {
        return new ErrorResponse(new ErrorMessage(code, message));
    }
}

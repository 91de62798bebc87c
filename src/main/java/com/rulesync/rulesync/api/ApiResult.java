package com.rulesync.rulesync.api;

/**
 * Outcome of one HTTP call: the decoded body on success, or a failure description.
 * A successful call may still carry a {@code null} body when the response was empty.
 */
public record ApiResult<T>(T body, int status, String error) {

    public static final int NO_STATUS = -1;

    public static <T> ApiResult<T> success(T body, int status) {
        return new ApiResult<>(body, status, null);
    }

    public static <T> ApiResult<T> failure(int status, String error) {
        return new ApiResult<>(null, status, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasBody() {
        return isSuccess() && body != null;
    }
}

package de.htwsaar.socialnet.common.dto;

/**
 * Error envelope shared by all services: {@code {"success": false, "error": {...}}}.
 */
public class ApiErrorResponse {

    private boolean success;
    private ApiError error;

    public ApiErrorResponse() {}

    public ApiErrorResponse(ApiError error) {
        this.success = false;
        this.error = error;
    }

    public static ApiErrorResponse of(String code, String message) {
        return new ApiErrorResponse(new ApiError(code, message));
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public ApiError getError() {
        return error;
    }

    public void setError(ApiError error) {
        this.error = error;
    }
}

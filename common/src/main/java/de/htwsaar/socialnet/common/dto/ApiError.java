package de.htwsaar.socialnet.common.dto;

/**
 * Machine readable error code plus a message that is safe to show to clients.
 */
public class ApiError {

    private String code;
    private String message;

    public ApiError() {}

    public ApiError(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}

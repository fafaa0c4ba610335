package com.tasklens.exception;

/**
 * Body of every failure response.
 */
public record ErrorBody(ErrorDetail error) {

    public static ErrorBody of(String code, String message) {
        return new ErrorBody(new ErrorDetail(code, message));
    }

    public record ErrorDetail(String code, String message) {}
}

package com.questrail.chat.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ErrorInfo
 * -----------------------------------------------------------------------------
 * Immutable description of an error as reported by the realtime collaborator
 * or raised by this library.
 *
 * <p>{@code code} is a library or transport error code (see {@link ErrorCode}),
 * {@code statusCode} an HTTP-like status. An {@code ErrorInfo} may wrap the
 * {@code ErrorInfo} that caused it.</p>
 */
public record ErrorInfo(String message, int code, int statusCode, ErrorInfo cause)
{
    public ErrorInfo {
        Objects.requireNonNull(message, "message");
    }

    public ErrorInfo(String message, int code, int statusCode) {
        this(message, code, statusCode, null);
    }

    public static ErrorInfo of(ErrorCode code, int statusCode, String message) {
        return new ErrorInfo(message, code.code(), statusCode, null);
    }

    /**
     * Converts an arbitrary failure into an {@code ErrorInfo}.
     * <p>
     * A {@link ChatException} yields its own error info; anything else becomes
     * a generic internal error (code 50000, status 500) with the throwable's
     * message.
     */
    public static ErrorInfo from(Throwable failure) {
        Objects.requireNonNull(failure, "failure");
        if (failure instanceof ChatException chat) {
            return chat.errorInfo();
        }
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return new ErrorInfo(message, 50000, 500, null);
    }

    public Optional<ErrorInfo> causeInfo() {
        return Optional.ofNullable(cause);
    }

    /**
     * @return {@code true} if this error carries the given code
     */
    public boolean is(ErrorCode errorCode) {
        return code == errorCode.code();
    }

    @Override
    public String toString() {
        return "ErrorInfo[" + code + "/" + statusCode + ": " + message
                + (cause != null ? ", cause=" + cause : "") + "]";
    }
}

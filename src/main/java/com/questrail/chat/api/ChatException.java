package com.questrail.chat.api;

import java.util.Objects;

/**
 * Raised by room operations and by the message consistency model.
 *
 * <p>The carried {@link ErrorInfo} identifies the failure kind through its
 * code; callers are expected to branch on {@link #is(ErrorCode)} rather than on
 * exception subtypes.</p>
 */
public final class ChatException extends RuntimeException
{
    private final ErrorInfo errorInfo;

    public ChatException(ErrorInfo errorInfo) {
        super(Objects.requireNonNull(errorInfo, "errorInfo").message());
        this.errorInfo = errorInfo;
    }

    public ChatException(ErrorInfo errorInfo, Throwable cause) {
        super(Objects.requireNonNull(errorInfo, "errorInfo").message(), cause);
        this.errorInfo = errorInfo;
    }

    public static ChatException of(ErrorCode code, int statusCode, String message) {
        return new ChatException(ErrorInfo.of(code, statusCode, message));
    }

    public static ChatException invalidArgument(String message) {
        return of(ErrorCode.INVALID_ARGUMENT, 400, message);
    }

    public ErrorInfo errorInfo() {
        return errorInfo;
    }

    public int code() {
        return errorInfo.code();
    }

    public int statusCode() {
        return errorInfo.statusCode();
    }

    public boolean is(ErrorCode code) {
        return errorInfo.is(code);
    }
}

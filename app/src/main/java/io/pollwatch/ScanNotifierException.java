package io.pollwatch;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a notifier cannot be constructed, when a lifecycle call is made in a state that does not allow
 * it, or when the scan loop hits an unexpected failure.
 */
public class ScanNotifierException extends Exception {
    private final ErrorCode code;

    public ScanNotifierException(ErrorCode code) {
        super(format(code, null));
        this.code = code;
    }

    public ScanNotifierException(ErrorCode code, Throwable cause) {
        super(format(code, cause), cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    private static String format(ErrorCode code, @Nullable Throwable cause) {
        var message = "pollwatch: " + code.description();
        if (cause != null && cause.getMessage() != null) {
            message += ": " + cause.getMessage();
        }
        return message;
    }
}

package io.pollwatch;

/** Failure kinds reported by a {@link ScanNotifier}. */
public enum ErrorCode {
    INTERNAL_ERROR("internal error"),
    INVALID_ROOT_DIR_PATH("invalid root directory path"),
    INITIALIZATION("error parsing root directory"),
    NOT_RUNNING("scan notifier is not running"),
    ALREADY_STARTED("scan notifier has already started"),
    STOPPING("scan notifier is stopping"),
    NOT_READY("scan notifier is not (re)initialized");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}

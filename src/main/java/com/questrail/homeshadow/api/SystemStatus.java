package com.questrail.homeshadow.api;

import java.util.Optional;

/**
 * Controller busy state, published on the system-status feed.
 */
public enum SystemStatus
{
    NOT_BUSY("0"),
    BUSY("1"),
    IDLE("2"),
    SAFE_MODE("3");

    private final String code;

    SystemStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<SystemStatus> fromCode(String code) {
        for (SystemStatus status : values()) {
            if (status.code.equals(code)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

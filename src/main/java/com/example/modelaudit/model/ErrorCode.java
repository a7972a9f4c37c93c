package com.example.modelaudit.model;

import java.util.Arrays;
import java.util.Optional;

public enum ErrorCode {
    NULL("#NULL!"),
    DIV_ZERO("#DIV/0!"),
    VALUE("#VALUE!"),
    REF("#REF!"),
    NAME("#NAME?"),
    NUM("#NUM!"),
    NA("#N/A"),
    GETTING_DATA("#GETTING_DATA"),
    SPILL("#SPILL!"),
    CALC("#CALC!");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<ErrorCode> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String trimmed = code.trim();
        return Arrays.stream(values())
                .filter(errorCode -> errorCode.code.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return code;
    }
}

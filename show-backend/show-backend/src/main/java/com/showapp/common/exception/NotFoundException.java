package com.showapp.common.exception;

import java.util.Collections;
import java.util.Map;

public class NotFoundException extends RuntimeException {

    public static final String DEFAULT_CODE = "NOT_FOUND";

    private final String errorCode;
    private final Map<String, Object> details;

    public NotFoundException(String message, String errorCode, Map<String, Object> details) {
        super(message);
        this.errorCode = (errorCode == null || errorCode.isBlank()) ? DEFAULT_CODE : errorCode;
        this.details = (details == null) ? Collections.emptyMap() : details;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}

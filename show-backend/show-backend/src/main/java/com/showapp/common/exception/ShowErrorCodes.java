package com.showapp.common.exception;

/**
 * Error codes carried by {@link NotFoundException} so clients can tell the
 * not-found cases apart without parsing messages.
 */
public final class ShowErrorCodes {

    public static final String DATE_NOT_PARSEABLE = "DATE_NOT_PARSEABLE";
    public static final String SHOW_NOT_FOUND = "SHOW_NOT_FOUND";
    public static final String YEAR_NOT_FOUND = "YEAR_NOT_FOUND";

    private ShowErrorCodes() {}
}

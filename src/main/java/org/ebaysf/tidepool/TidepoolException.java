package org.ebaysf.tidepool;

import com.google.common.base.Preconditions;

/**
 * A failure the caller can see and act upon, as opposed to a programming error.
 */
public class TidepoolException extends RuntimeException {

    public enum Code {
        CANCELLED,
        INVALID_ARGUMENT,
        FAILED_PRECONDITION,
        UNIMPLEMENTED,
        INTERNAL,
        UNAVAILABLE
    }

    private final Code _code;

    public TidepoolException(final Code code, final String message) {

        super(message);

        _code = Preconditions.checkNotNull(code);
    }

    public TidepoolException(final Code code, final String message, final Throwable cause) {

        super(message, cause);

        _code = Preconditions.checkNotNull(code);
    }

    public Code getCode() {

        return _code;
    }
}

package com.contactline.error;

/**
 * Base type for failures a caller of the phone line operations must see.
 *
 * <p>Each subtype carries the HTTP status the transport reports it with, so
 * the mapping lives next to the failure rather than in the server.
 */
public abstract class PhoneLineException extends RuntimeException {

    protected PhoneLineException(final String message) {
        super(message);
    }

    protected PhoneLineException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public abstract int httpStatus();
}

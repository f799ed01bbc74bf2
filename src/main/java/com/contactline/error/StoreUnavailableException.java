package com.contactline.error;

/**
 * The key-value store is not configured, could not be initialized, or a
 * call against it failed. The message includes the underlying cause.
 */
public class StoreUnavailableException extends PhoneLineException {

    public StoreUnavailableException(final String message) {
        super(message);
    }

    public StoreUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public int httpStatus() {
        return 500;
    }
}

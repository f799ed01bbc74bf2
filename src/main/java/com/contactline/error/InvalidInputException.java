package com.contactline.error;

/**
 * The request body was unusable: missing phone, a phone that does not
 * normalize to 13 digits, or malformed JSON. Raised before any store access.
 */
public class InvalidInputException extends PhoneLineException {

    public InvalidInputException(final String message) {
        super(message);
    }

    public InvalidInputException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public int httpStatus() {
        return 400;
    }
}

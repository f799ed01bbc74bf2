package com.contactline.error;

/** The supplied administrator password did not match. Terminal for the request. */
public class InvalidCredentialException extends PhoneLineException {

    public InvalidCredentialException() {
        super("Incorrect password");
    }

    @Override
    public int httpStatus() {
        return 401;
    }
}

package com.contactline.error;

/**
 * The normalizer returned something other than 13 digits for an input that
 * had enough digits to pass its own length check. Reported to the caller as
 * invalid input; the value is never stored.
 */
public class NormalizationAnomalyException extends InvalidInputException {

    public NormalizationAnomalyException(final String normalized) {
        super("Invalid phone number. Normalization produced " + normalized.length()
                + " digits, expected 13.");
    }
}

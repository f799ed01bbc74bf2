package com.contactline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Result of a successful update or counter reset.
 *
 * <p>{@code normalizedPhone} is only present for updates; a reset leaves the
 * stored number untouched and reports just the counter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "message", "changeCount", "normalizedPhone"})
public final class UpdateOutcome {

    private final String message;
    private final long   changeCount;
    private final String normalizedPhone;

    private UpdateOutcome(final String message, final long changeCount, final String normalizedPhone) {
        this.message         = message;
        this.changeCount     = changeCount;
        this.normalizedPhone = normalizedPhone;
    }

    public static UpdateOutcome updated(final String normalizedPhone, final long changeCount) {
        return new UpdateOutcome("Number updated successfully! Saved as: " + normalizedPhone,
                changeCount, normalizedPhone);
    }

    public static UpdateOutcome reset() {
        return new UpdateOutcome("Counter reset successfully!", 0L, null);
    }

    public boolean isSuccess()          { return true; }
    public String  getMessage()         { return message; }
    public long    getChangeCount()     { return changeCount; }
    public String  getNormalizedPhone() { return normalizedPhone; }

    @Override
    public String toString() {
        return "UpdateOutcome{changeCount=" + changeCount
             + (normalizedPhone != null ? ", normalizedPhone=" + normalizedPhone : "")
             + "}";
    }
}

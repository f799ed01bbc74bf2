package com.contactline.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * What the public read returns: the number to contact, the message to
 * prefill and how many times the number has been changed.
 */
@JsonPropertyOrder({"phone", "message", "changeCount"})
public final class PhoneSnapshot {

    private final String phone;
    private final String message;
    private final long   changeCount;

    public PhoneSnapshot(final String phone, final String message, final long changeCount) {
        this.phone       = phone;
        this.message     = message;
        this.changeCount = changeCount;
    }

    public String getPhone()       { return phone; }
    public String getMessage()     { return message; }
    public long   getChangeCount() { return changeCount; }

    @Override
    public String toString() {
        return "PhoneSnapshot{phone=" + phone + ", changeCount=" + changeCount + "}";
    }
}

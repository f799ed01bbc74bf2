package com.contactline.model;

import com.contactline.error.InvalidInputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Body of an administrator {@code POST}.
 *
 * <pre>{@code
 * { "phone": "+54 11 4344 3600", "password": "..." }   // update
 * { "password": "...", "reset": true }                 // counter reset
 * }</pre>
 *
 * <p>Only a JSON boolean {@code true} selects a reset. A numeric phone is
 * accepted and read as its decimal text; a non-string password never matches.
 */
public final class PhoneUpdateRequest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String  phone;
    private final String  password;
    private final boolean reset;

    public PhoneUpdateRequest(final String phone, final String password, final boolean reset) {
        this.phone    = phone;
        this.password = password;
        this.reset    = reset;
    }

    public static PhoneUpdateRequest update(final String phone, final String password) {
        return new PhoneUpdateRequest(phone, password, false);
    }

    public static PhoneUpdateRequest resetCounter(final String password) {
        return new PhoneUpdateRequest(null, password, true);
    }

    /**
     * @throws InvalidInputException if {@code json} is not a JSON object
     */
    public static PhoneUpdateRequest fromJson(final String json) {
        final JsonNode node;
        try {
            node = json == null || json.isBlank() ? MAPPER.createObjectNode() : MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed JSON body: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject()) {
            throw new InvalidInputException("Request body must be a JSON object");
        }

        final JsonNode phoneNode    = node.path("phone");
        final JsonNode passwordNode = node.path("password");
        final JsonNode resetNode    = node.path("reset");

        final String phone    = phoneNode.isTextual() || phoneNode.isNumber() ? phoneNode.asText() : null;
        final String password = passwordNode.isTextual() ? passwordNode.asText() : null;
        final boolean reset   = resetNode.isBoolean() && resetNode.booleanValue();
        return new PhoneUpdateRequest(phone, password, reset);
    }

    public String  getPhone()    { return phone; }
    public String  getPassword() { return password; }
    public boolean isReset()     { return reset; }

    @Override
    public String toString() {
        // never print the password
        return "PhoneUpdateRequest{phone=" + phone + ", reset=" + reset + "}";
    }
}

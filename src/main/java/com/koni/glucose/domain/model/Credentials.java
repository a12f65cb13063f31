package com.koni.glucose.domain.model;

import com.koni.glucose.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Login credentials for the health-data service, supplied per request.
 * The secret is never persisted and never appears in {@link #toString()}.
 */
@Getter
@EqualsAndHashCode
public final class Credentials {

    private final String identifier;
    private final String secret;

    public Credentials(String identifier, String secret) {
        this.identifier = identifier;
        this.secret = secret;
    }

    /**
     * Validates that both parts of the credentials are present.
     *
     * @throws ValidationException if the identifier or the secret is blank
     */
    public void validate() {
        if (identifier == null || identifier.isBlank()) {
            throw new ValidationException("useremail is required");
        }
        if (secret == null || secret.isEmpty()) {
            throw new ValidationException("password is required");
        }
    }

    @Override
    public String toString() {
        return "Credentials{identifier=" + identifier + ", secret=****}";
    }
}

package com.koni.glucose.domain.model;

import lombok.Getter;

/**
 * Result of a successful login: the opaque session token issued by the service
 * and the account identifier the measurements are stored under.
 * Valid for a single retrieval only.
 */
@Getter
public final class Session {

    private final String token;
    private final String accountId;

    public Session(String token, String accountId) {
        this.token = token;
        this.accountId = accountId;
    }

    @Override
    public String toString() {
        return "Session{accountId=" + accountId + "}";
    }
}

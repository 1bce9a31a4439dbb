package com.hellokaton.lumen.config;

import lombok.Getter;

/**
 * Signed cookie session options.
 */
@Getter
public class SessionConfig {

    private final String secretKey;
    private String sessionCookie = "session";
    private long maxAge = 14 * 24 * 60 * 60;
    private String path = "/";
    private String sameSite = "lax";
    private boolean httpsOnly;

    public SessionConfig(String secretKey) {
        this.secretKey = secretKey;
    }

    public SessionConfig sessionCookie(String sessionCookie) {
        this.sessionCookie = sessionCookie;
        return this;
    }

    public SessionConfig maxAge(long maxAge) {
        this.maxAge = maxAge;
        return this;
    }

    public SessionConfig path(String path) {
        this.path = path;
        return this;
    }

    public SessionConfig sameSite(String sameSite) {
        this.sameSite = sameSite;
        return this;
    }

    public SessionConfig httpsOnly(boolean httpsOnly) {
        this.httpsOnly = httpsOnly;
        return this;
    }

}

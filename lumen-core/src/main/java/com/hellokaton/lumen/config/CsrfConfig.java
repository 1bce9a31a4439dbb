package com.hellokaton.lumen.config;

import lombok.Getter;

/**
 * Double submit cookie CSRF protection options.
 */
@Getter
public class CsrfConfig {

    private final String secret;
    private String cookieName = "csrftoken";
    private String headerName = "X-CSRFToken";
    private String cookiePath = "/";
    private boolean cookieSecure;
    private boolean cookieHttpOnly;
    private String cookieSameSite = "lax";

    public CsrfConfig(String secret) {
        this.secret = secret;
    }

    public CsrfConfig cookieName(String cookieName) {
        this.cookieName = cookieName;
        return this;
    }

    public CsrfConfig headerName(String headerName) {
        this.headerName = headerName;
        return this;
    }

    public CsrfConfig cookiePath(String cookiePath) {
        this.cookiePath = cookiePath;
        return this;
    }

    public CsrfConfig cookieSecure(boolean cookieSecure) {
        this.cookieSecure = cookieSecure;
        return this;
    }

    public CsrfConfig cookieHttpOnly(boolean cookieHttpOnly) {
        this.cookieHttpOnly = cookieHttpOnly;
        return this;
    }

    public CsrfConfig cookieSameSite(String cookieSameSite) {
        this.cookieSameSite = cookieSameSite;
        return this;
    }

}

package com.hellokaton.lumen.mvc.http;

import lombok.Getter;

/**
 * A cookie to be sent with a response.
 */
@Getter
public class Cookie {

    private final String name;
    private final String value;
    private String path = "/";
    private long maxAge = -1;
    private boolean httpOnly;
    private boolean secure;
    private String sameSite;

    public Cookie(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public Cookie path(String path) {
        this.path = path;
        return this;
    }

    public Cookie maxAge(long maxAge) {
        this.maxAge = maxAge;
        return this;
    }

    public Cookie httpOnly(boolean httpOnly) {
        this.httpOnly = httpOnly;
        return this;
    }

    public Cookie secure(boolean secure) {
        this.secure = secure;
        return this;
    }

    public Cookie sameSite(String sameSite) {
        this.sameSite = sameSite;
        return this;
    }

    /**
     * Render as a {@code Set-Cookie} header value.
     */
    public String toHeader() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append('=').append(value == null ? "" : value);
        if (null != path) {
            sb.append("; Path=").append(path);
        }
        if (maxAge >= 0) {
            sb.append("; Max-Age=").append(maxAge);
        }
        if (httpOnly) {
            sb.append("; HttpOnly");
        }
        if (secure) {
            sb.append("; Secure");
        }
        if (null != sameSite) {
            sb.append("; SameSite=").append(sameSite);
        }
        return sb.toString();
    }

}

package com.hellokaton.lumen.mvc.middleware;

import com.hellokaton.lumen.config.CsrfConfig;
import com.hellokaton.lumen.kit.SignKit;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.http.Cookie;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Double submit cookie protection. Safe requests receive a signed token
 * cookie; unsafe requests must echo the cookie value in the configured
 * header or are rejected with 403.
 */
@Slf4j
public class CsrfMiddleware implements Application {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Application app;
    private final CsrfConfig config;

    public CsrfMiddleware(Application app, CsrfConfig config) {
        this.app = app;
        this.config = config;
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        String cookieToken = context.request().cookie(config.getCookieName());
        boolean safe;
        try {
            safe = context.request().httpMethod().isSafe();
        } catch (IllegalArgumentException e) {
            safe = false;
        }
        if (safe) {
            app.handle(context);
            if (null == cookieToken || null == SignKit.unsign(config.getSecret(), cookieToken, -1)) {
                context.response().cookie(new Cookie(config.getCookieName(), newToken())
                        .path(config.getCookiePath())
                        .secure(config.isCookieSecure())
                        .httpOnly(config.isCookieHttpOnly())
                        .sameSite(config.getCookieSameSite()));
            }
            return;
        }
        String submitted = context.header(config.getHeaderName());
        if (null == cookieToken || null == submitted
                || !MessageDigest.isEqual(cookieToken.getBytes(StandardCharsets.UTF_8), submitted.getBytes(StandardCharsets.UTF_8))
                || null == SignKit.unsign(config.getSecret(), cookieToken, -1)) {
            log.debug("CSRF token verification failed on {} {}", context.method(), context.uri());
            context.status(403).text("CSRF token verification failed");
            return;
        }
        app.handle(context);
    }

    String newToken() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return SignKit.sign(config.getSecret(), Base64.getUrlEncoder().withoutPadding().encodeToString(bytes));
    }

}

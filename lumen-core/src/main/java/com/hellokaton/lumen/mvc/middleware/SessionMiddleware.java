package com.hellokaton.lumen.mvc.middleware;

import com.hellokaton.lumen.config.SessionConfig;
import com.hellokaton.lumen.exception.LumenException;
import com.hellokaton.lumen.kit.JsonKit;
import com.hellokaton.lumen.kit.SignKit;
import com.hellokaton.lumen.mvc.Application;
import com.hellokaton.lumen.mvc.RouteContext;
import com.hellokaton.lumen.mvc.http.Cookie;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session data kept client side in a signed cookie: base64 encoded json,
 * signed with the session secret and expiring after {@code maxAge}.
 * An invalid or expired cookie starts an empty session.
 */
@Slf4j
public class SessionMiddleware implements Application {

    private final Application app;
    private final SessionConfig config;

    public SessionMiddleware(Application app, SessionConfig config) {
        this.app = app;
        this.config = config;
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        String cookie = context.request().cookie(config.getSessionCookie());
        Map<String, Object> session = new LinkedHashMap<>();
        if (null != cookie) {
            session.putAll(decode(cookie));
        }
        context.session(session);

        app.handle(context);

        if (!session.isEmpty()) {
            context.response().cookie(sessionCookie(encode(session)).maxAge(config.getMaxAge()));
        } else if (null != cookie) {
            context.response().cookie(sessionCookie("null").maxAge(0));
        }
    }

    private Cookie sessionCookie(String value) {
        return new Cookie(config.getSessionCookie(), value)
                .path(config.getPath())
                .httpOnly(true)
                .secure(config.isHttpsOnly())
                .sameSite(config.getSameSite());
    }

    String encode(Map<String, Object> session) {
        String json = JsonKit.toJson(session);
        String payload = Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
        return SignKit.sign(config.getSecretKey(), payload);
    }

    Map<String, Object> decode(String cookie) {
        String payload = SignKit.unsign(config.getSecretKey(), cookie, config.getMaxAge());
        if (null == payload) {
            log.debug("Discard invalid session cookie");
            return new LinkedHashMap<>();
        }
        try {
            String json = new String(Base64.getUrlDecoder().decode(payload), StandardCharsets.UTF_8);
            return JsonKit.toMap(json);
        } catch (IllegalArgumentException | LumenException e) {
            log.debug("Discard malformed session cookie", e);
            return new LinkedHashMap<>();
        }
    }

}

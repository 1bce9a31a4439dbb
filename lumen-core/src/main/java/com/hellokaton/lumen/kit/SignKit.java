package com.hellokaton.lumen.kit;

import com.hellokaton.lumen.exception.LumenException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HMAC-SHA256 signing of cookie values. A signed value reads
 * {@code value.timestamp.signature}, the timestamp in epoch seconds.
 */
public final class SignKit {

    private static final String ALGORITHM = "HmacSHA256";

    private SignKit() {
    }

    public static String sign(String secret, String value) {
        return sign(secret, value, System.currentTimeMillis() / 1000);
    }

    public static String sign(String secret, String value, long timestamp) {
        String payload = value + "." + timestamp;
        return payload + "." + signature(secret, payload);
    }

    /**
     * Verify a signed value.
     *
     * @param maxAge seconds the signature stays valid, negative for no limit
     * @return the original value, or {@code null} when the signature is bad or expired
     */
    public static String unsign(String secret, String signed, long maxAge) {
        if (null == signed) {
            return null;
        }
        int sigDot = signed.lastIndexOf('.');
        if (sigDot <= 0) {
            return null;
        }
        String payload = signed.substring(0, sigDot);
        String expected = signature(secret, payload);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
                signed.substring(sigDot + 1).getBytes(StandardCharsets.US_ASCII))) {
            return null;
        }
        int tsDot = payload.lastIndexOf('.');
        if (tsDot < 0) {
            return null;
        }
        long timestamp;
        try {
            timestamp = Long.parseLong(payload.substring(tsDot + 1));
        } catch (NumberFormatException e) {
            return null;
        }
        if (maxAge >= 0 && System.currentTimeMillis() / 1000 - timestamp > maxAge) {
            return null;
        }
        return payload.substring(0, tsDot);
    }

    private static String signature(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new LumenException("Sign value error", e);
        }
    }

}

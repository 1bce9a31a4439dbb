package com.hellokaton.lumen.kit;

import org.junit.Test;

import static org.junit.Assert.*;

public class SignKitTest {

    @Test
    public void testSignAndUnsign() {
        String signed = SignKit.sign("secret", "payload");
        assertEquals("payload", SignKit.unsign("secret", signed, 60));
        assertNull(SignKit.unsign("other", signed, 60));
        assertNull(SignKit.unsign("secret", signed + "x", 60));
        assertNull(SignKit.unsign("secret", "payload", 60));
        assertNull(SignKit.unsign("secret", null, 60));
    }

    @Test
    public void testExpiry() {
        long anHourAgo = System.currentTimeMillis() / 1000 - 3600;
        String signed = SignKit.sign("secret", "payload", anHourAgo);
        assertNull(SignKit.unsign("secret", signed, 60));
        assertEquals("payload", SignKit.unsign("secret", signed, -1));
    }

}

package com.hellokaton.lumen.config;

import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import org.junit.Test;

import java.time.ZoneId;
import java.util.Arrays;
import java.util.Properties;

import static org.junit.Assert.*;

public class LumenSettingsTest {

    @Test
    public void testDefaults() {
        LumenSettings settings = LumenSettings.defaults();
        assertEquals("Lumen", settings.getTitle());
        assertEquals(Boolean.FALSE, settings.getDebug());
        assertEquals(Boolean.TRUE, settings.getRedirectSlashes());
        assertEquals(ZoneId.of("UTC"), settings.getTimezone());
        assertSame(ExitStackConfig.DEFAULT, settings.getExitStackConfig());
    }

    @Test
    public void testLoadProperties() {
        Properties properties = new Properties();
        properties.setProperty("lumen.title", "Billing");
        properties.setProperty("lumen.allow-origins", "https://a.com, https://b.com");
        properties.setProperty("lumen.enable-openapi", "false");
        properties.setProperty("other.title", "ignored");

        LumenSettings settings = LumenSettings.load(properties);
        assertEquals("Billing", settings.getTitle());
        assertEquals(Arrays.asList("https://a.com", "https://b.com"), settings.getAllowOrigins());
        assertEquals(Boolean.FALSE, settings.getEnableOpenApi());
        assertEquals("lumen", settings.getAppName());
    }

    @Test
    public void testFromClasspath() {
        LumenSettings settings = LumenSettings.fromClasspath("lumen-test.properties");
        assertEquals("Orders", settings.getTitle());
        assertEquals("orders", settings.getAppName());
        assertEquals(Boolean.TRUE, settings.getDebug());
        assertEquals(Boolean.FALSE, settings.getRedirectSlashes());
        assertEquals(Arrays.asList("example.com", "*.example.org"), settings.getAllowedHosts());
        assertEquals(ZoneId.of("Europe/Lisbon"), settings.getTimezone());
        assertEquals(Arrays.asList("orders", "internal"), settings.getTags());
    }

    @Test(expected = ImproperlyConfiguredException.class)
    public void testMissingResource() {
        LumenSettings.fromClasspath("missing.properties");
    }

    @Test(expected = ImproperlyConfiguredException.class)
    public void testInvalidTimezone() {
        Properties properties = new Properties();
        properties.setProperty("lumen.timezone", "Mars/Olympus");
        LumenSettings.load(properties);
    }

}

package com.hellokaton.lumen.config;

import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.mvc.route.LifecycleHook;
import com.hellokaton.lumen.mvc.route.Lifespan;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;

public class ConfigMergerTest {

    public static class CustomSettings extends LumenSettings {
        public CustomSettings() {
            title("custom").allowedHosts("custom.example.com");
        }
    }

    public static class BrokenSettings extends LumenSettings {
        public BrokenSettings(String required) {
        }
    }

    @Test
    public void testExplicitValueWins() {
        AppConfig config = ConfigMerger.merge(new AppOptions().title("orders").version("2.0"), LumenSettings.defaults());
        assertEquals("orders", config.getTitle());
        assertEquals("2.0", config.getVersion());
        assertEquals("lumen", config.getAppName());
    }

    @Test
    public void testFalsyExplicitValueFallsBackToSettings() {
        LumenSettings settings = LumenSettings.defaults().debug(true).title("from settings");
        AppConfig config = ConfigMerger.merge(new AppOptions().debug(false).title(""), settings);
        assertTrue(config.isDebug());
        assertEquals("from settings", config.getTitle());
    }

    @Test
    public void testCollectionsDefaultToEmptyAndUnmodifiable() {
        AppConfig config = ConfigMerger.merge(new AppOptions(), LumenSettings.defaults());
        assertTrue(config.getAllowedHosts().isEmpty());
        assertTrue(config.getMiddleware().isEmpty());
        assertTrue(config.getExceptionHandlers().isEmpty());
        assertNull(config.getCorsConfig());
        assertSame(ExitStackConfig.DEFAULT, config.getExitStackConfig());

        AppConfig withHosts = ConfigMerger.merge(new AppOptions().allowedHosts("example.com"), LumenSettings.defaults());
        try {
            withHosts.getAllowedHosts().add("evil.com");
            fail("resolved collections must be unmodifiable");
        } catch (UnsupportedOperationException e) {
            assertEquals(Collections.singletonList("example.com"), withHosts.getAllowedHosts());
        }
    }

    @Test
    public void testExplicitListReplacesSettingsList() {
        LumenSettings settings = LumenSettings.defaults().allowedHosts("settings.example.com");
        AppConfig config = ConfigMerger.merge(new AppOptions().allowedHosts("explicit.example.com"), settings);
        assertEquals(Collections.singletonList("explicit.example.com"), config.getAllowedHosts());

        AppConfig fallback = ConfigMerger.merge(new AppOptions(), settings);
        assertEquals(Collections.singletonList("settings.example.com"), fallback.getAllowedHosts());
    }

    @Test(expected = ImproperlyConfiguredException.class)
    public void testAllowOriginsAndCorsConfigConflict() {
        ConfigMerger.merge(new AppOptions().allowOrigins("https://a.com").corsConfig(new CorsConfig()), LumenSettings.defaults());
    }

    @Test(expected = ImproperlyConfiguredException.class)
    public void testConflictInSettingsIsRejected() {
        LumenSettings settings = LumenSettings.defaults().allowOrigins("https://a.com").corsConfig(new CorsConfig());
        ConfigMerger.merge(new AppOptions(), settings);
    }

    @Test
    public void testCorsGroupResolvesAsUnit() {
        CorsConfig cors = new CorsConfig().allowOrigins("https://explicit.com");
        LumenSettings settings = LumenSettings.defaults().allowOrigins("https://settings.com");
        AppConfig config = ConfigMerger.merge(new AppOptions().corsConfig(cors), settings);
        assertSame(cors, config.getCorsConfig());
        assertTrue(config.getAllowOrigins().isEmpty());
    }

    @Test
    public void testAllowOriginsShorthandDerivesCorsConfig() {
        AppConfig config = ConfigMerger.merge(new AppOptions().allowOrigins("https://a.com", "https://b.com"), LumenSettings.defaults());
        assertNotNull(config.getCorsConfig());
        assertEquals(Arrays.asList("https://a.com", "https://b.com"), config.getCorsConfig().getAllowOrigins());
        assertEquals(Arrays.asList("https://a.com", "https://b.com"), config.getAllowOrigins());
    }

    @Test(expected = ImproperlyConfiguredException.class)
    public void testLifespanAndHooksConflict() {
        AppOptions options = new AppOptions()
                .lifespan(mock(Lifespan.class))
                .onStartup(mock(LifecycleHook.class));
        ConfigMerger.merge(options, LumenSettings.defaults());
    }

    @Test
    public void testLifespanGroupResolvesAsUnit() {
        LifecycleHook hook = mock(LifecycleHook.class);
        LumenSettings settings = LumenSettings.defaults().lifespan(mock(Lifespan.class));
        AppConfig config = ConfigMerger.merge(new AppOptions().onStartup(hook), settings);
        assertNull(config.getLifespan());
        assertEquals(Collections.singletonList(hook), config.getOnStartup());
        assertTrue(config.getOnShutdown().isEmpty());

        AppConfig fromSettings = ConfigMerger.merge(new AppOptions(), settings);
        assertNotNull(fromSettings.getLifespan());
        assertTrue(fromSettings.getOnStartup().isEmpty());
    }

    @Test
    public void testResolveSettings() {
        LumenSettings settings = LumenSettings.defaults().title("given");
        assertSame(settings, ConfigMerger.resolveSettings(new AppOptions().settings(settings)));

        LumenSettings custom = ConfigMerger.resolveSettings(new AppOptions().settingsClass(CustomSettings.class));
        assertTrue(custom instanceof CustomSettings);
        assertEquals("custom", ConfigMerger.merge(new AppOptions(), custom).getTitle());

        assertEquals("Lumen", ConfigMerger.resolveSettings(new AppOptions()).getTitle());
    }

    @Test(expected = ImproperlyConfiguredException.class)
    public void testSettingsClassWithoutDefaultConstructor() {
        ConfigMerger.resolveSettings(new AppOptions().settingsClass(BrokenSettings.class));
    }

    @Test
    public void testPick() {
        assertEquals("a", ConfigMerger.pick("a", "b"));
        assertEquals("b", ConfigMerger.pick("", "b"));
        assertEquals("b", ConfigMerger.pick(null, "b"));
        assertEquals(Boolean.TRUE, ConfigMerger.pick(Boolean.FALSE, Boolean.TRUE));
        assertEquals(Collections.singletonList(1), ConfigMerger.pick(Collections.<Integer>emptyList(), Collections.singletonList(1)));
    }

}

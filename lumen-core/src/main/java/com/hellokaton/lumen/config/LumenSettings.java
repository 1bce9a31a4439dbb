package com.hellokaton.lumen.config;

import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.kit.StringKit;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Properties;

/**
 * Default values for every application option.
 * <p>
 * Subclass to provide project wide defaults, or load them from
 * {@code lumen.*} properties. The settings object is read only from the
 * application's point of view: nothing is ever written back into it.
 */
@Slf4j
public class LumenSettings extends ConfigSource<LumenSettings> {

    public static final String PREFIX = "lumen.";

    public LumenSettings() {
        this.debug(false)
                .title("Lumen")
                .appName("lumen")
                .summary("Lumen application")
                .description("Lumen web application")
                .version("1.0.0")
                .enableScheduler(false)
                .timezone(ZoneId.of("UTC"))
                .rootPath("")
                .includeInSchema(true)
                .enableOpenApi(true)
                .redirectSlashes(true)
                .exitStackConfig(ExitStackConfig.DEFAULT);
    }

    public static LumenSettings defaults() {
        return new LumenSettings();
    }

    /**
     * Defaults overridden by the {@code lumen.*} entries of the given properties.
     */
    public static LumenSettings load(Properties properties) {
        LumenSettings settings = new LumenSettings();
        String debug = property(properties, "debug");
        if (null != debug) {
            settings.debug(Boolean.parseBoolean(debug));
        }
        String title = property(properties, "title");
        if (null != title) {
            settings.title(title);
        }
        String appName = property(properties, "app-name");
        if (null != appName) {
            settings.appName(appName);
        }
        String summary = property(properties, "summary");
        if (null != summary) {
            settings.summary(summary);
        }
        String description = property(properties, "description");
        if (null != description) {
            settings.description(description);
        }
        String version = property(properties, "version");
        if (null != version) {
            settings.version(version);
        }
        String secretKey = property(properties, "secret-key");
        if (null != secretKey) {
            settings.secretKey(secretKey);
        }
        List<String> allowedHosts = StringKit.splitList(property(properties, "allowed-hosts"));
        if (!allowedHosts.isEmpty()) {
            settings.allowedHosts(allowedHosts);
        }
        List<String> allowOrigins = StringKit.splitList(property(properties, "allow-origins"));
        if (!allowOrigins.isEmpty()) {
            settings.allowOrigins(allowOrigins);
        }
        String rootPath = property(properties, "root-path");
        if (null != rootPath) {
            settings.rootPath(rootPath);
        }
        String enableScheduler = property(properties, "enable-scheduler");
        if (null != enableScheduler) {
            settings.enableScheduler(Boolean.parseBoolean(enableScheduler));
        }
        String enableOpenApi = property(properties, "enable-openapi");
        if (null != enableOpenApi) {
            settings.enableOpenApi(Boolean.parseBoolean(enableOpenApi));
        }
        String includeInSchema = property(properties, "include-in-schema");
        if (null != includeInSchema) {
            settings.includeInSchema(Boolean.parseBoolean(includeInSchema));
        }
        String redirectSlashes = property(properties, "redirect-slashes");
        if (null != redirectSlashes) {
            settings.redirectSlashes(Boolean.parseBoolean(redirectSlashes));
        }
        String timezone = property(properties, "timezone");
        if (null != timezone) {
            try {
                settings.timezone(ZoneId.of(timezone));
            } catch (DateTimeException e) {
                throw new ImproperlyConfiguredException("Invalid " + PREFIX + "timezone '" + timezone + "'", e);
            }
        }
        List<String> tags = StringKit.splitList(property(properties, "tags"));
        if (!tags.isEmpty()) {
            settings.tags(tags.toArray(new String[0]));
        }
        return settings;
    }

    /**
     * Load settings from a properties file on the classpath.
     */
    public static LumenSettings fromClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (null == loader) {
            loader = LumenSettings.class.getClassLoader();
        }
        InputStream in = loader.getResourceAsStream(resource);
        if (null == in) {
            throw new ImproperlyConfiguredException("Settings resource '" + resource + "' not found on the classpath");
        }
        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ImproperlyConfiguredException("Read settings resource '" + resource + "' error", e);
        }
        log.debug("Loaded {} settings entries from {}", properties.size(), resource);
        return load(properties);
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        return null == value ? null : value.trim();
    }

    @Override
    protected LumenSettings self() {
        return this;
    }

}

package com.hellokaton.lumen.config;

import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.kit.StringKit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges explicit application options with settings defaults.
 * <p>
 * Every field resolves to the explicit value when it is supplied and to the
 * settings value otherwise. Two groups of options are mutually exclusive and
 * resolve as a unit: the origin list shorthand and a full CORS config, and a
 * lifespan callback and startup/shutdown hooks. Supplying both sides of a
 * group in the same source is a configuration error.
 */
public final class ConfigMerger {

    private ConfigMerger() {
    }

    /**
     * Resolve the settings an application reads its defaults from.
     */
    public static LumenSettings resolveSettings(AppOptions options) {
        if (null != options.getSettings()) {
            return options.getSettings();
        }
        Class<? extends LumenSettings> settingsClass = options.getSettingsClass();
        if (null == settingsClass) {
            return LumenSettings.defaults();
        }
        if (!LumenSettings.class.isAssignableFrom(settingsClass)) {
            throw new ImproperlyConfiguredException("settings class must be a subclass of LumenSettings");
        }
        try {
            return settingsClass.getConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ImproperlyConfiguredException("Create settings " + settingsClass.getName() + " error", e);
        }
    }

    public static AppConfig merge(AppOptions explicit, LumenSettings defaults) {
        validate(explicit, "application options");
        validate(defaults, "settings");

        ConfigSource<?> corsSource = suppliesCors(explicit) ? explicit : defaults;
        List<String> allowOrigins = list(corsSource.getAllowOrigins());
        CorsConfig corsConfig = corsSource.getCorsConfig();
        if (null == corsConfig && !allowOrigins.isEmpty()) {
            corsConfig = new CorsConfig().allowOrigins(allowOrigins);
        }

        ConfigSource<?> lifespanSource = suppliesLifespan(explicit) ? explicit : defaults;
        ExitStackConfig exitStackConfig = pick(explicit.getExitStackConfig(), defaults.getExitStackConfig());

        return AppConfig.builder()
                .debug(flag(explicit.getDebug(), defaults.getDebug()))
                .title(pick(explicit.getTitle(), defaults.getTitle()))
                .appName(pick(explicit.getAppName(), defaults.getAppName()))
                .summary(pick(explicit.getSummary(), defaults.getSummary()))
                .description(pick(explicit.getDescription(), defaults.getDescription()))
                .version(pick(explicit.getVersion(), defaults.getVersion()))
                .contact(map(pick(explicit.getContact(), defaults.getContact())))
                .termsOfService(pick(explicit.getTermsOfService(), defaults.getTermsOfService()))
                .license(pick(explicit.getLicense(), defaults.getLicense()))
                .servers(list(pick(explicit.getServers(), defaults.getServers())))
                .secretKey(pick(explicit.getSecretKey(), defaults.getSecretKey()))
                .allowedHosts(list(pick(explicit.getAllowedHosts(), defaults.getAllowedHosts())))
                .allowOrigins(allowOrigins)
                .permissions(list(pick(explicit.getPermissions(), defaults.getPermissions())))
                .interceptors(list(pick(explicit.getInterceptors(), defaults.getInterceptors())))
                .csrfConfig(pick(explicit.getCsrfConfig(), defaults.getCsrfConfig()))
                .corsConfig(corsConfig)
                .openApiConfig(pick(explicit.getOpenApiConfig(), defaults.getOpenApiConfig()))
                .templateConfig(pick(explicit.getTemplateConfig(), defaults.getTemplateConfig()))
                .staticFilesConfig(list(pick(explicit.getStaticFilesConfig(), defaults.getStaticFilesConfig())))
                .sessionConfig(pick(explicit.getSessionConfig(), defaults.getSessionConfig()))
                .responseHeaders(map(pick(explicit.getResponseHeaders(), defaults.getResponseHeaders())))
                .responseCookies(list(pick(explicit.getResponseCookies(), defaults.getResponseCookies())))
                .schedulerFactory(pick(explicit.getSchedulerFactory(), defaults.getSchedulerFactory()))
                .schedulerTasks(map(pick(explicit.getSchedulerTasks(), defaults.getSchedulerTasks())))
                .schedulerConfigurations(map(pick(explicit.getSchedulerConfigurations(), defaults.getSchedulerConfigurations())))
                .enableScheduler(flag(explicit.getEnableScheduler(), defaults.getEnableScheduler()))
                .timezone(pick(explicit.getTimezone(), defaults.getTimezone()))
                .rootPath(nullToEmpty(pick(explicit.getRootPath(), defaults.getRootPath())))
                .middleware(list(pick(explicit.getMiddleware(), defaults.getMiddleware())))
                .exceptionHandlers(map(pick(explicit.getExceptionHandlers(), defaults.getExceptionHandlers())))
                .onStartup(list(lifespanSource.getOnStartup()))
                .onShutdown(list(lifespanSource.getOnShutdown()))
                .lifespan(lifespanSource.getLifespan())
                .tags(list(pick(explicit.getTags(), defaults.getTags())))
                .includeInSchema(flag(explicit.getIncludeInSchema(), defaults.getIncludeInSchema()))
                .enableOpenApi(flag(explicit.getEnableOpenApi(), defaults.getEnableOpenApi()))
                .redirectSlashes(flag(explicit.getRedirectSlashes(), defaults.getRedirectSlashes()))
                .security(list(pick(explicit.getSecurity(), defaults.getSecurity())))
                .extensions(list(pick(explicit.getExtensions(), defaults.getExtensions())))
                .exitStackConfig(null != exitStackConfig ? exitStackConfig : ExitStackConfig.DEFAULT)
                .build();
    }

    /**
     * The explicit value when supplied, else the default.
     */
    public static <T> T pick(T explicit, T defaultValue) {
        return StringKit.isTruthy(explicit) ? explicit : defaultValue;
    }

    static void validate(ConfigSource<?> source, String origin) {
        if (StringKit.isTruthy(source.getAllowOrigins()) && null != source.getCorsConfig()) {
            throw new ImproperlyConfiguredException("It can be only allow_origins or cors_config but not both (" + origin + ").");
        }
        if (null != source.getLifespan()
                && (StringKit.isTruthy(source.getOnStartup()) || StringKit.isTruthy(source.getOnShutdown()))) {
            throw new ImproperlyConfiguredException("Use either 'lifespan' or 'on_startup'/'on_shutdown', not both (" + origin + ").");
        }
    }

    private static boolean suppliesCors(ConfigSource<?> source) {
        return StringKit.isTruthy(source.getAllowOrigins()) || null != source.getCorsConfig();
    }

    private static boolean suppliesLifespan(ConfigSource<?> source) {
        return null != source.getLifespan()
                || StringKit.isTruthy(source.getOnStartup())
                || StringKit.isTruthy(source.getOnShutdown());
    }

    private static boolean flag(Boolean explicit, Boolean defaultValue) {
        Boolean value = pick(explicit, defaultValue);
        return null != value && value;
    }

    private static String nullToEmpty(String value) {
        return null == value ? "" : value;
    }

    private static <T> List<T> list(List<T> value) {
        if (null == value || value.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(value));
    }

    private static <K, V> Map<K, V> map(Map<K, V> value) {
        if (null == value || value.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

}

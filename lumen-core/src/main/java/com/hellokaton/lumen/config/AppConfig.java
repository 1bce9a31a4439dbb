package com.hellokaton.lumen.config;

import com.hellokaton.lumen.Extension;
import com.hellokaton.lumen.mvc.handler.ExceptionHandler;
import com.hellokaton.lumen.mvc.handler.ExceptionKey;
import com.hellokaton.lumen.mvc.handler.Interceptor;
import com.hellokaton.lumen.mvc.handler.Permission;
import com.hellokaton.lumen.mvc.hook.Middleware;
import com.hellokaton.lumen.mvc.http.Cookie;
import com.hellokaton.lumen.mvc.route.LifecycleHook;
import com.hellokaton.lumen.mvc.route.Lifespan;
import com.hellokaton.lumen.scheduler.SchedulerConfig;
import com.hellokaton.lumen.scheduler.SchedulerFactory;
import com.hellokaton.lumen.template.TemplateConfig;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Resolved configuration of one application instance.
 * <p>
 * Built once by {@link ConfigMerger} and never modified; collections are
 * unmodifiable. Object valued fields that were supplied nowhere are
 * {@code null}, collection valued ones are empty.
 */
@Getter
@Builder(access = AccessLevel.PACKAGE)
public final class AppConfig {

    private final boolean debug;
    private final String title;
    private final String appName;
    private final String summary;
    private final String description;
    private final String version;
    private final Map<String, String> contact;
    private final String termsOfService;
    private final String license;
    private final List<String> servers;
    private final String secretKey;
    private final List<String> allowedHosts;
    private final List<String> allowOrigins;
    private final List<Permission> permissions;
    private final List<Interceptor> interceptors;
    private final CsrfConfig csrfConfig;
    private final CorsConfig corsConfig;
    private final OpenApiConfig openApiConfig;
    private final TemplateConfig templateConfig;
    private final List<StaticFilesConfig> staticFilesConfig;
    private final SessionConfig sessionConfig;
    private final Map<String, String> responseHeaders;
    private final List<Cookie> responseCookies;
    private final SchedulerFactory schedulerFactory;
    private final Map<String, String> schedulerTasks;
    private final Map<String, Object> schedulerConfigurations;
    private final boolean enableScheduler;
    private final ZoneId timezone;
    private final String rootPath;
    private final List<Middleware> middleware;
    private final Map<ExceptionKey, ExceptionHandler> exceptionHandlers;
    private final List<LifecycleHook> onStartup;
    private final List<LifecycleHook> onShutdown;
    private final Lifespan lifespan;
    private final List<String> tags;
    private final boolean includeInSchema;
    private final boolean enableOpenApi;
    private final boolean redirectSlashes;
    private final List<Map<String, List<String>>> security;
    private final List<Extension> extensions;
    private final ExitStackConfig exitStackConfig;

    public SchedulerConfig schedulerConfig() {
        return new SchedulerConfig(schedulerTasks, schedulerConfigurations, timezone);
    }

}

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
import com.hellokaton.lumen.scheduler.SchedulerFactory;
import com.hellokaton.lumen.template.TemplateConfig;
import lombok.Getter;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every option an application can be configured with. A field left at
 * {@code null} (or empty) is "not supplied".
 * <p>
 * All mutators are fluent and return {@code this}. List valued mutators
 * append, map valued mutators put.
 *
 * @param <S> the concrete options type
 */
@Getter
public abstract class ConfigSource<S extends ConfigSource<S>> {

    private Boolean debug;
    private String title;
    private String appName;
    private String summary;
    private String description;
    private String version;
    private Map<String, String> contact;
    private String termsOfService;
    private String license;
    private List<String> servers;
    private String secretKey;
    private List<String> allowedHosts;
    private List<String> allowOrigins;
    private List<Permission> permissions;
    private List<Interceptor> interceptors;
    private CsrfConfig csrfConfig;
    private CorsConfig corsConfig;
    private OpenApiConfig openApiConfig;
    private TemplateConfig templateConfig;
    private List<StaticFilesConfig> staticFilesConfig;
    private SessionConfig sessionConfig;
    private Map<String, String> responseHeaders;
    private List<Cookie> responseCookies;
    private SchedulerFactory schedulerFactory;
    private Map<String, String> schedulerTasks;
    private Map<String, Object> schedulerConfigurations;
    private Boolean enableScheduler;
    private ZoneId timezone;
    private String rootPath;
    private List<Middleware> middleware;
    private Map<ExceptionKey, ExceptionHandler> exceptionHandlers;
    private List<LifecycleHook> onStartup;
    private List<LifecycleHook> onShutdown;
    private Lifespan lifespan;
    private List<String> tags;
    private Boolean includeInSchema;
    private Boolean enableOpenApi;
    private Boolean redirectSlashes;
    private List<Map<String, List<String>>> security;
    private List<Extension> extensions;
    private ExitStackConfig exitStackConfig;

    protected abstract S self();

    public S debug(Boolean debug) {
        this.debug = debug;
        return self();
    }

    public S title(String title) {
        this.title = title;
        return self();
    }

    public S appName(String appName) {
        this.appName = appName;
        return self();
    }

    public S summary(String summary) {
        this.summary = summary;
        return self();
    }

    public S description(String description) {
        this.description = description;
        return self();
    }

    public S version(String version) {
        this.version = version;
        return self();
    }

    public S contact(String key, String value) {
        this.contact = put(this.contact, key, value);
        return self();
    }

    public S termsOfService(String termsOfService) {
        this.termsOfService = termsOfService;
        return self();
    }

    public S license(String license) {
        this.license = license;
        return self();
    }

    public S servers(String... servers) {
        this.servers = append(this.servers, servers);
        return self();
    }

    public S secretKey(String secretKey) {
        this.secretKey = secretKey;
        return self();
    }

    public S allowedHosts(String... allowedHosts) {
        this.allowedHosts = append(this.allowedHosts, allowedHosts);
        return self();
    }

    public S allowedHosts(List<String> allowedHosts) {
        this.allowedHosts = append(this.allowedHosts, allowedHosts.toArray(new String[0]));
        return self();
    }

    public S allowOrigins(String... allowOrigins) {
        this.allowOrigins = append(this.allowOrigins, allowOrigins);
        return self();
    }

    public S allowOrigins(List<String> allowOrigins) {
        this.allowOrigins = append(this.allowOrigins, allowOrigins.toArray(new String[0]));
        return self();
    }

    public S permissions(Permission... permissions) {
        this.permissions = append(this.permissions, permissions);
        return self();
    }

    public S interceptors(Interceptor... interceptors) {
        this.interceptors = append(this.interceptors, interceptors);
        return self();
    }

    public S csrfConfig(CsrfConfig csrfConfig) {
        this.csrfConfig = csrfConfig;
        return self();
    }

    public S corsConfig(CorsConfig corsConfig) {
        this.corsConfig = corsConfig;
        return self();
    }

    public S openApiConfig(OpenApiConfig openApiConfig) {
        this.openApiConfig = openApiConfig;
        return self();
    }

    public S templateConfig(TemplateConfig templateConfig) {
        this.templateConfig = templateConfig;
        return self();
    }

    public S staticFilesConfig(StaticFilesConfig... staticFilesConfig) {
        this.staticFilesConfig = append(this.staticFilesConfig, staticFilesConfig);
        return self();
    }

    public S sessionConfig(SessionConfig sessionConfig) {
        this.sessionConfig = sessionConfig;
        return self();
    }

    public S responseHeader(String name, String value) {
        this.responseHeaders = put(this.responseHeaders, name, value);
        return self();
    }

    public S responseCookies(Cookie... responseCookies) {
        this.responseCookies = append(this.responseCookies, responseCookies);
        return self();
    }

    public S schedulerFactory(SchedulerFactory schedulerFactory) {
        this.schedulerFactory = schedulerFactory;
        return self();
    }

    public S schedulerTask(String name, String task) {
        this.schedulerTasks = put(this.schedulerTasks, name, task);
        return self();
    }

    public S schedulerConfiguration(String key, Object value) {
        this.schedulerConfigurations = put(this.schedulerConfigurations, key, value);
        return self();
    }

    public S enableScheduler(Boolean enableScheduler) {
        this.enableScheduler = enableScheduler;
        return self();
    }

    public S timezone(ZoneId timezone) {
        this.timezone = timezone;
        return self();
    }

    public S rootPath(String rootPath) {
        this.rootPath = rootPath;
        return self();
    }

    public S middleware(Middleware... middleware) {
        this.middleware = append(this.middleware, middleware);
        return self();
    }

    public S exceptionHandler(Class<? extends Throwable> type, ExceptionHandler handler) {
        this.exceptionHandlers = put(this.exceptionHandlers, ExceptionKey.of(type), handler);
        return self();
    }

    public S exceptionHandler(int status, ExceptionHandler handler) {
        this.exceptionHandlers = put(this.exceptionHandlers, ExceptionKey.of(status), handler);
        return self();
    }

    public S onStartup(LifecycleHook... hooks) {
        this.onStartup = append(this.onStartup, hooks);
        return self();
    }

    public S onShutdown(LifecycleHook... hooks) {
        this.onShutdown = append(this.onShutdown, hooks);
        return self();
    }

    public S lifespan(Lifespan lifespan) {
        this.lifespan = lifespan;
        return self();
    }

    public S tags(String... tags) {
        this.tags = append(this.tags, tags);
        return self();
    }

    public S includeInSchema(Boolean includeInSchema) {
        this.includeInSchema = includeInSchema;
        return self();
    }

    public S enableOpenApi(Boolean enableOpenApi) {
        this.enableOpenApi = enableOpenApi;
        return self();
    }

    public S redirectSlashes(Boolean redirectSlashes) {
        this.redirectSlashes = redirectSlashes;
        return self();
    }

    public S security(String scheme, String... scopes) {
        Map<String, List<String>> requirement = new LinkedHashMap<>();
        requirement.put(scheme, Arrays.asList(scopes));
        List<Map<String, List<String>>> requirements = null == this.security ? new ArrayList<>() : this.security;
        requirements.add(requirement);
        this.security = requirements;
        return self();
    }

    public S extensions(Extension... extensions) {
        this.extensions = append(this.extensions, extensions);
        return self();
    }

    public S exitStackConfig(ExitStackConfig exitStackConfig) {
        this.exitStackConfig = exitStackConfig;
        return self();
    }

    @SafeVarargs
    private static <T> List<T> append(List<T> current, T... items) {
        List<T> list = null == current ? new ArrayList<>() : current;
        if (null != items) {
            for (T item : items) {
                if (null != item) {
                    list.add(item);
                }
            }
        }
        return list;
    }

    private static <K, V> Map<K, V> put(Map<K, V> current, K key, V value) {
        Map<K, V> map = null == current ? new LinkedHashMap<>() : current;
        map.put(key, value);
        return map;
    }

}

package com.hellokaton.lumen.mvc.hook;

import com.hellokaton.lumen.exception.ImproperlyConfiguredException;
import com.hellokaton.lumen.mvc.Application;
import lombok.AccessLevel;
import lombok.Getter;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.function.Function;

/**
 * Declaration of a middleware layer: the layer type, the factory that wraps
 * the next application, and the options bound to it.
 * <p>
 * Declarations are inert. The layer is only constructed by {@link #wrap(Application)}
 * when the middleware stack is built, so one declaration can be reused by
 * every rebuild.
 */
@Getter
public final class Middleware {

    private final Class<? extends Application> type;
    private final MiddlewareFactory<?> factory;
    private final Object options;
    @Getter(AccessLevel.NONE)
    private final Function<Application, Application> binding;

    private <O> Middleware(Class<? extends Application> type, MiddlewareFactory<O> factory, O options) {
        this.type = type;
        this.factory = factory;
        this.options = options;
        this.binding = app -> factory.create(app, options);
    }

    public static <O> Middleware of(Class<? extends Application> type, MiddlewareFactory<O> factory, O options) {
        if (null == factory) {
            throw new ImproperlyConfiguredException("Middleware factory must not be null");
        }
        return new Middleware(type, factory, options);
    }

    public static Middleware of(Class<? extends Application> type, final Function<Application, ? extends Application> factory) {
        if (null == factory) {
            throw new ImproperlyConfiguredException("Middleware factory must not be null");
        }
        return new Middleware(type, (MiddlewareFactory<Void>) (app, options) -> factory.apply(app), null);
    }

    /**
     * Declare a middleware class constructed reflectively through its public
     * constructor taking the next {@link Application}.
     */
    public static Middleware of(final Class<? extends Application> type) {
        final Constructor<? extends Application> constructor;
        try {
            constructor = type.getConstructor(Application.class);
        } catch (NoSuchMethodException e) {
            throw new ImproperlyConfiguredException(
                    "Middleware " + type.getName() + " must declare a public constructor taking the next Application", e);
        }
        return new Middleware(type, (MiddlewareFactory<Void>) (app, options) -> instantiate(constructor, app), null);
    }

    private static Application instantiate(Constructor<? extends Application> constructor, Application app) {
        try {
            return constructor.newInstance(app);
        } catch (InvocationTargetException e) {
            throw new ImproperlyConfiguredException("Create middleware " + constructor.getDeclaringClass().getName() + " error", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ImproperlyConfiguredException("Create middleware " + constructor.getDeclaringClass().getName() + " error", e);
        }
    }

    public Application wrap(Application app) {
        return binding.apply(app);
    }

    public String getName() {
        return null != type ? type.getSimpleName() : "anonymous";
    }

    @Override
    public String toString() {
        return "Middleware(" + getName() + ")";
    }

}

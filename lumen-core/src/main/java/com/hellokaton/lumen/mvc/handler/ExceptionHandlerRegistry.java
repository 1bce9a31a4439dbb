package com.hellokaton.lumen.mvc.handler;

import com.hellokaton.lumen.mvc.route.Gateway;
import com.hellokaton.lumen.mvc.route.Include;
import com.hellokaton.lumen.mvc.route.ResolvedRoute;
import com.hellokaton.lumen.mvc.route.RouteAggregator;
import com.hellokaton.lumen.mvc.route.RouteNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the exception handlers of an application.
 * <p>
 * Application level handlers are registered first and framework defaults
 * only fill the gaps. Route declarations are then merged top-down, a
 * later registration replacing an earlier one for the same key, so the
 * deepest declaration on a path wins. Catch-all keys end up in the error
 * handler and never shadow a typed handler.
 */
@Slf4j
public final class ExceptionHandlerRegistry {

    private ExceptionHandlerRegistry() {
    }

    public static ExceptionHandlerMap build(Map<ExceptionKey, ExceptionHandler> explicit,
                                            Map<ExceptionKey, ExceptionHandler> defaults,
                                            List<? extends RouteNode> routes) {
        Map<ExceptionKey, ExceptionHandler> merged = new LinkedHashMap<>();
        if (null != explicit) {
            merged.putAll(explicit);
        }
        if (null != defaults) {
            for (Map.Entry<ExceptionKey, ExceptionHandler> entry : defaults.entrySet()) {
                merged.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        List<Map.Entry<ExceptionKey, ExceptionHandler>> declared = RouteAggregator.collect(routes, ExceptionHandlerRegistry::declaredHandlers);
        for (Map.Entry<ExceptionKey, ExceptionHandler> entry : declared) {
            if (log.isDebugEnabled() && merged.containsKey(entry.getKey())) {
                log.debug("Route exception handler for {} replaces an earlier registration", entry.getKey());
            }
            merged.put(entry.getKey(), entry.getValue());
        }
        return ExceptionHandlerMap.partition(merged);
    }

    /**
     * Handlers declared along the path of one dispatch target: enclosing
     * includes outermost first, then the target and its bound handler.
     */
    public static ExceptionHandlerMap forRoute(ResolvedRoute route) {
        Map<ExceptionKey, ExceptionHandler> merged = new LinkedHashMap<>();
        for (Include include : route.getAncestors()) {
            merged.putAll(include.getExceptionHandlers());
        }
        for (Map.Entry<ExceptionKey, ExceptionHandler> entry : declaredHandlers(route.getTarget())) {
            merged.put(entry.getKey(), entry.getValue());
        }
        if (merged.isEmpty()) {
            return ExceptionHandlerMap.EMPTY;
        }
        return ExceptionHandlerMap.partition(merged);
    }

    static List<Map.Entry<ExceptionKey, ExceptionHandler>> declaredHandlers(RouteNode node) {
        List<Map.Entry<ExceptionKey, ExceptionHandler>> entries = new ArrayList<>(node.getExceptionHandlers().entrySet());
        if (node instanceof Gateway) {
            entries.addAll(((Gateway) node).getHandler().getExceptionHandlers().entrySet());
        }
        return entries;
    }

}

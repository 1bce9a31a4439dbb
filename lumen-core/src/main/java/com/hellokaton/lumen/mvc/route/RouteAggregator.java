package com.hellokaton.lumen.mvc.route;

import com.hellokaton.lumen.kit.PathKit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Order preserving walks over the route tree.
 * <p>
 * Walks are pre-order (a group before its children, children in declaration
 * order), use an explicit worklist instead of recursion and never modify
 * the tree. Nested application boundaries are visited but never descended
 * into.
 */
public final class RouteAggregator {

    private RouteAggregator() {
    }

    /**
     * Collect what the extractor yields for every reachable node.
     */
    public static <T> List<T> collect(List<? extends RouteNode> routes, RouteExtractor<T> extractor) {
        List<T> collected = new ArrayList<>();
        Deque<RouteNode> worklist = new ArrayDeque<>();
        pushAll(worklist, routes);
        while (!worklist.isEmpty()) {
            RouteNode node = worklist.pop();
            collected.addAll(extractor.extract(node));
            if (node instanceof Include && !((Include) node).isApplicationBoundary()) {
                pushAll(worklist, ((Include) node).getRoutes());
            }
        }
        return Collections.unmodifiableList(collected);
    }

    /**
     * Flatten the tree into dispatch targets: every gateway and every include
     * mounting an application, with its full path and the includes enclosing it.
     */
    public static List<ResolvedRoute> resolve(List<? extends RouteNode> routes) {
        List<ResolvedRoute> resolved = new ArrayList<>();
        Deque<ResolvedRoute> worklist = new ArrayDeque<>();
        for (int i = routes.size() - 1; i >= 0; i--) {
            RouteNode node = routes.get(i);
            worklist.push(new ResolvedRoute(PathKit.fixPath(node.getPath()), node, Collections.<Include>emptyList()));
        }
        while (!worklist.isEmpty()) {
            ResolvedRoute current = worklist.pop();
            RouteNode node = current.getTarget();
            if (node instanceof Gateway) {
                resolved.add(current);
                continue;
            }
            Include include = (Include) node;
            if (null != include.getApp()) {
                resolved.add(current);
                continue;
            }
            List<Include> ancestors = new ArrayList<>(current.getAncestors());
            ancestors.add(include);
            List<Include> chain = Collections.unmodifiableList(ancestors);
            List<RouteNode> children = include.getRoutes();
            for (int i = children.size() - 1; i >= 0; i--) {
                RouteNode child = children.get(i);
                worklist.push(new ResolvedRoute(PathKit.join(current.getPath(), child.getPath()), child, chain));
            }
        }
        return Collections.unmodifiableList(resolved);
    }

    private static void pushAll(Deque<RouteNode> worklist, List<? extends RouteNode> routes) {
        for (int i = routes.size() - 1; i >= 0; i--) {
            worklist.push(routes.get(i));
        }
    }

}

package com.hellokaton.lumen.mvc.route;

import java.util.List;

/**
 * Extracts the items a route node contributes to an aggregation pass.
 */
@FunctionalInterface
public interface RouteExtractor<T> {

    List<T> extract(RouteNode node);

}

package com.ourd.router;

import java.util.List;

/**
 * A path rule that matched a request, with its captured parameters.
 */
public record PathMatch(PathRoute route, List<String> params) {

    public PathMatch {
        params = params != null ? List.copyOf(params) : List.of();
    }
}

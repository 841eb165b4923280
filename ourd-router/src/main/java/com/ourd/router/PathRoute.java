package com.ourd.router;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Path-pattern rule (e.g. {@code files/(.+)} for asset retrieval). The pattern must match the whole
 * request path without its leading slash; capture groups become the context's path parameters.
 */
public record PathRoute(HttpMethod method, Pattern pattern, Handler handler, List<Preprocessor> preprocessors) {

    public PathRoute {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(handler, "handler");
        preprocessors = preprocessors != null ? List.copyOf(preprocessors) : List.of();
    }

    /** Rule key used for duplicate detection, e.g. {@code GET files/(.+)}. */
    public String key() {
        return method + " " + pattern.pattern();
    }

    /**
     * Returns the capture groups when this rule matches, or null when it does not.
     */
    List<String> match(HttpMethod requestMethod, String path) {
        if (requestMethod != method) return null;
        Matcher m = pattern.matcher(stripLeadingSlash(path));
        if (!m.matches()) return null;
        List<String> groups = new ArrayList<>(m.groupCount());
        for (int i = 1; i <= m.groupCount(); i++) {
            groups.add(m.group(i));
        }
        return groups;
    }

    static String stripLeadingSlash(String path) {
        if (path == null) return "";
        return path.startsWith("/") ? path.substring(1) : path;
    }
}

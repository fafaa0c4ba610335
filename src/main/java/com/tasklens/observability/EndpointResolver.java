package com.tasklens.observability;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.servlet.HandlerMapping;

import java.util.regex.Pattern;

/**
 * Resolves the bounded {@code endpoint} label for a request: the matched route template when
 * MVC dispatched the request, otherwise the raw path with identifier segments templated.
 */
public final class EndpointResolver {

    static final String NOT_FOUND = "NOT_FOUND";

    private static final Pattern ID_SEGMENT = Pattern.compile(
            "\\d+|[0-9a-fA-F]{8}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{12}");

    private EndpointResolver() {
    }

    public static String resolve(HttpServletRequest request, int status) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern != null) {
            return pattern.toString();
        }
        if (status == 404) {
            return NOT_FOUND;
        }
        return templated(request.getRequestURI());
    }

    static String templated(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String[] segments = path.split("/", -1);
        StringBuilder result = new StringBuilder();
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i];
            result.append('/').append(ID_SEGMENT.matcher(segment).matches() ? "{id}" : segment);
        }
        return result.length() == 0 ? "/" : result.toString();
    }
}

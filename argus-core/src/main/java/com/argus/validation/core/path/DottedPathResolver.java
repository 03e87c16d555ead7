/*
 * Copyright (c) 2025 Argus Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.argus.validation.core.path;

import com.argus.validation.api.model.PathValue;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Locates a field by dotted path ({@code user.address.city}) in nested submission data.
 *
 * LOOKUP ORDER:
 * 1. A key equal to the whole path wins, so {@code {"a.b": "x"}} resolves {@code a.b} to "x".
 * 2. Otherwise the path is split on dots (trailing {@code *} and {@code .} are ignored)
 *    and walked segment by segment:
 *    - Map: the joined remaining path is tried as a key first, then the single segment.
 *      {@code *} searches every value.
 *    - List: a numeric segment is an index, {@code *} searches every element, and any
 *      other segment is searched for inside each element (implicit wildcard).
 *    - Scalar: nothing further to walk, NOT_FOUND.
 * 3. The value under the last segment is returned as found, even when it is null.
 *
 * Wildcard searches return the first match in iteration order.
 */
public final class DottedPathResolver {

    private static final String WILDCARD = "*";

    private DottedPathResolver() {
    }

    /**
     * @return true if the field reference needs a path lookup rather than an exact key
     */
    public static boolean isDotted(String field) {
        return field != null && field.indexOf('.') >= 0;
    }

    public static PathValue resolve(String path, Map<String, ?> data) {
        if (path == null || data == null || data.isEmpty()) {
            return PathValue.NOT_FOUND;
        }
        if (data.containsKey(path)) {
            return PathValue.found(data.get(path));
        }

        String trimmed = trimTrailing(path);
        if (trimmed.isEmpty()) {
            return PathValue.NOT_FOUND;
        }
        return search(data, trimmed.split("\\.", -1), 0);
    }

    private static PathValue search(Object node, String[] segments, int index) {
        if (segments[index].isEmpty()) {
            return PathValue.NOT_FOUND;
        }
        if (node instanceof Map<?, ?> map) {
            return searchMap(map, segments, index);
        }
        if (node instanceof List<?> list) {
            return searchList(list, segments, index);
        }
        return PathValue.NOT_FOUND;
    }

    private static PathValue searchMap(Map<?, ?> map, String[] segments, int index) {
        if (index < segments.length - 1) {
            String remainder = String.join(".", List.of(segments).subList(index, segments.length));
            if (map.containsKey(remainder)) {
                return PathValue.found(map.get(remainder));
            }
        }

        String segment = segments[index];
        if (WILDCARD.equals(segment)) {
            return searchEach(map.values(), segments, index + 1);
        }
        if (!map.containsKey(segment)) {
            return PathValue.NOT_FOUND;
        }
        return descend(map.get(segment), segments, index + 1);
    }

    private static PathValue searchList(List<?> list, String[] segments, int index) {
        String segment = segments[index];
        if (WILDCARD.equals(segment)) {
            return searchEach(list, segments, index + 1);
        }

        int position = parseIndex(segment);
        if (position >= 0 && position < list.size()) {
            return descend(list.get(position), segments, index + 1);
        }

        // Segment is not an index: look for it inside each element
        for (Object element : list) {
            if (element instanceof Map || element instanceof List) {
                PathValue answer = search(element, segments, index);
                if (answer.isFound()) {
                    return answer;
                }
            }
        }
        return PathValue.NOT_FOUND;
    }

    private static PathValue searchEach(Collection<?> children, String[] segments, int next) {
        for (Object child : children) {
            PathValue answer = descend(child, segments, next);
            if (answer.isFound()) {
                return answer;
            }
        }
        return PathValue.NOT_FOUND;
    }

    private static PathValue descend(Object child, String[] segments, int next) {
        if (next == segments.length) {
            return PathValue.found(child);
        }
        return search(child, segments, next);
    }

    private static int parseIndex(String segment) {
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String trimTrailing(String path) {
        int end = path.length();
        while (end > 0 && (path.charAt(end - 1) == '*' || path.charAt(end - 1) == ' ')) {
            end--;
        }
        while (end > 0 && path.charAt(end - 1) == '.') {
            end--;
        }
        return path.substring(0, end);
    }
}

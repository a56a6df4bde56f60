package com.premerge.resolver.model;

import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of path segments where {@link #WILDCARD} matches any single segment.
 *
 * Matching is a prefix match: a path with more segments than the pattern still
 * matches as long as the leading segments agree.
 */
@Value
public class PathPattern {

    public static final String WILDCARD = "*";

    @NonNull
    List<String> segments;

    public PathPattern(@NonNull List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    /**
     * Parses a slash separated pattern such as {@code clang/lib/CIR}.
     */
    public static PathPattern parse(String pattern) {
        return new PathPattern(split(pattern));
    }

    public static PathPattern of(String... segments) {
        return new PathPattern(List.of(segments));
    }

    public boolean matches(List<String> pathSegments) {
        if (pathSegments.size() < segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            String expected = segments.get(i);
            if (!WILDCARD.equals(expected) && !expected.equals(pathSegments.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits a relative path into segments on either separator, dropping empty and {@code .} parts.
     */
    public static List<String> split(String path) {
        List<String> parts = new ArrayList<>();
        if (path == null) {
            return parts;
        }
        for (String part : path.split("[/\\\\]")) {
            if (!part.isEmpty() && !".".equals(part)) {
                parts.add(part);
            }
        }
        return parts;
    }

    @Override
    public String toString() {
        return String.join("/", segments);
    }
}

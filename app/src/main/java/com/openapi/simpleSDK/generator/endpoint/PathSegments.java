package com.openapi.simpleSDK.generator.endpoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Splitting of path templates. Empty segments from leading, trailing or doubled slashes are
 * dropped.
 */
public final class PathSegments {

    private PathSegments() {
    }

    public static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /** Segments that are not path parameters. */
    public static List<String> staticSegments(String path) {
        List<String> segments = segments(path);
        segments.removeIf(PathSegments::isParameter);
        return segments;
    }

    public static boolean hasParameter(String path) {
        return segments(path).stream().anyMatch(PathSegments::isParameter);
    }

    public static boolean isParameter(String segment) {
        return segment.startsWith("{");
    }

    /** {@code v} followed by at least one digit and nothing else. */
    public static boolean isVersion(String segment) {
        return segment.length() > 1 && segment.charAt(0) == 'v'
            && segment.substring(1).chars().allMatch(Character::isDigit);
    }
}

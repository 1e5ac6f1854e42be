package com.axiomprofiler.service.filter;

import lombok.Value;

import java.util.List;

/**
 * Auxiliary result of applying a filter. Most filters only change visibility and return {@link #none()}.
 */
@Value
public class FilterOutput {

    public enum Type {
        NONE,
        LONGEST_PATH
    }

    private static final FilterOutput NONE = new FilterOutput(Type.NONE, List.of());

    Type type;
    List<Integer> path;     // Raw origin indices, root first

    public static FilterOutput none() {
        return NONE;
    }

    public static FilterOutput longestPath(List<Integer> path) {
        return new FilterOutput(Type.LONGEST_PATH, List.copyOf(path));
    }

    public boolean isNone() {
        return type == Type.NONE;
    }
}

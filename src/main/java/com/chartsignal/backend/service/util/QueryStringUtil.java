package com.chartsignal.backend.service.util;

import java.util.Map;
import java.util.stream.Collectors;

public final class QueryStringUtil {

    private QueryStringUtil() {
    }

    /**
     * Joins parameters as {@code key=value} pairs sorted by key, skipping null values.
     */
    public static String buildQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        return params.entrySet().stream()
                .filter(entry -> entry.getValue() != null)
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
    }
}

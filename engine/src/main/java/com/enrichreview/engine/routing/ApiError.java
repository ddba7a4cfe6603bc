package com.enrichreview.engine.routing;

import java.util.List;

public record ApiError(String code, String message, List<String> details) {
    public static ApiError of(String code, String message) {
        return new ApiError(code, message, List.of());
    }

    public static ApiError of(String code, String message, List<String> details) {
        return new ApiError(code, message, details == null ? List.of() : List.copyOf(details));
    }
}

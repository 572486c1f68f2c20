package com.localflipper.core.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a step that may degrade softly. A failure carries the cause and the component that reported it
 * instead of an exception.
 */
public final class Outcome<T> {
    public final boolean success;
    public final T value;
    public final CauseCode causeCode;
    public final String owner;
    public final Map<String, Object> details;

    private Outcome(boolean success, T value, CauseCode causeCode, String owner, Map<String, Object> details) {
        this.success = success;
        this.value = value;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.owner = owner == null ? "" : owner;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static <T> Outcome<T> success(T value, String owner) {
        return new Outcome<>(true, value, CauseCode.NONE, owner, Map.of());
    }

    /**
     * A degraded result still carries a usable fallback value.
     */
    public static <T> Outcome<T> degraded(T fallback, CauseCode causeCode, String owner, Map<String, Object> details) {
        return new Outcome<>(false, fallback, causeCode, owner, copy(details));
    }

    public T valueOr(T fallback) {
        return value == null ? fallback : value;
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : in.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "Outcome{success=" + success + ", cause=" + causeCode + ", owner=" + owner + ", details=" + details + '}';
    }
}

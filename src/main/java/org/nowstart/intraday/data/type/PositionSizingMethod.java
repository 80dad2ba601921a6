package org.nowstart.intraday.data.type;

import java.util.Locale;

public enum PositionSizingMethod {
    FIXED("fixed"),
    PERCENT_RISK("percent_risk");

    private final String key;

    PositionSizingMethod(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a configured method name. Anything unrecognised falls back to {@link #FIXED}.
     */
    public static PositionSizingMethod from(String raw) {
        PositionSizingMethod method = lookup(raw);
        return method == null ? FIXED : method;
    }

    public static boolean isKnown(String raw) {
        return raw == null || raw.isBlank() || lookup(raw) != null;
    }

    private static PositionSizingMethod lookup(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PositionSizingMethod method : values()) {
            if (method.key.equals(normalized)) {
                return method;
            }
        }
        return null;
    }
}

package com.edge.merger.core.compose;

import com.edge.merger.core.error.ConfigurationException;

import java.util.Locale;

/**
 * 并排拼接方向
 */
public enum Orientation {
    HORIZONTAL("horizontal"),
    VERTICAL("vertical");

    private final String value;

    Orientation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Orientation fromValue(String value) {
        if (value == null || value.isBlank()) {
            return HORIZONTAL;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "horizontal":
                return HORIZONTAL;
            case "vertical":
                return VERTICAL;
            default:
                throw new ConfigurationException("Unknown orientation: " + value + ". Supported: horizontal, vertical");
        }
    }
}

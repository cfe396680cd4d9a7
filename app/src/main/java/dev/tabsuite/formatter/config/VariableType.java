package dev.tabsuite.formatter.config;

import java.util.Locale;

/**
 * Variable flavours, identified by their sigil.
 */
public enum VariableType {
    SCALAR('$'),
    LIST('@'),
    DICT('&');

    private final char sigil;

    VariableType(char sigil) {
        this.sigil = sigil;
    }

    public static VariableType from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Variable type must be provided");
        }
        try {
            return VariableType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported variable type: " + raw + " (expected scalar, list or dict)", ex);
        }
    }

    public boolean matches(String variableName) {
        return variableName != null && !variableName.isEmpty() && variableName.charAt(0) == sigil;
    }
}

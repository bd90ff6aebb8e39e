package it.unimib.datai.clout.common.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How a function's code is loaded and invoked.
 */
public enum RuntimeKind {
    /**
     * A JAR loaded in an isolated class loader; the entrypoint names a public method.
     */
    JVM("java"),

    /**
     * A script handed to the interpreter named by the entrypoint. Input is written to stdin,
     * stdout is the output.
     */
    SCRIPT("script"),

    /**
     * A native executable; the entrypoint carries its arguments.
     */
    NATIVE("native");

    private final String tag;

    RuntimeKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a runtime from its tag or enum name, case-insensitively.
     */
    public static Optional<RuntimeKind> fromTag(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RuntimeKind kind : values()) {
            if (kind.tag.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}

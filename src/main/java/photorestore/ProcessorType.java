package photorestore;

import java.util.Locale;

public enum ProcessorType {
    SEQUENTIAL,
    FORKJOIN,
    EXECUTOR;

    public static ProcessorType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", ""));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported processor type: " + value, e);
        }
    }
}

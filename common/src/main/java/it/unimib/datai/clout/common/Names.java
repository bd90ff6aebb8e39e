package it.unimib.datai.clout.common;

import java.util.regex.Pattern;

/**
 * Naming rules shared by queues, functions and blobs.
 */
public final class Names {
    public static final int MAX_LENGTH = 256;

    private static final Pattern QUEUE_NAME = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private Names() {
    }

    public static boolean isValidQueueName(String name) {
        return name != null && !name.isEmpty() && name.length() <= MAX_LENGTH && QUEUE_NAME.matcher(name).matches();
    }

    public static void requireQueueName(String name) {
        if (!isValidQueueName(name)) {
            throw CloutException.validation("queueName",
                    "Queue name must be 1-" + MAX_LENGTH + " characters of letters, digits, '-' or '_'");
        }
    }

    public static boolean isValidIdentifier(String value) {
        return value != null && !value.isBlank() && value.length() <= MAX_LENGTH;
    }
}

package it.unimib.datai.clout.common;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single exception type for every domain failure. The {@link ErrorKind} discriminates the category;
 * the optional attributes carry the context relevant to that category.
 */
public final class CloutException extends RuntimeException {
    private final ErrorKind kind;
    private final String blobId;
    private final String queueName;
    private final String functionName;
    private final long maxBytes;
    private final Map<String, List<String>> fieldErrors;

    private CloutException(ErrorKind kind,
                           String message,
                           Throwable cause,
                           String blobId,
                           String queueName,
                           String functionName,
                           long maxBytes,
                           Map<String, List<String>> fieldErrors) {
        super(message, cause);
        this.kind = kind;
        this.blobId = blobId;
        this.queueName = queueName;
        this.functionName = functionName;
        this.maxBytes = maxBytes;
        this.fieldErrors = fieldErrors == null ? Map.of() : fieldErrors;
    }

    public static CloutException blobNotFound(String blobId) {
        return new CloutException(ErrorKind.BLOB_NOT_FOUND,
                "Blob '" + blobId + "' not found", null, blobId, null, null, -1, null);
    }

    public static CloutException blobOperationFailed(String blobId, String message, Throwable cause) {
        return new CloutException(ErrorKind.BLOB_OPERATION_FAILED, message, cause, blobId, null, null, -1, null);
    }

    public static CloutException queueOperationFailed(String queueName, String message) {
        return queueOperationFailed(queueName, message, null);
    }

    public static CloutException queueOperationFailed(String queueName, String message, Throwable cause) {
        return new CloutException(ErrorKind.QUEUE_OPERATION_FAILED, message, cause, null, queueName, null, -1, null);
    }

    public static CloutException queueQuotaExceeded(String queueName, long maxBytes, String message) {
        return new CloutException(ErrorKind.QUEUE_QUOTA_EXCEEDED, message, null, null, queueName, null, maxBytes, null);
    }

    public static CloutException functionExecutionFailed(String functionName, String blobId,
                                                         String message, Throwable cause) {
        return new CloutException(ErrorKind.FUNCTION_EXECUTION_FAILED, message, cause,
                blobId, null, functionName, -1, null);
    }

    public static CloutException validation(String field, String message) {
        return validation(Map.of(field, List.of(message)));
    }

    public static CloutException validation(Map<String, List<String>> fieldErrors) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        fieldErrors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        StringBuilder message = new StringBuilder("Validation failed");
        copy.forEach((field, messages) -> message.append("; ").append(field).append(": ")
                .append(String.join(", ", messages)));
        return new CloutException(ErrorKind.VALIDATION_FAILED, message.toString(), null,
                null, null, null, -1, Map.copyOf(copy));
    }

    public ErrorKind kind() {
        return kind;
    }

    public String code() {
        return kind.code();
    }

    public String blobId() {
        return blobId;
    }

    public String queueName() {
        return queueName;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Byte limit that was exceeded, or {@code -1} when not a quota failure.
     */
    public long maxBytes() {
        return maxBytes;
    }

    public Map<String, List<String>> fieldErrors() {
        return fieldErrors;
    }
}

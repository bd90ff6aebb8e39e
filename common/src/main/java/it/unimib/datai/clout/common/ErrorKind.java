package it.unimib.datai.clout.common;

/**
 * Closed set of failure categories surfaced by the substrate.
 */
public enum ErrorKind {
    BLOB_NOT_FOUND,
    BLOB_OPERATION_FAILED,
    QUEUE_OPERATION_FAILED,
    QUEUE_QUOTA_EXCEEDED,
    FUNCTION_EXECUTION_FAILED,
    VALIDATION_FAILED;

    public String code() {
        return name();
    }
}

package com.batchq;

/** Unchecked failure of a scheduler, registry or protocol operation, tagged with its kind. */
public class BatchException extends RuntimeException {
    private final ErrorCode code;

    public BatchException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BatchException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static BatchException notFound(long jobId) {
        return new BatchException(ErrorCode.NOT_FOUND, "Job not found: " + jobId);
    }

    public static BatchException validation(String message) {
        return new BatchException(ErrorCode.VALIDATION, message);
    }

    public static BatchException conflict(String message) {
        return new BatchException(ErrorCode.CONFLICT, message);
    }

    public static BatchException launch(String message, Throwable cause) {
        return new BatchException(ErrorCode.LAUNCH, message, cause);
    }

    public static BatchException storage(String message, Throwable cause) {
        return new BatchException(ErrorCode.STORAGE, message, cause);
    }

    public static BatchException config(String message) {
        return new BatchException(ErrorCode.CONFIG, message);
    }
}

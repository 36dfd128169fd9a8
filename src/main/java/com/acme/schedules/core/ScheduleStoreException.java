package com.acme.schedules.core;

/**
 * Failure of a schedule store operation. Carried inside {@link Result.Err} rather
 * than thrown across the store boundary.
 */
public class ScheduleStoreException extends RuntimeException {

    public enum Kind {
        /** The referenced id matched no row. */
        NOT_FOUND,
        /** The requested state change is not in the transition table. */
        INVALID_TRANSITION,
        /** Caller input rejected before anything was written. */
        INVALID_ARGUMENT,
        /** The storage engine raised a fault. */
        STORAGE_FAILURE,
        /** The statement ran but no row was written; usually a concurrent change. */
        NO_ROWS_AFFECTED
    }

    private final Kind kind;

    public ScheduleStoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScheduleStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static ScheduleStoreException notFound(String message) {
        return new ScheduleStoreException(Kind.NOT_FOUND, message);
    }

    public static ScheduleStoreException invalidTransition(String message) {
        return new ScheduleStoreException(Kind.INVALID_TRANSITION, message);
    }

    public static ScheduleStoreException invalidArgument(String message) {
        return new ScheduleStoreException(Kind.INVALID_ARGUMENT, message);
    }

    public static ScheduleStoreException noRowsAffected(String message) {
        return new ScheduleStoreException(Kind.NO_ROWS_AFFECTED, message);
    }

    public static ScheduleStoreException storageFailure(String context, Throwable cause) {
        return new ScheduleStoreException(Kind.STORAGE_FAILURE, context + ": " + describe(cause), cause);
    }

    static String describe(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getName();
    }
}

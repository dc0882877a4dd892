package com.eainde.docexport.state;

import java.io.Serializable;

/**
 * A failure a stage absorbed (or, for {@link FailureKind#RENDER}, reported) during one run.
 *
 * @param kind    taxonomy entry
 * @param stage   graph node that recorded it
 * @param message human-readable cause
 */
public record StageFailure(FailureKind kind, String stage, String message) implements Serializable {

    public static StageFailure of(FailureKind kind, String stage, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new StageFailure(kind, stage, message);
    }
}

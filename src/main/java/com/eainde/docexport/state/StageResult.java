package com.eainde.docexport.state;

import java.util.Optional;

/**
 * Value produced by a stage, plus the failure it absorbed to produce it, if any.
 * A degraded result always carries the documented safe default as its value.
 */
public final class StageResult<T> {

    private final T value;
    private final StageFailure failure;

    private StageResult(T value, StageFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(value, null);
    }

    public static <T> StageResult<T> degraded(T fallback, StageFailure failure) {
        return new StageResult<>(fallback, failure);
    }

    public T value() {
        return value;
    }

    public Optional<StageFailure> failure() {
        return Optional.ofNullable(failure);
    }

    public boolean isDegraded() {
        return failure != null;
    }

    @Override
    public String toString() {
        return failure == null ? "StageResult[" + value + "]" : "StageResult[" + value + ", " + failure + "]";
    }
}

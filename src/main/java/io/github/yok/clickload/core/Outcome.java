package io.github.yok.clickload.core;

/**
 * Result of a component operation: either a value or an {@link IngestionFailure}.
 *
 * <p>
 * Expected business failures (no files found, nothing matched, bad configuration) travel as
 * values of this type. Exceptions are reserved for collaborator I/O errors.
 * </p>
 *
 * @param <T> success value type
 * @author Yasuharu.Okawauchi
 */
public final class Outcome<T> {

    private final T value;
    private final IngestionFailure failure;

    private Outcome(T value, IngestionFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(FailureKind kind, String message) {
        return new Outcome<>(null, new IngestionFailure(kind, message));
    }

    public static <T> Outcome<T> failure(IngestionFailure failure) {
        return new Outcome<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this outcome is a failure
     */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value on failed outcome: " + failure);
        }
        return value;
    }

    /**
     * @return the failure, or {@code null} on success
     */
    public IngestionFailure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return failure == null ? "Success[" + value + "]" : "Failure[" + failure + "]";
    }
}

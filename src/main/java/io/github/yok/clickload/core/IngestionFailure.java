package io.github.yok.clickload.core;

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A typed business failure: its {@link FailureKind} and a human-readable cause.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
public final class IngestionFailure {

    private final FailureKind kind;
    private final String message;

    public IngestionFailure(FailureKind kind, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}

package io.github.eutro.flowlint.lint;

import io.github.eutro.flowlint.source.Position;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single finding, anchored to a source position.
 */
public final class Diagnostic {
    /**
     * Orders diagnostics by position, then by rule identifier.
     */
    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::getPosition)
            .thenComparing(Diagnostic::getRuleId);

    private final Position position;
    private final String message;
    private final String ruleId;
    private final Severity severity;

    public Diagnostic(Position position, String message, String ruleId, Severity severity) {
        this.position = Objects.requireNonNull(position, "position");
        this.message = Objects.requireNonNull(message, "message");
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId");
        this.severity = Objects.requireNonNull(severity, "severity");
    }

    public Position getPosition() {
        return position;
    }

    public String getMessage() {
        return message;
    }

    public String getRuleId() {
        return ruleId;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return position.equals(that.position)
                && message.equals(that.message)
                && ruleId.equals(that.ruleId)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, message, ruleId, severity);
    }

    @Override
    public String toString() {
        return Reporter.format(this);
    }
}

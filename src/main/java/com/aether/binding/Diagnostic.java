package com.aether.binding;

import java.util.Objects;
import java.util.UUID;

/**
 * A recoverable problem found while resolving or generating.
 */
public record Diagnostic(
    Severity severity,   // ERROR/WARN/INFO
    DiagnosticCode code,
    String message,      // human-readable
    UUID nodeId,         // optional
    String subject       // property, event or file name; optional
) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic error(DiagnosticCode code, String message) {
        return new Diagnostic(Severity.ERROR, code, message, null, null);
    }

    public static Diagnostic warn(DiagnosticCode code, String message) {
        return new Diagnostic(Severity.WARN, code, message, null, null);
    }

    /**
     * Attaches the location the problem was found at.
     *
     * @param id the node id
     * @param subjectName the property, event or file concerned
     * @return a copy with location
     */
    public Diagnostic at(UUID id, String subjectName) {
        return new Diagnostic(severity, code, message, id, subjectName);
    }

    public Diagnostic withSeverity(Severity newSeverity) {
        return new Diagnostic(newSeverity, code, message, nodeId, subject);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(' ').append(code);
        if (nodeId != null) {
            sb.append(" [").append(nodeId);
            if (subject != null) {
                sb.append('.').append(subject);
            }
            sb.append(']');
        } else if (subject != null) {
            sb.append(" [").append(subject).append(']');
        }
        return sb.append(": ").append(message).toString();
    }
}

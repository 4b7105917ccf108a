package com.aether.codegen;

import com.aether.binding.Diagnostic;
import com.aether.binding.DiagnosticCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Everything that went wrong while generating a project, in the order it was found.
 */
public record GenerationReport(
    List<Diagnostic> diagnostics,
    Set<GenerationFlag> flags
) {

    public GenerationReport {
        diagnostics = List.copyOf(diagnostics);
        flags = flags.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(GenerationFlag.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public boolean isClean() {
        return diagnostics.isEmpty() && flags.isEmpty();
    }

    public boolean has(GenerationFlag flag) {
        return flags.contains(flag);
    }

    /**
     * Filters diagnostics by code.
     *
     * @param code the code
     * @return matching diagnostics in report order
     */
    public List<Diagnostic> withCode(DiagnosticCode code) {
        List<Diagnostic> matching = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.code() == code) {
                matching.add(diagnostic);
            }
        }
        return matching;
    }
}

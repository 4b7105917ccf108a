package com.aether.binding;

import com.aether.model.Document;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolution problems of a document while it is being edited, grouped by node
 * for the property editor.
 *
 * During editing every problem is a warning. For inline fragments the last
 * source that parsed is remembered per node and event, so the editor can keep
 * showing it, or an explicit placeholder when nothing valid was ever entered.
 */
public class LiveDiagnostics {

    private static final Logger LOGGER = LoggerFactory.getLogger(LiveDiagnostics.class);

    /** Shown in place of a fragment that never parsed. */
    public static final String INVALID_PLACEHOLDER = "/* invalid fragment */";

    private final BindingResolver resolver;
    private final Map<UUID, List<Diagnostic>> byNode = new LinkedHashMap<>();
    private final Map<FragmentKey, String> lastValid = new HashMap<>();

    public LiveDiagnostics(BindingResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Recomputes the diagnostics of every node, in tree order.
     *
     * @param document the edited document
     * @return node id to its warnings, only nodes with problems
     */
    public Map<UUID, List<Diagnostic>> refresh(Document document) {
        byNode.clear();
        for (Node node : document.tree().preOrder()) {
            List<Diagnostic> warnings = new ArrayList<>();
            for (Diagnostic diagnostic : resolver.diagnose(node, document.variables())) {
                warnings.add(diagnostic.withSeverity(Severity.WARN));
            }
            if (!warnings.isEmpty()) {
                byNode.put(node.getId(), Collections.unmodifiableList(warnings));
            }
        }
        lastValid.keySet().removeIf(key -> !document.tree().contains(key.nodeId()));
        LOGGER.debug("Live diagnostics: {} nodes with problems", byNode.size());
        return Collections.unmodifiableMap(byNode);
    }

    public List<Diagnostic> forNode(UUID nodeId) {
        return byNode.getOrDefault(nodeId, List.of());
    }

    public int count() {
        int count = 0;
        for (List<Diagnostic> diagnostics : byNode.values()) {
            count += diagnostics.size();
        }
        return count;
    }

    /**
     * Checks a fragment the user is typing for an event.
     *
     * @param nodeId the node being edited
     * @param event the event the fragment handles
     * @param source the current text
     * @return the status, with the text the editor should keep
     */
    public FragmentStatus checkFragment(UUID nodeId, NodeEvent event, String source) {
        FragmentKey key = new FragmentKey(nodeId, event);
        SyntaxCheck check = resolver.validator().checkStatements(source);
        if (check.valid()) {
            lastValid.put(key, source);
            return new FragmentStatus(true, source, null);
        }
        String where = check.line() > 0 ? " (line " + check.line() + ")" : "";
        Diagnostic warning = Diagnostic.warn(DiagnosticCode.INVALID_FRAGMENT, check.message() + where)
            .at(nodeId, event.wireName());
        return new FragmentStatus(false, lastValid.getOrDefault(key, INVALID_PLACEHOLDER), warning);
    }

    public Optional<String> lastValidFragment(UUID nodeId, NodeEvent event) {
        return Optional.ofNullable(lastValid.get(new FragmentKey(nodeId, event)));
    }

    /**
     * Result of checking a fragment during editing.
     *
     * @param valid whether the current text parsed
     * @param effectiveSource the current text if valid, else the last valid text or {@link #INVALID_PLACEHOLDER}
     * @param diagnostic the warning when invalid
     */
    public record FragmentStatus(boolean valid, String effectiveSource, Diagnostic diagnostic) {}

    private record FragmentKey(UUID nodeId, NodeEvent event) {}
}

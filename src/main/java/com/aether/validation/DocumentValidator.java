package com.aether.validation;

import com.aether.binding.BindingResolver;
import com.aether.binding.Diagnostic;
import com.aether.binding.DiagnosticCode;
import com.aether.model.Document;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.NodeKind;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a whole document for problems code generation would paper over.
 *
 * Reports every diagnostic generation would emit for the logic of the tree
 * (bindings, actions, events the kind cannot emit, unregistered assets) without
 * producing any source.
 */
public class DocumentValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentValidator.class);

    private final BindingResolver resolver;

    public DocumentValidator(BindingResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Validates every node in tree order.
     *
     * @param document the document
     * @return all diagnostics, empty when the document is clean
     */
    public List<Diagnostic> validate(Document document) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : document.tree().preOrder()) {
            NodeKind kind = document.registry().kindOf(node);
            diagnostics.addAll(resolver.diagnose(node, document.variables()));
            for (NodeEvent event : node.actions().keySet()) {
                if (!kind.supports(event)) {
                    diagnostics.add(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                        kind.tag() + " does not emit " + event.wireName()).at(node.getId(), event.wireName()));
                }
            }
            for (PropertyDefinition definition : kind.properties()) {
                if (definition.type() != PropertyType.ASSET) {
                    continue;
                }
                String assetName = node.property(definition.name()).asString();
                if (!assetName.isBlank() && !document.assets().contains(assetName)) {
                    diagnostics.add(Diagnostic.warn(DiagnosticCode.MISSING_ASSET,
                        String.format("Asset '%s' is not registered", assetName)).at(node.getId(), definition.name()));
                }
            }
        }
        LOGGER.debug("Validated '{}': {} problems", document.getProjectName(), diagnostics.size());
        return diagnostics;
    }

    public boolean isValid(Document document) {
        return validate(document).isEmpty();
    }
}

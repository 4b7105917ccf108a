package com.aether.model;

import com.aether.assets.AssetRegistry;
import com.aether.variables.Variable;
import com.aether.variables.VariableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The full state of one project: the element tree, its variables and assets, and
 * the project name. This is the unit that is saved, snapshotted and generated from.
 */
public class Document {

    private static final Logger LOGGER = LoggerFactory.getLogger(Document.class);

    private String projectName;
    private final DocumentTree tree;
    private final VariableStore variables;
    private final AssetRegistry assets;
    private final Set<UUID> selection = new LinkedHashSet<>();

    public Document(String projectName, DocumentTree tree, VariableStore variables, AssetRegistry assets) {
        this.projectName = Objects.requireNonNull(projectName, "projectName");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.variables = Objects.requireNonNull(variables, "variables");
        this.assets = Objects.requireNonNull(assets, "assets");
    }

    public String getProjectName() {
        return projectName;
    }

    public void setProjectName(String projectName) {
        this.projectName = Objects.requireNonNull(projectName, "projectName");
    }

    public DocumentTree tree() {
        return tree;
    }

    public VariableStore variables() {
        return variables;
    }

    public AssetRegistry assets() {
        return assets;
    }

    public NodeRegistry registry() {
        return tree.registry();
    }

    // Selection

    /**
     * Gets the selected node ids. Ids of nodes removed since selection are dropped.
     *
     * @return selected ids in selection order
     */
    public Set<UUID> selection() {
        selection.removeIf(id -> !tree.contains(id));
        return Collections.unmodifiableSet(selection);
    }

    public void select(UUID id) throws NodeNotFoundException {
        tree.find(id);
        selection.clear();
        selection.add(id);
    }

    public void addToSelection(UUID id) throws NodeNotFoundException {
        tree.find(id);
        selection.add(id);
    }

    public void clearSelection() {
        selection.clear();
    }

    // Variables

    /**
     * Renames a variable and rewrites every binding and action that refers to it.
     *
     * @param oldName the current name
     * @param newName the new name
     * @return number of bindings and actions rewritten
     * @throws IllegalArgumentException if the old name is undefined or the new one is invalid or taken
     */
    public int renameVariable(String oldName, String newName) {
        variables.rename(oldName, newName);
        if (oldName.equals(newName)) {
            return 0;
        }
        int rewritten = 0;
        for (Node node : tree.preOrder()) {
            for (Map.Entry<String, Binding> entry : node.bindings().entrySet()) {
                Binding binding = entry.getValue();
                if (binding instanceof Binding.VariableRef
                        && ((Binding.VariableRef) binding).variableName().equals(oldName)) {
                    node.setBinding(entry.getKey(), Binding.variable(newName));
                    rewritten++;
                }
            }
            for (Map.Entry<NodeEvent, Action> entry : node.actions().entrySet()) {
                Action renamed = entry.getValue().renameVariable(oldName, newName);
                if (renamed != entry.getValue()) {
                    node.setAction(entry.getKey(), renamed);
                    rewritten++;
                }
            }
        }
        LOGGER.debug("Renamed variable {} -> {}, rewrote {} references", oldName, newName, rewritten);
        return rewritten;
    }

    /**
     * Removes a variable. References to it are left in place and show up as
     * dangling bindings when the document is validated or generated.
     *
     * @param name the variable name
     * @return the removed variable, if it existed
     */
    public Optional<Variable> removeVariable(String name) {
        return variables.remove(name);
    }

    /**
     * Deep-copies the whole document, keeping ids. The selection is copied too.
     *
     * @return an independent document
     */
    public Document copy() {
        Document copy = new Document(projectName, tree.copy(), variables.copy(), assets.copy());
        copy.selection.addAll(selection());
        return copy;
    }

    @Override
    public String toString() {
        return "Document[" + projectName + ", " + tree.size() + " nodes, " + variables.size() + " variables]";
    }
}

package com.aether.session;

import com.aether.model.Document;
import com.aether.model.StructuralException;

/**
 * One user-visible mutation of a document.
 */
@FunctionalInterface
public interface Edit {

    /**
     * Applies the mutation.
     *
     * @param document the document to mutate
     * @throws StructuralException if the mutation is rejected
     */
    void apply(Document document) throws StructuralException;
}

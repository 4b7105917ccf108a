package com.aether.model;

/**
 * Value types a node property can declare.
 */
public enum PropertyType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    /** Name of an entry in the document's asset registry. */
    ASSET,
    STRING_LIST
}

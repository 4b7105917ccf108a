package com.aether.variables;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Named application variables of a document.
 * 
 * Iteration is always in ascending name order so that anything derived from
 * the store (persisted files, generated fields) is deterministic.
 */
public class VariableStore {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(VariableStore.class);
    
    private final Map<String, Variable> variables = new TreeMap<>();
    
    /**
     * Defines a new variable.
     * 
     * @param name the variable name
     * @param type the value kind
     * @param defaultValue the initial value, coerced to the type
     * @return the created variable
     * @throws IllegalArgumentException if the name is invalid or already defined
     */
    public Variable define(String name, VariableType type, Object defaultValue) {
        Identifiers.requireValid(name);
        if (variables.containsKey(name)) {
            throw new IllegalArgumentException(String.format("Variable '%s' is already defined", name));
        }
        Variable variable = new Variable(name, type, defaultValue);
        variables.put(name, variable);
        LOGGER.debug("Defined variable {} : {} = {}", name, type.wireName(), variable.defaultValue());
        return variable;
    }
    
    /**
     * Adds an already built variable.
     * 
     * @param variable the variable
     * @return the variable
     */
    public Variable define(Variable variable) {
        return define(variable.name(), variable.type(), variable.defaultValue());
    }
    
    public Optional<Variable> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }
    
    /**
     * Gets a variable that must exist.
     * 
     * @param name the variable name
     * @return the variable
     * @throws IllegalArgumentException if undefined
     */
    public Variable require(String name) {
        Variable variable = variables.get(name);
        if (variable == null) {
            throw new IllegalArgumentException(String.format("Variable '%s' is not defined", name));
        }
        return variable;
    }
    
    public boolean contains(String name) {
        return variables.containsKey(name);
    }
    
    /**
     * Replaces the default value of a variable.
     * 
     * @param name the variable name
     * @param newDefault the new value, coerced to the variable type
     * @return the updated variable
     */
    public Variable update(String name, Object newDefault) {
        Variable updated = require(name).withDefaultValue(newDefault);
        variables.put(name, updated);
        return updated;
    }
    
    /**
     * Removes a variable. References to it are not touched.
     * 
     * @param name the variable name
     * @return the removed variable, if it existed
     */
    public Optional<Variable> remove(String name) {
        Variable removed = variables.remove(name);
        if (removed != null) {
            LOGGER.debug("Removed variable {}", name);
        }
        return Optional.ofNullable(removed);
    }
    
    /**
     * Renames a variable inside the store only.
     * 
     * @param oldName current name
     * @param newName new name
     * @return the renamed variable
     * @throws IllegalArgumentException if the old name is undefined or the new one is invalid or taken
     */
    public Variable rename(String oldName, String newName) {
        Variable existing = require(oldName);
        if (oldName.equals(newName)) {
            return existing;
        }
        Identifiers.requireValid(newName);
        if (variables.containsKey(newName)) {
            throw new IllegalArgumentException(String.format("Variable '%s' is already defined", newName));
        }
        variables.remove(oldName);
        Variable renamed = existing.withName(newName);
        variables.put(newName, renamed);
        LOGGER.debug("Renamed variable {} -> {}", oldName, newName);
        return renamed;
    }
    
    public Set<String> names() {
        return java.util.Collections.unmodifiableSet(variables.keySet());
    }
    
    public List<Variable> all() {
        return new ArrayList<>(variables.values());
    }
    
    public int size() {
        return variables.size();
    }
    
    public boolean isEmpty() {
        return variables.isEmpty();
    }
    
    /**
     * Copies the store. Variables are immutable so a shallow copy is enough.
     * 
     * @return an independent store with the same variables
     */
    public VariableStore copy() {
        VariableStore copy = new VariableStore();
        copy.variables.putAll(variables);
        return copy;
    }
}

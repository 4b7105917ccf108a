package com.aether.model;

/**
 * Occurrences a node kind may declare support for.
 */
public enum NodeEvent {
    CLICKED("clicked", "click", "Clicked"),
    CHANGED("changed", "change", "Changed"),
    HOVERED("hovered", "mouseenter", "Hovered"),
    DOUBLE_CLICKED("double_clicked", "dblclick", "DoubleClicked"),
    FOCUSED("focused", "focus", "Focused"),
    LOST_FOCUS("lost_focus", "blur", "LostFocus");
    
    private final String wireName;
    private final String domEvent;
    private final String handlerSuffix;
    
    NodeEvent(String wireName, String domEvent, String handlerSuffix) {
        this.wireName = wireName;
        this.domEvent = domEvent;
        this.handlerSuffix = handlerSuffix;
    }
    
    /** Stable name used in persisted documents. */
    public String wireName() {
        return wireName;
    }
    
    /** DOM event the generated code listens to. */
    public String domEvent() {
        return domEvent;
    }
    
    public String handlerSuffix() {
        return handlerSuffix;
    }
    
    public static NodeEvent fromWireName(String wireName) {
        for (NodeEvent event : values()) {
            if (event.wireName.equals(wireName)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown event: " + wireName);
    }
}

package com.smartlists.ruleengine.api.model;

/**
 * Reference to a collection or playlist holding an item.
 */
public record ContainerRef(String id, String name) {
}

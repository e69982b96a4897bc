package com.smartlists.ruleengine.api.model;

/**
 * A person credited on an item.
 *
 * @param name  person name
 * @param type  credit type as reported by the host: Actor, Director, Writer, GuestStar, ...
 * @param role  character name for actors, may be null
 */
public record PersonCredit(String name, String type, String role) {
}

package com.aura.core.store;

import com.aura.core.model.AuraObject;

/**
 * One object accepted during a graph traversal.
 *
 * @param object the matching object (a private copy)
 * @param depth  edges walked from the start object
 */
public record TraversalMatch(AuraObject object, int depth) {}

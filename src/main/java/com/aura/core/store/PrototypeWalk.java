package com.aura.core.store;

import com.aura.core.model.AuraObject;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Breadth-first prototype walk shared by the store implementations.
 * <p>
 * The visited set makes the walk terminate on cyclic link graphs; the depth
 * bound makes it terminate on arbitrarily long chains.
 */
final class PrototypeWalk {

    private PrototypeWalk() {}

    static List<TraversalMatch> breadthFirst(String startId,
                                             int maxDepth,
                                             Predicate<AuraObject> predicate,
                                             Function<String, Optional<AuraObject>> loader,
                                             Function<String, List<String>> parents) {
        var matches = new ArrayList<TraversalMatch>();
        if (maxDepth < 0) {
            return matches;
        }

        Set<String> visited = new HashSet<>();
        var frontier = new ArrayDeque<Frame>();
        frontier.add(new Frame(startId, 0));
        visited.add(startId);

        while (!frontier.isEmpty()) {
            Frame frame = frontier.poll();
            Optional<AuraObject> object = loader.apply(frame.objectId());
            if (object.isEmpty()) {
                // dangling edge or missing start object
                continue;
            }
            if (predicate.test(object.get())) {
                matches.add(new TraversalMatch(object.get(), frame.depth()));
            }
            if (frame.depth() == maxDepth) {
                continue;
            }
            for (String parentId : parents.apply(frame.objectId())) {
                if (visited.add(parentId)) {
                    frontier.add(new Frame(parentId, frame.depth() + 1));
                }
            }
        }
        return matches;
    }

    private record Frame(String objectId, int depth) {}
}

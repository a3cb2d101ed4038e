package com.aura.core.resolver;

import com.aura.core.model.AuraObject;
import com.aura.core.model.ResolvedMethod;
import com.aura.core.store.EdgeType;
import com.aura.core.store.ObjectStore;
import com.aura.core.store.TraversalMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Locates the nearest object in a delegation chain that declares a method.
 * <p>
 * The walk is breadth-first along prototype edges, so the shallowest declaring
 * ancestor wins; among ancestors at the same depth the store's link-creation
 * order decides. The walk is bounded by {@code maxDepth}: a method declared
 * only beyond the bound is reported as not found. Resolution copies no code
 * and has no side effects.
 */
public class MethodResolver {

    private static final Logger log = LoggerFactory.getLogger(MethodResolver.class);

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final ObjectStore store;
    private final int maxDepth;

    public MethodResolver(ObjectStore store) {
        this(store, DEFAULT_MAX_DEPTH);
    }

    public MethodResolver(ObjectStore store, int maxDepth) {
        this.store = store;
        this.maxDepth = maxDepth;
    }

    /**
     * Resolves {@code methodName} starting at {@code startId} (depth 0).
     *
     * @return the declaring object and body, or empty when no object within the
     *         depth bound declares the method
     */
    public CompletableFuture<Optional<ResolvedMethod>> resolve(String startId, String methodName) {
        return store.traverse(startId, EdgeType.PROTOTYPE, maxDepth, object -> object.declaresMethod(methodName))
                .thenApply(matches -> firstMatch(startId, methodName, matches));
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private Optional<ResolvedMethod> firstMatch(String startId, String methodName, List<TraversalMatch> matches) {
        if (matches.isEmpty()) {
            log.debug("No declaration of '{}' reachable from '{}' within depth {}", methodName, startId, maxDepth);
            return Optional.empty();
        }
        TraversalMatch match = matches.get(0);
        AuraObject declaring = match.object();
        log.debug("Resolved '{}' from '{}' to '{}' at depth {}",
                methodName, startId, declaring.id(), match.depth());
        return declaring.methodBody(methodName)
                .map(body -> new ResolvedMethod(declaring.id(), methodName, body, match.depth()));
    }
}

package com.aura.core.store;

import com.aura.core.model.AuraObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Object store held in process memory.
 * <p>
 * Used when no DataSource is configured. Per-document atomicity comes from
 * {@link ConcurrentHashMap#compute}; all state is lost on restart.
 */
public class InMemoryObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryObjectStore.class);

    private final ConcurrentHashMap<String, AuraObject> objects = new ConcurrentHashMap<>();

    /** Outbound prototype edges per child, in link-creation order. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<String>> prototypeLinks = new ConcurrentHashMap<>();

    @Override
    public void initialize() {
        objects.putIfAbsent(AuraObject.NIL_ID, AuraObject.empty(AuraObject.NIL_ID));
        log.info("In-memory object store initialized (state will not persist across restarts)");
    }

    @Override
    public CompletableFuture<Optional<AuraObject>> get(String objectId) {
        return CompletableFuture.completedFuture(load(objectId));
    }

    @Override
    public CompletableFuture<Void> update(String objectId, ObjectPatch patch, boolean merge) {
        try {
            objects.compute(objectId, (id, existing) -> {
                if (existing == null) {
                    throw new ObjectNotFoundException(objectId);
                }
                return patch.applyTo(existing, merge);
            });
            log.debug("Updated object {} (merge={})", objectId, merge);
            return CompletableFuture.completedFuture(null);
        } catch (PersistenceException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<List<TraversalMatch>> traverse(String startId, EdgeType edgeType, int maxDepth,
                                                             Predicate<AuraObject> predicate) {
        return CompletableFuture.completedFuture(PrototypeWalk.breadthFirst(
                startId, maxDepth, predicate, this::load, this::parentsOf));
    }

    @Override
    public CompletableFuture<Void> create(AuraObject object) {
        AuraObject previous = objects.putIfAbsent(object.id(), object.copy());
        if (previous != null) {
            return CompletableFuture.failedFuture(
                    new StoreConflictException("Object already exists: " + object.id()));
        }
        log.debug("Created object {}", object.id());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> link(String childId, String parentId) {
        for (String id : List.of(childId, parentId)) {
            if (!objects.containsKey(id)) {
                return CompletableFuture.failedFuture(new ObjectNotFoundException(id));
            }
        }
        prototypeLinks.computeIfAbsent(childId, k -> new CopyOnWriteArrayList<>()).addIfAbsent(parentId);
        log.debug("Linked {} -> {}", childId, parentId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String backendName() {
        return "memory";
    }

    private Optional<AuraObject> load(String objectId) {
        AuraObject object = objects.get(objectId);
        return object != null ? Optional.of(object.copy()) : Optional.empty();
    }

    private List<String> parentsOf(String objectId) {
        List<String> parents = prototypeLinks.get(objectId);
        return parents != null ? List.copyOf(parents) : List.of();
    }
}

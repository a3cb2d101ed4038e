package com.aura.core.store;

import com.aura.core.model.AuraObject;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Persistent home of all objects and prototype links.
 * <p>
 * Every operation is asynchronous so callers can suspend on storage without
 * blocking their own thread. Implementations must make a single
 * {@link #update} atomic per document; they give no ordering guarantee
 * between two updates of the same document issued concurrently.
 * <p>
 * Implementations: {@link InMemoryObjectStore} (default), {@link JdbcObjectStore}
 * (when a DataSource is configured).
 */
public interface ObjectStore {

    /**
     * Ensures the backing schema exists and that the {@code nil} root object is present.
     * Called once at startup, before any other operation.
     */
    void initialize();

    /**
     * Point lookup. Completes with an empty optional when the object does not exist.
     * The returned object is a private copy owned by the caller.
     */
    CompletableFuture<Optional<AuraObject>> get(String objectId);

    /**
     * Atomically applies a partial update to one document.
     * <p>
     * With {@code merge=true} the patch's top-level attribute and method keys are merged
     * into the stored mappings; with {@code merge=false} each mapping the patch carries
     * replaces the stored one.
     * Completes exceptionally with {@link ObjectNotFoundException} when the object is
     * missing, {@link StoreConflictException} when a concurrent writer won, or
     * {@link PersistenceException} when the backend fails.
     */
    CompletableFuture<Void> update(String objectId, ObjectPatch patch, boolean merge);

    /**
     * Breadth-first walk along outbound edges of {@code edgeType}, starting at
     * {@code startId} (depth 0) and visiting each object at most once, down to
     * {@code maxDepth} inclusive. Returns the objects accepted by {@code predicate},
     * ordered by depth and, within one depth, by link-creation order.
     */
    CompletableFuture<List<TraversalMatch>> traverse(String startId, EdgeType edgeType, int maxDepth,
                                                      Predicate<AuraObject> predicate);

    /**
     * Stores a new object. Completes exceptionally with {@link StoreConflictException}
     * when the id is taken.
     */
    CompletableFuture<Void> create(AuraObject object);

    /**
     * Adds a prototype edge from {@code childId} to {@code parentId}. Adding an existing
     * edge is a no-op. Both objects must exist.
     */
    CompletableFuture<Void> link(String childId, String parentId);

    /** Short backend name for logs and health output. */
    String backendName();
}

package com.aura.core.store;

import com.aura.core.model.AuraObject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * JDBC-backed {@link ObjectStore} for PostgreSQL (H2 in tests).
 * <p>
 * Objects are rows of {@code aura_objects} with the attribute and method
 * mappings serialized as JSON text; prototype edges are rows of
 * {@code aura_prototype_links}, whose identity column fixes link-creation order.
 * <p>
 * Updates are compare-and-set on a version column: the row is read, the patch
 * applied in memory and written back only if the version is unchanged. A lost
 * race is re-attempted up to {@code casAttempts} times before surfacing as
 * {@link StoreConflictException}. This keeps each single update atomic; it does
 * not serialize two dispatches that wrote mappings computed from the same snapshot.
 * <p>
 * Blocking JDBC calls run on a private bounded executor so callers are never
 * blocked. Tables are created by {@link #initialize()}.
 */
public class JdbcObjectStore implements ObjectStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JdbcObjectStore.class);

    private static final String OBJECTS_TABLE = "aura_objects";
    private static final String LINKS_TABLE = "aura_prototype_links";

    /** SQLState for unique constraint violations (PostgreSQL and H2). */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String CREATE_OBJECTS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          VARCHAR(255) NOT NULL PRIMARY KEY,
                attributes  TEXT NOT NULL,
                methods     TEXT NOT NULL,
                version     BIGINT NOT NULL DEFAULT 0,
                updated_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(OBJECTS_TABLE);

    private static final String CREATE_LINKS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq        BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                child_id   VARCHAR(255) NOT NULL,
                parent_id  VARCHAR(255) NOT NULL,
                UNIQUE (child_id, parent_id)
            )
            """.formatted(LINKS_TABLE);

    private static final String SELECT_OBJECT_SQL = """
            SELECT id, attributes, methods, version
            FROM %s
            WHERE id = ?
            """.formatted(OBJECTS_TABLE);

    private static final String INSERT_OBJECT_SQL = """
            INSERT INTO %s (id, attributes, methods, version)
            VALUES (?, ?, ?, 0)
            """.formatted(OBJECTS_TABLE);

    private static final String CAS_UPDATE_SQL = """
            UPDATE %s
            SET attributes = ?, methods = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP
            WHERE id = ? AND version = ?
            """.formatted(OBJECTS_TABLE);

    private static final String SELECT_PARENTS_SQL = """
            SELECT parent_id
            FROM %s
            WHERE child_id = ?
            ORDER BY seq ASC
            """.formatted(LINKS_TABLE);

    private static final String SELECT_LINK_SQL = """
            SELECT 1 FROM %s WHERE child_id = ? AND parent_id = ?
            """.formatted(LINKS_TABLE);

    private static final String INSERT_LINK_SQL = """
            INSERT INTO %s (child_id, parent_id) VALUES (?, ?)
            """.formatted(LINKS_TABLE);

    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> METHODS_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final int casAttempts;

    public JdbcObjectStore(DataSource dataSource, ObjectMapper objectMapper, int threads, int casAttempts) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.casAttempts = Math.max(1, casAttempts);
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "aura-store-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates both tables if they do not exist and inserts the {@code nil} root object.
     */
    @Override
    public void initialize() {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(CREATE_OBJECTS_SQL)) {
                stmt.execute();
            }
            try (PreparedStatement stmt = conn.prepareStatement(CREATE_LINKS_SQL)) {
                stmt.execute();
            }
            if (selectObject(conn, AuraObject.NIL_ID).isEmpty()) {
                insertObject(conn, AuraObject.empty(AuraObject.NIL_ID));
                log.info("Created '{}' root object", AuraObject.NIL_ID);
            }
            log.info("Object store tables '{}' and '{}' ensured", OBJECTS_TABLE, LINKS_TABLE);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize object store: " + e.getMessage(), e);
        }
    }

    @Override
    public CompletableFuture<Optional<AuraObject>> get(String objectId) {
        return async(() -> {
            try (Connection conn = dataSource.getConnection()) {
                return selectObject(conn, objectId).map(VersionedObject::object);
            } catch (SQLException e) {
                throw new PersistenceException("Failed to read object '" + objectId + "'", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> update(String objectId, ObjectPatch patch, boolean merge) {
        return async(() -> {
            try (Connection conn = dataSource.getConnection()) {
                for (int attempt = 1; attempt <= casAttempts; attempt++) {
                    VersionedObject current = selectObject(conn, objectId)
                            .orElseThrow(() -> new ObjectNotFoundException(objectId));
                    AuraObject updated = patch.applyTo(current.object(), merge);

                    try (PreparedStatement stmt = conn.prepareStatement(CAS_UPDATE_SQL)) {
                        stmt.setString(1, toJson(updated.attributes()));
                        stmt.setString(2, toJson(updated.methods()));
                        stmt.setString(3, objectId);
                        stmt.setLong(4, current.version());
                        if (stmt.executeUpdate() == 1) {
                            log.debug("Updated object '{}' to version {} (merge={})",
                                    objectId, current.version() + 1, merge);
                            return null;
                        }
                    }
                    log.debug("Version race on object '{}' (attempt {}/{})", objectId, attempt, casAttempts);
                }
                throw new StoreConflictException("Concurrent update conflict on object '" + objectId
                        + "' after " + casAttempts + " attempts");
            } catch (SQLException e) {
                throw new PersistenceException("Failed to update object '" + objectId + "'", e);
            }
        });
    }

    @Override
    public CompletableFuture<List<TraversalMatch>> traverse(String startId, EdgeType edgeType, int maxDepth,
                                                             Predicate<AuraObject> predicate) {
        return async(() -> {
            try (Connection conn = dataSource.getConnection()) {
                return PrototypeWalk.breadthFirst(startId, maxDepth, predicate,
                        id -> unchecked(() -> selectObject(conn, id).map(VersionedObject::object)),
                        id -> unchecked(() -> selectParents(conn, id)));
            } catch (SQLException e) {
                throw new PersistenceException("Failed to traverse from '" + startId + "'", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> create(AuraObject object) {
        return async(() -> {
            try (Connection conn = dataSource.getConnection()) {
                insertObject(conn, object);
                log.debug("Created object '{}'", object.id());
                return null;
            } catch (SQLException e) {
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw new StoreConflictException("Object already exists: " + object.id());
                }
                throw new PersistenceException("Failed to create object '" + object.id() + "'", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> link(String childId, String parentId) {
        return async(() -> {
            try (Connection conn = dataSource.getConnection()) {
                for (String id : List.of(childId, parentId)) {
                    if (selectObject(conn, id).isEmpty()) {
                        throw new ObjectNotFoundException(id);
                    }
                }
                try (PreparedStatement check = conn.prepareStatement(SELECT_LINK_SQL)) {
                    check.setString(1, childId);
                    check.setString(2, parentId);
                    try (ResultSet rs = check.executeQuery()) {
                        if (rs.next()) {
                            return null;
                        }
                    }
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_LINK_SQL)) {
                    stmt.setString(1, childId);
                    stmt.setString(2, parentId);
                    stmt.executeUpdate();
                }
                log.debug("Linked '{}' -> '{}'", childId, parentId);
                return null;
            } catch (SQLException e) {
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    // lost a race against an identical link insert
                    return null;
                }
                throw new PersistenceException("Failed to link '" + childId + "' -> '" + parentId + "'", e);
            }
        });
    }

    @Override
    public String backendName() {
        return "jdbc";
    }

    /**
     * Stops the store executor. Pending operations are allowed to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Object store executor stopped");
    }

    // ── Row helpers ─────────────────────────────────────────────────────

    private Optional<VersionedObject> selectObject(Connection conn, String objectId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_OBJECT_SQL)) {
            stmt.setString(1, objectId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                var object = new AuraObject(
                        rs.getString("id"),
                        fromJson(rs.getString("attributes"), ATTRIBUTES_TYPE),
                        fromJson(rs.getString("methods"), METHODS_TYPE));
                return Optional.of(new VersionedObject(object, rs.getLong("version")));
            }
        }
    }

    private List<String> selectParents(Connection conn, String childId) throws SQLException {
        var parents = new ArrayList<String>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_PARENTS_SQL)) {
            stmt.setString(1, childId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    parents.add(rs.getString("parent_id"));
                }
            }
        }
        return parents;
    }

    private void insertObject(Connection conn, AuraObject object) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_OBJECT_SQL)) {
            stmt.setString(1, object.id());
            stmt.setString(2, toJson(object.attributes()));
            stmt.setString(3, toJson(object.methods()));
            stmt.executeUpdate();
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize object document", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize object document", e);
        }
    }

    private <T> CompletableFuture<T> async(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, executor);
    }

    private static <T> T unchecked(SqlSupplier<T> supplier) {
        try {
            return supplier.get();
        } catch (SQLException e) {
            throw new PersistenceException("Traversal query failed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface SqlSupplier<T> {
        T get() throws SQLException;
    }

    private record VersionedObject(AuraObject object, long version) {}
}

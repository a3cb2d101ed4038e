package com.aura.core.resolver;

import com.aura.core.model.AuraObject;
import com.aura.core.model.ResolvedMethod;
import com.aura.core.store.InMemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MethodResolverTest {

    private InMemoryObjectStore store;
    private MethodResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        store.initialize();
        resolver = new MethodResolver(store);
    }

    private void create(String id, Map<String, String> methods, String... parents) {
        store.create(new AuraObject(id, Map.of(), methods)).join();
        for (String parent : parents) {
            store.link(id, parent).join();
        }
    }

    @Test
    @DisplayName("method declared on the target resolves at depth 0")
    void ownMethod() {
        create("a", Map.of("m", "function m(self) { return 'a'; }"), AuraObject.NIL_ID);

        ResolvedMethod resolved = resolver.resolve("a", "m").join().orElseThrow();
        assertEquals("a", resolved.declaringObjectId());
        assertEquals(0, resolved.depth());
    }

    @Test
    @DisplayName("method inherited two levels up resolves to the ancestor")
    void inheritedMethod() {
        create("b", Map.of("m", "function m(self) { return 'b'; }"), AuraObject.NIL_ID);
        create("a", Map.of(), "b");
        create("c", Map.of(), "a");

        ResolvedMethod resolved = resolver.resolve("c", "m").join().orElseThrow();
        assertEquals("b", resolved.declaringObjectId());
        assertEquals(2, resolved.depth());
        assertEquals("function m(self) { return 'b'; }", resolved.body());
    }

    @Test
    @DisplayName("shallowest declaring ancestor wins over a deeper one")
    void shallowestWins() {
        create("deep", Map.of("m", "function m(self) { return 'deep'; }"), AuraObject.NIL_ID);
        create("mid", Map.of(), "deep");
        create("near", Map.of("m", "function m(self) { return 'near'; }"), AuraObject.NIL_ID);
        create("start", Map.of(), "mid", "near");

        assertEquals("near", resolver.resolve("start", "m").join().orElseThrow().declaringObjectId());
    }

    @Test
    @DisplayName("equal depth ties break by link-creation order")
    void tieBreak() {
        create("p1", Map.of("m", "function m(self) { return 1; }"));
        create("p2", Map.of("m", "function m(self) { return 2; }"));
        create("child", Map.of(), "p2", "p1");

        assertEquals("p2", resolver.resolve("child", "m").join().orElseThrow().declaringObjectId());
    }

    @Test
    @DisplayName("unknown method resolves to empty")
    void miss() {
        create("a", Map.of(), AuraObject.NIL_ID);
        assertEquals(Optional.empty(), resolver.resolve("a", "missing").join());
    }

    @Test
    @DisplayName("cyclic chains terminate with a miss")
    void cycleTerminates() {
        create("a", Map.of());
        create("b", Map.of(), "a");
        store.link("a", "b").join();

        assertTrue(resolver.resolve("a", "missing").join().isEmpty());
    }

    @Test
    @DisplayName("declarations beyond the depth bound are not found")
    void beyondMaxDepth() {
        create("root", Map.of("m", "function m(self) {}"));
        create("l1", Map.of(), "root");
        create("l2", Map.of(), "l1");
        create("l3", Map.of(), "l2");

        var bounded = new MethodResolver(store, 2);
        assertTrue(bounded.resolve("l3", "m").join().isEmpty());
        assertTrue(new MethodResolver(store, 3).resolve("l3", "m").join().isPresent());
    }

    @Test
    @DisplayName("resolution does not modify the store")
    void noSideEffects() {
        create("b", Map.of("m", "function m(self) {}"));
        create("a", Map.of(), "b");

        resolver.resolve("a", "m").join();
        assertFalse(store.get("a").join().orElseThrow().declaresMethod("m"));
    }
}

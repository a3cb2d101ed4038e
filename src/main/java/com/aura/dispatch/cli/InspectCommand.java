package com.aura.dispatch.cli;

import com.aura.core.model.AuraObject;
import com.aura.core.resolver.MethodResolver;
import com.aura.core.store.EdgeType;
import com.aura.core.store.ObjectStore;
import com.aura.core.store.TraversalMatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: aura inspect &lt;objectId&gt;
 * <p>
 * Shows an object's attributes, the methods it declares and its delegation chain.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect an object and its delegation chain")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Object ID")
    private String objectId;

    private final ObjectStore objectStore;
    private final MethodResolver methodResolver;
    private final ObjectMapper objectMapper;

    public InspectCommand(ObjectStore objectStore, MethodResolver methodResolver, ObjectMapper objectMapper) {
        this.objectStore = objectStore;
        this.methodResolver = methodResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var found = objectStore.get(objectId).join();
        if (found.isEmpty()) {
            ConsoleOutput.error("Object not found: " + objectId);
            return 1;
        }
        AuraObject object = found.get();

        System.out.println();
        System.out.println("OBJECT " + object.id());
        System.out.println("──────────────────────────────────");
        System.out.println("  Attributes: " + render(object.attributes()));
        if (object.methods().isEmpty()) {
            System.out.println("  Methods:    none");
        } else {
            System.out.println("  Methods:    " + String.join(", ", object.methods().keySet()));
        }

        List<TraversalMatch> chain = objectStore.traverse(object.id(), EdgeType.PROTOTYPE,
                methodResolver.getMaxDepth(), o -> true).join();
        System.out.println();
        System.out.println("  DELEGATION CHAIN:");
        for (var link : chain) {
            ConsoleOutput.chainLink(link.depth(), link.object().id(), link.object().methods().size());
        }
        return 0;
    }

    private String render(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            return attributes.toString();
        }
    }
}

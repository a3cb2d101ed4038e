package com.aura.core.generator;

import com.aura.core.llm.LlmEmptyResponseException;
import com.aura.core.llm.LlmParseException;
import com.aura.core.llm.LlmService;
import com.aura.core.model.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CodeGenerator} backed by the chat model behind {@link LlmService}.
 * <p>
 * Model calls are blocking, so they run on a dedicated pool and never on the
 * dispatching thread.
 */
@Service
public class LlmCodeGenerator implements CodeGenerator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmCodeGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are %s, the steward of the Aura object runtime. Your purpose is to keep the
            system stable, secure and coherent.
            Your current task is to write a JavaScript implementation of the missing method `%s`.

            CONSTRAINTS:
            1. Output: respond with a single JSON object with one key, "code", whose value is the
               complete JavaScript source. No text before or after the JSON.
            2. Signature: define exactly one top-level function named `%s`. Its first parameter is
               the receiving object `self`; the call's positional arguments follow. Named arguments,
               when present, arrive as one trailing plain object.
            3. Receiver: read state with `self.get(name)` (null when absent) or `self.has(name)`,
               write it with `self.set(name, value)`. `self.attributes` is the plain attribute map.
            4. Commit marker: if the function modifies state, its LAST statement MUST be
               `self.commit();`.
            5. Security: no `import`, `require` or `load`; no `eval`, `Function`, `globalThis`,
               `Reflect`, `Proxy`, `Java`, `Polyglot`, `process`, `open` or `fetch`; no `delete`;
               no `__proto__`, `constructor`, `prototype` or other double-underscore names;
               no `this`. Index with a computed key only on `self.attributes`; iterate arrays
               with `for (const x of items)`, `forEach`, `map` or `reduce`.
            6. Simplicity: keep the code short, deterministic and focused on the mandate.
               Return plain JSON-compatible values.

            Example for `greet(self, name)`:
            {"code": "function greet(self, name) {\\n  return 'Hello, ' + name + '!';\\n}"}

            Example for a state-modifying `set_name(self, newName)`:
            {"code": "function set_name(self, newName) {\\n  self.set('name', newName);\\n  self.commit();\\n}"}
            """;

    private final LlmService llmService;
    private final GeneratorProperties properties;
    private final ExecutorService executor;

    public LlmCodeGenerator(LlmService llmService, GeneratorProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getThreads()), r -> {
            var t = new Thread(r, "aura-generator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<String> generate(String mandate, String methodName) {
        return CompletableFuture.supplyAsync(() -> generateBlocking(mandate, methodName), executor);
    }

    @Override
    public String describe() {
        return "llm(" + llmService.getBaseUrl() + ")";
    }

    String generateBlocking(String mandate, String methodName) {
        String systemPrompt = SYSTEM_PROMPT.formatted(properties.getPersona(), methodName, methodName);
        log.info("Generating implementation for '{}'", methodName);
        log.debug("Generation mandate: {}", mandate);

        GeneratedMethod generated;
        try {
            generated = llmService.structuredCall(systemPrompt, mandate, GeneratedMethod.class);
        } catch (LlmEmptyResponseException | LlmParseException e) {
            throw new GenerationException("code generation failed: " + e.getMessage(), e);
        } catch (ResourceAccessException e) {
            throw new TransportException("generator", "model unreachable: " + e.getMessage(), e);
        }

        String code = generated == null || generated.code() == null ? "" : LlmService.stripFences(generated.code());
        if (code.isBlank()) {
            throw new GenerationException("code generation failed: model returned no code for '" + methodName + "'");
        }
        log.debug("Generated body for '{}':\n{}", methodName, code);
        return code;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

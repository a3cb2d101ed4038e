package com.aura.core.security;

import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ErrorReporter;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.Assignment;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.ElementGet;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.FunctionNode;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NumberLiteral;
import org.mozilla.javascript.ast.ObjectProperty;
import org.mozilla.javascript.ast.PropertyGet;
import org.mozilla.javascript.ast.StringLiteral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static audit of generated method bodies before they may be installed.
 * <p>
 * The body is parsed with Rhino's JavaScript parser and its syntax tree is
 * walked; nothing is ever executed. A body fails when it does not parse, uses
 * module-loading constructs, references a denied identifier or a dunder name,
 * contains a {@code delete} expression, uses {@code this} (the global object
 * inside a body) or indexes anything but {@code self.attributes} with a computed
 * key. The verdict depends only on the source text (and the configured
 * denylist), so auditing the same text twice yields the same verdict.
 * <p>
 * Soft rule: a function that writes receiver state ({@code self.set(...)} or
 * an assignment into {@code self.attributes}) should end with
 * {@code self.commit();}. A violation is logged and reported as a warning.
 */
@Service
public class SecurityAuditor {

    private static final Logger log = LoggerFactory.getLogger(SecurityAuditor.class);

    /** Module and script loaders of the engines a body could run on. */
    static final Set<String> MODULE_LOADERS = Set.of(
            "require", "load", "loadWithNewGlobal", "importScripts", "importClass", "importPackage");

    static final Set<String> DENIED_IDENTIFIERS = Set.of(
            // dynamic evaluation
            "eval", "Function", "constructor", "prototype",
            // host interop
            "Java", "Packages", "Polyglot", "Graal", "java", "javax", "JavaImporter",
            // global object and reflection
            "globalThis", "global", "Reflect", "Proxy",
            // process, environment and file access
            "process", "open", "exit", "quit", "readFile", "readline", "arguments", "print", "printErr",
            // network and scheduling
            "fetch", "XMLHttpRequest", "WebSocket", "setTimeout", "setInterval", "Worker",
            "SharedArrayBuffer", "Atomics", "WebAssembly");

    private static final Pattern IMPORT_SYNTAX = Pattern.compile("(^|[^\\w$.])import\\s*[({'\"*\\w]");

    private static final String RECEIVER = "self";

    private final Set<String> deniedIdentifiers;
    private final boolean strictCommitMarker;

    public SecurityAuditor(SecurityProperties properties) {
        var denied = new HashSet<>(DENIED_IDENTIFIERS);
        denied.addAll(MODULE_LOADERS);
        denied.addAll(properties.getDeniedIdentifiers());
        this.deniedIdentifiers = Set.copyOf(denied);
        this.strictCommitMarker = properties.isStrictCommitMarker();
    }

    public AuditVerdict audit(String source) {
        return audit(source, null);
    }

    /**
     * Audits a candidate body.
     *
     * @param source     the method body source text
     * @param methodName when non-null, the body must declare a top-level function of this name
     * @return the verdict
     */
    public AuditVerdict audit(String source, String methodName) {
        if (source == null || source.isBlank()) {
            return reject(methodName, "empty method body");
        }

        AstRoot root;
        try {
            root = parse(source);
        } catch (RhinoException e) {
            if (IMPORT_SYNTAX.matcher(source).find()) {
                return reject(methodName, "module import syntax is not allowed");
            }
            return reject(methodName, "syntax error: " + e.details());
        }

        var finder = new ViolationFinder(deniedIdentifiers);
        root.visit(finder);
        if (finder.violation != null) {
            return reject(methodName, finder.violation);
        }

        List<FunctionNode> functions = topLevelFunctions(root);
        if (methodName != null && functions.stream().noneMatch(fn -> methodName.equals(nameOf(fn)))) {
            return reject(methodName, "no top-level function named '" + methodName + "'");
        }

        var warnings = new ArrayList<String>();
        for (FunctionNode fn : functions) {
            if (methodName != null && !methodName.equals(nameOf(fn))) {
                continue;
            }
            if (writesReceiverState(fn) && !endsWithCommit(fn)) {
                warnings.add("function '" + nameOf(fn) + "' modifies state but does not end with "
                        + RECEIVER + ".commit()");
            }
        }

        if (!warnings.isEmpty()) {
            if (strictCommitMarker) {
                return reject(methodName, warnings.get(0));
            }
            warnings.forEach(w -> log.warn("Audit warning for '{}': {}", methodName, w));
        }
        log.debug("Audit passed for '{}'", methodName);
        return AuditVerdict.pass(warnings);
    }

    private AuditVerdict reject(String methodName, String reason) {
        log.warn("Audit rejected '{}': {}", methodName, reason);
        return AuditVerdict.fail(reason);
    }

    private static AstRoot parse(String source) {
        var env = new CompilerEnvirons();
        env.setLanguageVersion(Context.VERSION_ES6);
        env.setRecordingComments(false);
        env.setStrictMode(false);
        var reporter = new ThrowingErrorReporter();
        env.setErrorReporter(reporter);
        return new Parser(env, reporter).parse(source, "method-body", 1);
    }

    private static List<FunctionNode> topLevelFunctions(AstRoot root) {
        var functions = new ArrayList<FunctionNode>();
        for (Node child : root) {
            if (child instanceof FunctionNode fn && fn.getFunctionName() != null) {
                functions.add(fn);
            }
        }
        return functions;
    }

    private static String nameOf(FunctionNode fn) {
        return fn.getFunctionName() != null ? fn.getFunctionName().getIdentifier() : null;
    }

    static boolean isDunder(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }

    private static boolean writesReceiverState(FunctionNode fn) {
        var detector = new StateWriteDetector();
        fn.getBody().visit(detector);
        return detector.found;
    }

    private static boolean endsWithCommit(FunctionNode fn) {
        AstNode last = null;
        for (Node statement : fn.getBody()) {
            if (statement instanceof AstNode node) {
                last = node;
            }
        }
        return last instanceof ExpressionStatement stmt
                && isReceiverCall(stmt.getExpression(), "commit");
    }

    private static boolean isReceiverCall(AstNode node, String method) {
        return node instanceof FunctionCall call
                && call.getTarget() instanceof PropertyGet get
                && isReceiver(get.getTarget())
                && method.equals(get.getProperty().getIdentifier());
    }

    private static boolean isReceiver(AstNode node) {
        return node instanceof Name name && RECEIVER.equals(name.getIdentifier());
    }

    private static boolean isReceiverAttributes(AstNode node) {
        return node instanceof PropertyGet get && isReceiver(get.getTarget())
                && "attributes".equals(get.getProperty().getIdentifier());
    }

    /** True when {@code node} is {@code self.attributes} or an access below it. */
    private static boolean isUnderReceiverAttributes(AstNode node) {
        AstNode current = node;
        while (current instanceof PropertyGet || current instanceof ElementGet) {
            AstNode target = current instanceof PropertyGet get ? get.getTarget() : ((ElementGet) current).getTarget();
            if (current instanceof PropertyGet get && isReceiver(target)
                    && "attributes".equals(get.getProperty().getIdentifier())) {
                return true;
            }
            current = target;
        }
        return false;
    }

    /**
     * Records the first hard-rule violation found in the tree.
     */
    private static final class ViolationFinder implements org.mozilla.javascript.ast.NodeVisitor {

        private final Set<String> denied;
        private String violation;

        ViolationFinder(Set<String> denied) {
            this.denied = denied;
        }

        @Override
        public boolean visit(AstNode node) {
            if (violation != null) {
                return false;
            }
            if (node.getType() == Token.DELPROP) {
                violation = "deletion ('delete') is not allowed";
            } else if (node instanceof FunctionCall call && call.getTarget() instanceof Name target
                    && MODULE_LOADERS.contains(target.getIdentifier())) {
                violation = "module loading via '" + target.getIdentifier() + "' is not allowed";
            } else if (node instanceof Name name) {
                checkIdentifier(name.getIdentifier());
            } else if (node.getType() == Token.THIS) {
                violation = "'this' is not allowed; use the receiver '" + RECEIVER + "'";
            } else if (node instanceof ElementGet get) {
                checkElementAccess(get);
            } else if (node instanceof ObjectProperty property && property.getLeft() instanceof StringLiteral key) {
                checkIdentifier(key.getValue());
            }
            return violation == null;
        }

        /** Literal keys are checked like names; computed keys may only index {@code self.attributes}. */
        private void checkElementAccess(ElementGet get) {
            AstNode element = get.getElement();
            if (element instanceof StringLiteral key) {
                checkIdentifier(key.getValue());
            } else if (!(element instanceof NumberLiteral) && !isReceiverAttributes(get.getTarget())) {
                violation = "computed property access is only allowed on " + RECEIVER + ".attributes";
            }
        }

        private void checkIdentifier(String identifier) {
            if (identifier == null) {
                return;
            }
            if (isDunder(identifier)) {
                violation = "reflection attribute '" + identifier + "' is not allowed";
            } else if (denied.contains(identifier)) {
                violation = "forbidden identifier '" + identifier + "'";
            }
        }
    }

    private static final class StateWriteDetector implements org.mozilla.javascript.ast.NodeVisitor {

        private boolean found;

        @Override
        public boolean visit(AstNode node) {
            if (found) {
                return false;
            }
            if (isReceiverCall(node, "set")) {
                found = true;
            } else if (node instanceof Assignment assignment && isUnderReceiverAttributes(assignment.getLeft())) {
                found = true;
            }
            return !found;
        }
    }

    /**
     * Turns every parse error into an exception so a malformed body never yields a tree.
     */
    private static final class ThrowingErrorReporter implements ErrorReporter {

        @Override
        public void warning(String message, String sourceName, int line, String lineSource, int lineOffset) {
            log.debug("Parser warning at line {}: {}", line, message);
        }

        @Override
        public void error(String message, String sourceName, int line, String lineSource, int lineOffset) {
            throw runtimeError(message, sourceName, line, lineSource, lineOffset);
        }

        @Override
        public EvaluatorException runtimeError(String message, String sourceName, int line,
                                               String lineSource, int lineOffset) {
            return new EvaluatorException(message, sourceName, line, lineSource, lineOffset);
        }
    }
}

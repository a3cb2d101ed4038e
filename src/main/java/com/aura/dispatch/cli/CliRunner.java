package com.aura.dispatch.cli;

import com.aura.core.model.TransportException;
import com.aura.core.store.PersistenceException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.concurrent.CompletionException;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * <p>
 * Commands return their own exit codes (see each command) and usage errors exit
 * with 2. A runtime component that cannot be reached while a command runs exits
 * with {@value #EXIT_COMPONENT_UNAVAILABLE}; any other unexpected error with 1.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_COMPONENT_UNAVAILABLE = 3;

    private final AuraCommand auraCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AuraCommand auraCommand, IFactory factory) {
        this.auraCommand = auraCommand;
        this.factory = factory;
    }

    /**
     * True when the first non-option argument is {@code serve}. In serve mode the
     * embedded web server keeps the JVM alive and picocli is not run.
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            return;
        }
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(auraCommand, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    Throwable cause = unwrap(ex);
                    ConsoleOutput.error(describe(cause));
                    return exitCodeFor(cause);
                });
    }

    static int exitCodeFor(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TransportException || cause instanceof PersistenceException) {
            return EXIT_COMPONENT_UNAVAILABLE;
        }
        return CommandLine.ExitCode.SOFTWARE;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof TransportException transport) {
            return "Component '" + transport.getComponent() + "' unavailable: " + transport.getMessage();
        }
        if (cause instanceof PersistenceException) {
            return "Object store unavailable: " + cause.getMessage();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

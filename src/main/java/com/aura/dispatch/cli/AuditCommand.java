package com.aura.dispatch.cli;

import com.aura.core.security.AuditVerdict;
import com.aura.core.security.SecurityAuditor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: aura audit &lt;file&gt; [--method name]
 * <p>
 * Runs the static security audit on a method body without installing or executing it.
 * Exits with 0 when the body passes, 1 when it is rejected, 2 when the file cannot be read.
 */
@Command(name = "audit", mixinStandardHelpOptions = true, description = "Audit a method body offline")
@Component
public class AuditCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "File containing the JavaScript method body")
    private Path file;

    @Option(names = {"-m", "--method"}, description = "Require a top-level function with this name")
    private String methodName;

    private final SecurityAuditor auditor;

    public AuditCommand(SecurityAuditor auditor) {
        this.auditor = auditor;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }

        AuditVerdict verdict = auditor.audit(source, methodName);
        verdict.warnings().forEach(ConsoleOutput::warning);
        if (verdict.passed()) {
            ConsoleOutput.success("Audit passed: " + file);
            return 0;
        }
        ConsoleOutput.error("Audit rejected: " + verdict.reason());
        return 1;
    }
}

package com.aura.core.security;

import java.util.List;

/**
 * Result of a static audit.
 *
 * @param passed   whether the body may be installed and executed
 * @param reason   why the audit failed ({@code null} when passed)
 * @param warnings soft-rule findings that did not fail the audit
 */
public record AuditVerdict(
    boolean passed,
    String reason,
    List<String> warnings
) {

    public AuditVerdict {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static AuditVerdict pass(List<String> warnings) {
        return new AuditVerdict(true, null, warnings);
    }

    public static AuditVerdict fail(String reason) {
        return new AuditVerdict(false, reason, List.of());
    }
}

package com.aura.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "aura.security")
public class SecurityProperties {

    /** Identifiers denied in addition to the built-in list. */
    private List<String> deniedIdentifiers = List.of();

    /** When true, a state-modifying body without the commit marker fails the audit. */
    private boolean strictCommitMarker = false;

    public List<String> getDeniedIdentifiers() {
        return deniedIdentifiers;
    }

    public void setDeniedIdentifiers(List<String> deniedIdentifiers) {
        this.deniedIdentifiers = deniedIdentifiers;
    }

    public boolean isStrictCommitMarker() {
        return strictCommitMarker;
    }

    public void setStrictCommitMarker(boolean strictCommitMarker) {
        this.strictCommitMarker = strictCommitMarker;
    }
}

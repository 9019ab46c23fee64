package com.eainde.slopstopper.provider;

/**
 * Persona instructions sent verbatim as the system message, tagged with the schema version they target.
 */
public record PersonaPrompt(String schemaVersion, String instructions) {
}

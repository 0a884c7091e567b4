package com.openforge.parley.memory;

/**
 * Classifies the nature of a long-term memory entry.
 *
 * INTERACTION  a promoted exchange: "User: … / Assistant: …".
 * FEEDBACK     user feedback that matched no preference rule, kept verbatim.
 * SUMMARY      written when a session closes or expires.
 * FACT         knowledge stored explicitly by a caller.
 */
public enum MemoryType {
    INTERACTION,
    FEEDBACK,
    SUMMARY,
    FACT
}

package com.repstack.model.enums;

/**
 * How a routine is produced. FALLBACK is never requested by callers; it marks routines built
 * by the safe bodyweight fallback.
 */
public enum GenerationStrategy {
    /** deterministic routine built from today's program template */
    CATALOG,
    /** single generative call constrained to the exercise pool */
    CREATIVE,
    /** generative call with function-calling tools, bounded loop */
    TOOL_BASED,
    FALLBACK
}

package com.dispense.follow;

public enum RenderMode {
    /** Log lines exactly as written. */
    RAW,
    /** Every decoded message, fully formatted. */
    HUMAN,
    /** Only what matters while watching live: assistant text, tools, problems and the result. */
    FOLLOW
}

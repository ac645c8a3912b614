package com.dispense.follow;

/**
 * What the agent appears to be doing, as inferred from its output.
 */
public enum WorkingState {
    IDLE("", new String[] {" "}),
    PROCESSING("Working...", new String[] {"|", "/", "-", "\\"}),
    TOOLING("Using tools...", new String[] {"[=  ]", "[ = ]", "[  =]", "[ = ]"}),
    THINKING("Thinking...", new String[] {".  ", ".. ", "...", " ..", "  .", "   "});

    private final String label;
    private final String[] frames;

    WorkingState(String label, String[] frames) {
        this.label = label;
        this.frames = frames;
    }

    public String label() {
        return label;
    }

    public String frame(int tick) {
        return frames[Math.floorMod(tick, frames.length)];
    }
}

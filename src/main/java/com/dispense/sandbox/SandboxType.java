package com.dispense.sandbox;

public enum SandboxType {
    /** Docker container on this machine. */
    LOCAL,
    /** Sandbox hosted by the remote control plane. */
    REMOTE
}

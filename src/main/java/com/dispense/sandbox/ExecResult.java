package com.dispense.sandbox;

public record ExecResult(String stdout, String stderr, int exitCode) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}

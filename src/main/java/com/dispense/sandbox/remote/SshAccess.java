package com.dispense.sandbox.remote;

/**
 * Short-lived credential for the SSH relay, scoped to one sandbox.
 *
 * @param token     used as the SSH user name
 * @param expiresAt expiry as reported by the control plane, may be null
 */
public record SshAccess(String token, String expiresAt) {}

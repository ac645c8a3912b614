package com.dispense.follow;

import com.dispense.core.error.DispenseException;
import com.dispense.core.error.ErrorCode;
import com.dispense.sandbox.ExecResult;
import com.dispense.sandbox.SandboxInfo;
import com.dispense.sandbox.SandboxProvider;

import java.util.Base64;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link LogSource} reading log files inside a sandbox through its provider's command
 * execution. Byte ranges are fetched with {@code tail -c +N | head -c LEN}, so only new
 * bytes cross the wire. Providers hand back command output as text, so each range is
 * base64-encoded in the sandbox and decoded here; a multibyte character cut at a range
 * boundary then reaches the line assembler intact.
 */
public class SandboxLogSource implements LogSource {

    private final SandboxProvider provider;
    private final SandboxInfo sandbox;

    public SandboxLogSource(SandboxProvider provider, SandboxInfo sandbox) {
        this.provider = provider;
        this.sandbox = sandbox;
    }

    @Override
    public OptionalLong size(String path) {
        ExecResult result = provider.executeCommand(sandbox, "stat -c %s " + quote(path) + " 2>/dev/null");
        String out = result.stdout().trim();
        if (!result.succeeded() || out.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(out));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    @Override
    public byte[] read(String path, long offset, int length) {
        ExecResult result = provider.executeCommand(sandbox,
                "tail -c +" + (offset + 1) + " " + quote(path) + " | head -c " + length + " | base64");
        if (!result.succeeded()) {
            throw new DispenseException(ErrorCode.COMMAND_FAILED,
                    "Cannot read " + path + " in " + sandbox.name() + ": " + result.stderr());
        }
        try {
            return Base64.getMimeDecoder().decode(result.stdout().trim());
        } catch (IllegalArgumentException e) {
            throw new DispenseException(ErrorCode.COMMAND_FAILED,
                    "Unreadable range of " + path + " in " + sandbox.name() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> latestLog(String directory) {
        ExecResult result = provider.executeCommand(sandbox,
                "ls -t " + quote(directory) + "/claude_*.log 2>/dev/null | head -n 1");
        String path = result.stdout().trim();
        return result.succeeded() && !path.isEmpty() ? Optional.of(path) : Optional.empty();
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}

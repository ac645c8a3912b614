package com.dispense.follow;

import java.io.PrintStream;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-line spinner repainted from a background thread while the agent is working.
 * Output lines must go through {@link #println} so the spinner line is cleared first.
 */
public class ProgressIndicator implements AutoCloseable {

    private static final long REPAINT_MS = 200;
    private static final String CLEAR_LINE = "\r\033[2K";

    private final WorkingStateClassifier classifier;
    private final PrintStream out;
    private final boolean enabled;
    private final AtomicInteger tick = new AtomicInteger();
    private ScheduledExecutorService scheduler;
    private boolean painted;

    public ProgressIndicator(WorkingStateClassifier classifier, PrintStream out, boolean enabled) {
        this.classifier = classifier;
        this.out = out;
        this.enabled = enabled;
    }

    /** A spinner that only paints when attached to an interactive console. */
    public static ProgressIndicator forConsole(WorkingStateClassifier classifier) {
        return new ProgressIndicator(classifier, System.out, System.console() != null);
    }

    public synchronized void start() {
        if (!enabled || scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "progress-indicator");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::repaint, REPAINT_MS, REPAINT_MS, TimeUnit.MILLISECONDS);
    }

    public synchronized void println(String line) {
        clear();
        out.println(line);
    }

    private synchronized void repaint() {
        if (!classifier.isWorking()) {
            clear();
            return;
        }
        WorkingState state = classifier.state();
        out.print(CLEAR_LINE + state.frame(tick.getAndIncrement()) + " " + state.label());
        out.flush();
        painted = true;
    }

    private void clear() {
        if (painted) {
            out.print(CLEAR_LINE);
            out.flush();
            painted = false;
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        clear();
    }
}

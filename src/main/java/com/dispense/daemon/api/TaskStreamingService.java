package com.dispense.daemon.api;

import com.dispense.core.error.DispenseException;
import com.dispense.core.events.EventBus;
import com.dispense.core.events.TaskEvent;
import com.dispense.core.metrics.DispenseMetrics;
import com.dispense.daemon.DaemonProperties;
import com.dispense.daemon.TaskSupervisor;
import com.dispense.protocol.LineAssembler;
import com.dispense.protocol.LogLine;
import com.dispense.protocol.StreamFrame;
import com.dispense.protocol.TaskStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams a task's output to {@link SseEmitter} clients by tailing its log sink.
 * <p>
 * Every stream reads the log from the beginning, so any number of consumers, attached at
 * any time, see the same lines. A stream ends with a STATUS frame carrying the exit code
 * once the supervisor has finalized the task and the file is drained. A consumer that goes
 * away only ends its own stream; the task keeps running.
 * <p>
 * Idle streams get a heartbeat comment so tunnels and proxies keep the connection open.
 */
@Service
@ConditionalOnProperty(name = "dispense.mode", havingValue = "daemon")
public class TaskStreamingService {

    private static final Logger log = LoggerFactory.getLogger(TaskStreamingService.class);

    /** No emitter timeout: a stream lasts as long as its task. */
    private static final long NO_TIMEOUT = 0L;

    private static final int READ_CHUNK = 64 * 1024;

    private final TaskSupervisor supervisor;
    private final EventBus eventBus;
    private final DaemonProperties properties;
    private final DispenseMetrics metrics;

    private final CopyOnWriteArrayList<StreamRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ExecutorService tailExecutor;

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public TaskStreamingService(TaskSupervisor supervisor,
                                EventBus eventBus,
                                DaemonProperties properties,
                                @Autowired(required = false) DispenseMetrics metrics) {
        this.supervisor = supervisor;
        this.eventBus = eventBus;
        this.properties = properties;
        this.metrics = metrics;
        AtomicInteger threadCount = new AtomicInteger();
        this.tailExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "stream-tail-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    void startHeartbeat() {
        long interval = properties.getHeartbeatInterval().toMillis();
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats, interval, interval, TimeUnit.MILLISECONDS);
        log.info("SSE heartbeat scheduler started (interval={}ms)", interval);
    }

    @PreDestroy
    void stop() {
        heartbeatScheduler.shutdownNow();
        tailExecutor.shutdownNow();
        for (StreamRegistration registration : activeRegistrations) {
            registration.emitter().complete();
        }
        log.info("Task streaming stopped");
    }

    private void sendHeartbeats() {
        for (StreamRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for task {} (connection likely closed): {}",
                        registration.taskId(), e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for task {} (emitter not active)", registration.taskId());
            }
        }
    }

    /**
     * Creates an emitter streaming the given task from the start of its log.
     *
     * @throws DispenseException if the task is unknown
     */
    public SseEmitter createEmitter(String taskId) {
        supervisor.logPath(taskId);
        SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
        var registration = new StreamRegistration(taskId, emitter, new AtomicBoolean(true));
        activeRegistrations.add(registration);
        if (metrics != null) {
            metrics.streamOpened();
        }

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for task {}: {}", taskId, ex.getMessage());
            cleanup(registration);
        });

        tailExecutor.execute(() -> pump(registration));
        log.info("Stream opened for task {}", taskId);
        return emitter;
    }

    public int activeStreamCount() {
        return activeRegistrations.size();
    }

    private void pump(StreamRegistration registration) {
        String taskId = registration.taskId();
        SseEmitter emitter = registration.emitter();
        try {
            streamTask(taskId, frame -> {
                if (!registration.open().get()) {
                    throw new IOException("stream closed");
                }
                emitter.send(SseEmitter.event().name("frame").data(frame, MediaType.APPLICATION_JSON));
            });
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.debug("Stream for task {} ended by consumer: {}", taskId, e.getMessage());
            cleanup(registration);
        } catch (DispenseException e) {
            log.warn("Stream for task {} failed: {}", taskId, e.getMessage());
            sendQuietly(emitter, StreamFrame.error(e.getMessage()));
            emitter.complete();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        }
    }

    /**
     * Delivers every line of the task's log to {@code sink}, following the file until the task
     * is finalized, then a final STATUS frame with the exit code. Returns when the stream is
     * complete; an {@link IOException} from the sink aborts only this stream.
     */
    public void streamTask(String taskId, FrameSink sink) throws IOException, InterruptedException {
        Path logPath = supervisor.logPath(taskId);
        Semaphore wakeup = new Semaphore(0);
        EventBus.Subscription subscription = eventBus.subscribe(taskId, event -> {
            if (TaskEvent.TYPE_FINALIZED.equals(event.eventType())) {
                wakeup.release();
            }
        });
        try {
            awaitLogFile(taskId, logPath);
            LineAssembler assembler = new LineAssembler();
            long offset = 0;
            while (true) {
                boolean finalized = supervisor.isFinalized(taskId);
                offset = drain(logPath, offset, assembler, sink);
                if (finalized) {
                    break;
                }
                wakeup.tryAcquire(properties.getTailInterval().toMillis(), TimeUnit.MILLISECONDS);
            }
            var trailing = assembler.flush();
            if (trailing.isPresent()) {
                sink.send(toFrame(trailing.get()));
            }
        } finally {
            subscription.unsubscribe();
        }

        TaskStatus status = supervisor.getStatus(taskId);
        int exitCode = status.exitCode() == null ? 0 : status.exitCode();
        sink.send(StreamFrame.completion(exitCode, "Task completed with exit code " + exitCode));
    }

    private void awaitLogFile(String taskId, Path logPath) throws InterruptedException {
        long deadline = System.nanoTime() + properties.getStreamWait().toNanos();
        while (!Files.exists(logPath) && !supervisor.isFinalized(taskId) && System.nanoTime() < deadline) {
            Thread.sleep(properties.getTailInterval().toMillis());
        }
    }

    private long drain(Path logPath, long offset, LineAssembler assembler, FrameSink sink) throws IOException {
        try (FileChannel channel = FileChannel.open(logPath, StandardOpenOption.READ)) {
            long size = channel.size();
            ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
            while (offset < size) {
                buffer.clear();
                int read = channel.read(buffer, offset);
                if (read <= 0) {
                    break;
                }
                offset += read;
                for (String line : assembler.push(buffer.array(), 0, read)) {
                    sink.send(toFrame(line));
                }
            }
            return offset;
        } catch (NoSuchFileException e) {
            return offset;
        }
    }

    private StreamFrame toFrame(String line) {
        return LogLine.parse(line).map(LogLine::toFrame).orElseGet(() -> LogLine.rawFrame(line));
    }

    private void sendQuietly(SseEmitter emitter, StreamFrame frame) {
        try {
            emitter.send(SseEmitter.event().name("frame").data(frame, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("Could not deliver error frame: {}", e.getMessage());
        }
    }

    private void cleanup(StreamRegistration registration) {
        if (registration.open().compareAndSet(true, false)) {
            activeRegistrations.remove(registration);
            if (metrics != null) {
                metrics.streamClosed();
            }
            log.debug("Cleaned up stream for task {}", registration.taskId());
        }
    }

    /** Receiver of stream frames; throwing {@link IOException} ends the stream. */
    @FunctionalInterface
    public interface FrameSink {
        void send(StreamFrame frame) throws IOException;
    }

    private record StreamRegistration(String taskId, SseEmitter emitter, AtomicBoolean open) {}
}

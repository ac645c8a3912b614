package com.dispense.daemon.api;

import com.dispense.core.health.HealthCheckService;
import com.dispense.core.health.HealthStatus;
import com.dispense.daemon.TaskSupervisor;
import com.dispense.protocol.DaemonHealth;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/health: the daemon's component checks plus its task and stream load.
 * The overall status is the worst component status; DOWN answers 503.
 */
@RestController
@RequestMapping("/api/v1/health")
@ConditionalOnProperty(name = "dispense.mode", havingValue = "daemon")
public class HealthController {

    private final HealthCheckService healthCheckService;
    private final TaskSupervisor supervisor;
    private final TaskStreamingService streamingService;

    public HealthController(HealthCheckService healthCheckService, TaskSupervisor supervisor,
                            TaskStreamingService streamingService) {
        this.healthCheckService = healthCheckService;
        this.supervisor = supervisor;
        this.streamingService = streamingService;
    }

    @GetMapping
    public ResponseEntity<DaemonHealth> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        Map<String, DaemonHealth.Component> components = new LinkedHashMap<>();
        HealthStatus.Status overall = HealthStatus.Status.UP;
        for (HealthStatus check : checks) {
            components.put(check.component(),
                    new DaemonHealth.Component(check.status().name(), check.detail(), check.metadata()));
            overall = worse(overall, check.status());
        }

        DaemonHealth body = new DaemonHealth(overall.name(), supervisor.activeTaskCount(), supervisor.taskCount(),
                streamingService.activeStreamCount(), components);
        return ResponseEntity.status(body.isDown() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK).body(body);
    }

    static HealthStatus.Status worse(HealthStatus.Status a, HealthStatus.Status b) {
        if (a == HealthStatus.Status.DOWN || b == HealthStatus.Status.DOWN) {
            return HealthStatus.Status.DOWN;
        }
        if (a == HealthStatus.Status.DEGRADED || b == HealthStatus.Status.DEGRADED) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }
}

package com.goldtrader.api.controller;

import com.goldtrader.domain.model.QueueHealth;
import com.goldtrader.oms.ExecutionWorker;
import com.goldtrader.queue.WorkQueue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoints.
 *
 * <p>GET /api/health is a shallow probe for the load balancer and never touches a subsystem.
 * GET /api/health/detailed reports the queue backend and the execution worker.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final WorkQueue workQueue;
    private final ExecutionWorker executionWorker;

    public HealthController(WorkQueue workQueue, ExecutionWorker executionWorker) {
        this.workQueue = workQueue;
        this.executionWorker = executionWorker;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        QueueHealth queueHealth = workQueue.health();
        boolean workerRunning = executionWorker.isRunning();

        Map<String, Object> subsystems = new LinkedHashMap<>();
        subsystems.put("queue", queueHealth.isBackendConnected() ? "UP" : "DOWN");
        subsystems.put("worker", workerRunning ? "UP" : "DOWN");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", queueHealth.isBackendConnected() && workerRunning ? "UP" : "DEGRADED");
        body.put("subsystems", subsystems);
        return ResponseEntity.ok(body);
    }
}

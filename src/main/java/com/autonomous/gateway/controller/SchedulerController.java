package com.autonomous.gateway.controller;

import com.autonomous.gateway.error.ValidationException;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.scheduler.ChatTaskScheduler;
import com.autonomous.gateway.scheduler.ScheduledChatTask;
import com.autonomous.gateway.scheduler.SchedulerManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/scheduler/tasks")
public class SchedulerController {

    private final SchedulerManager schedulerManager;

    public SchedulerController(SchedulerManager schedulerManager) {
        this.schedulerManager = schedulerManager;
    }

    @PostMapping
    public ResponseEntity<ScheduledTaskInfo> createTask(@RequestBody CreateScheduledTaskRequest request) {
        ProviderType provider = null;
        if (request.getProviderId() != null) {
            provider = ProviderType.fromId(request.getProviderId())
                .orElseThrow(() -> new ValidationException("Invalid scheduled task",
                    List.of("Unknown provider: " + request.getProviderId())));
        }

        ScheduledChatTask task = ScheduledChatTask.builder()
            .title(request.getTitle())
            .taskRequest(request.getTaskRequest())
            .intervalSeconds(request.getIntervalSeconds())
            .executeImmediately(request.isExecuteImmediately())
            .providerId(provider)
            .model(request.getModel())
            .build();

        ChatTaskScheduler scheduler = schedulerManager.createTask(task);
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduledTaskInfo.from(scheduler));
    }

    @GetMapping
    public ResponseEntity<?> listTasks() {
        List<ScheduledTaskInfo> tasks = schedulerManager.getAllSchedulers().stream()
            .map(ScheduledTaskInfo::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("tasks", tasks));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduledTaskInfo> getTask(@PathVariable String id) {
        return ResponseEntity.ok(ScheduledTaskInfo.from(schedulerManager.getScheduler(id)));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<?> startTask(@PathVariable String id) {
        schedulerManager.startTask(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Task started"));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<?> stopTask(@PathVariable String id) {
        schedulerManager.stopTask(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Task stopped"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteTask(@PathVariable String id) {
        schedulerManager.deleteTask(id);
        return ResponseEntity.ok(Map.of("success", true, "message", "Task deleted"));
    }
}

package com.tasklens.task;

import com.tasklens.audit.AuditLog;
import com.tasklens.audit.AuditService;
import com.tasklens.exception.ApiException;
import com.tasklens.observability.EventLog;
import com.tasklens.observability.RequestContext;
import com.tasklens.observability.TasklensMetrics;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task CRUD scoped to the owning user. A task owned by someone else is reported exactly
 * like a missing one.
 */
@Service
public class TaskService {

    static final String SERVICE = "task_service";
    static final int MAX_LIMIT = 1000;

    private static final EventLog events = EventLog.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final AuditService auditService;
    private final TasklensMetrics metrics;

    public TaskService(TaskRepository taskRepository, AuditService auditService, TasklensMetrics metrics) {
        this.taskRepository = taskRepository;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    @Transactional
    public Task create(RequestContext context, Long userId, String title, String description, TaskPriority priority) {
        events.info(context, "Task creation attempt", "title", title);

        Task task = taskRepository.save(new Task(userId, title, description, priority));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("title", title);
        details.put("priority", task.getPriority().value());
        auditService.record(context, AuditLog.ACTION_TASK_CREATED, userId, "task", task.getId(), details);
        metrics.recordApiCall(SERVICE, "create_task");

        events.info(context, "Task created", "task_id", task.getId());
        return task;
    }

    @Transactional(readOnly = true)
    public List<Task> list(RequestContext context, Long userId, int skip, int limit, String statusFilter) {
        if (skip < 0) {
            throw ApiException.badRequest("INVALID_PARAMETER", "skip must not be negative");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw ApiException.badRequest("INVALID_PARAMETER", "limit must be between 1 and " + MAX_LIMIT);
        }
        TaskStatus status = parseStatus(statusFilter);
        events.info(context, "Tasks list requested", "skip", skip, "limit", limit, "status_filter", statusFilter);

        List<Task> tasks = taskRepository.findOwnedTasks(userId, status, skip, limit);
        metrics.recordApiCall(SERVICE, "list_tasks");

        events.info(context, "Tasks retrieved", "count", tasks.size());
        return tasks;
    }

    @Transactional(readOnly = true)
    public Task get(RequestContext context, Long userId, Long taskId) {
        Task task = findOwned(context, userId, taskId);
        metrics.recordApiCall(SERVICE, "get_task");
        return task;
    }

    @Transactional
    public Task update(RequestContext context, Long userId, Long taskId, TaskChanges changes) {
        Task task = findOwned(context, userId, taskId);

        List<String> changed = new ArrayList<>();
        if (changes.title() != null && !changes.title().equals(task.getTitle())) {
            task.setTitle(changes.title());
            changed.add("title");
        }
        if (changes.description() != null && !changes.description().equals(task.getDescription())) {
            task.setDescription(changes.description());
            changed.add("description");
        }
        if (changes.priority() != null && changes.priority() != task.getPriority()) {
            task.setPriority(changes.priority());
            changed.add("priority");
        }
        if (changes.status() != null && changes.status() != task.getStatus()) {
            task.transitionTo(changes.status());
            changed.add("status");
        }

        if (!changed.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("fields", changed);
            details.put("status", task.getStatus().value());
            auditService.record(context, AuditLog.ACTION_TASK_UPDATED, userId, "task", taskId, details);
        }
        metrics.recordApiCall(SERVICE, "update_task");

        events.info(context, "Task updated", "task_id", taskId, "fields", changed);
        return task;
    }

    @Transactional
    public void delete(RequestContext context, Long userId, Long taskId) {
        Task task = findOwned(context, userId, taskId);
        taskRepository.delete(task);
        auditService.record(context, AuditLog.ACTION_TASK_DELETED, userId, "task", taskId,
                Map.of("title", task.getTitle()));
        metrics.recordApiCall(SERVICE, "delete_task");

        events.info(context, "Task deleted", "task_id", taskId);
    }

    private Task findOwned(RequestContext context, Long userId, Long taskId) {
        return taskRepository.findByIdAndUserId(taskId, userId).orElseThrow(() -> {
            events.debug(context, "Task not found", "task_id", taskId);
            return ApiException.notFound("TASK_NOT_FOUND", "Task not found");
        });
    }

    private static TaskStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return TaskStatus.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw ApiException.badRequest("INVALID_PARAMETER", e.getMessage());
        }
    }
}

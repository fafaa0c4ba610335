package com.tasklens.controller;

import com.tasklens.observability.OperationInterceptor;
import com.tasklens.observability.RequestContext;
import com.tasklens.task.Task;
import com.tasklens.task.TaskChanges;
import com.tasklens.task.TaskPriority;
import com.tasklens.task.TaskService;
import com.tasklens.task.TaskStatus;
import com.tasklens.user.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Task endpoints. The owner is always the token subject; there is no way to address
 * another user's tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskService taskService;
    private final UserService userService;
    private final OperationInterceptor operations;

    public TaskController(TaskService taskService, UserService userService, OperationInterceptor operations) {
        this.taskService = taskService;
        this.userService = userService;
        this.operations = operations;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TaskResponse create(@Valid @RequestBody CreateTaskRequest request,
                               @AuthenticationPrincipal Jwt jwt,
                               RequestContext context) {
        Long userId = ownerId(jwt, context);
        Task task = operations.call(context, "task_creation", () -> taskService.create(
                context, userId, request.title(), request.description(), request.priority()));
        return TaskResponse.from(task);
    }

    @GetMapping
    public List<TaskResponse> list(@RequestParam(defaultValue = "0") int skip,
                                   @RequestParam(defaultValue = "100") int limit,
                                   @RequestParam(name = "status_filter", required = false) String statusFilter,
                                   @AuthenticationPrincipal Jwt jwt,
                                   RequestContext context) {
        Long userId = ownerId(jwt, context);
        List<Task> tasks = operations.call(context, "task_list",
                () -> taskService.list(context, userId, skip, limit, statusFilter));
        return tasks.stream().map(TaskResponse::from).toList();
    }

    @GetMapping("/{taskId}")
    public TaskResponse get(@PathVariable Long taskId, @AuthenticationPrincipal Jwt jwt, RequestContext context) {
        Long userId = ownerId(jwt, context);
        return TaskResponse.from(operations.call(context, "task_get",
                () -> taskService.get(context, userId, taskId)));
    }

    @PatchMapping("/{taskId}")
    public TaskResponse update(@PathVariable Long taskId,
                               @Valid @RequestBody UpdateTaskRequest request,
                               @AuthenticationPrincipal Jwt jwt,
                               RequestContext context) {
        Long userId = ownerId(jwt, context);
        TaskChanges changes = new TaskChanges(
                request.title(), request.description(), request.status(), request.priority());
        return TaskResponse.from(operations.call(context, "task_update",
                () -> taskService.update(context, userId, taskId, changes)));
    }

    @DeleteMapping("/{taskId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long taskId, @AuthenticationPrincipal Jwt jwt, RequestContext context) {
        Long userId = ownerId(jwt, context);
        operations.run(context, "task_delete", () -> taskService.delete(context, userId, taskId));
    }

    private Long ownerId(Jwt jwt, RequestContext context) {
        return userService.currentUser(context, jwt.getSubject()).getId();
    }

    public record CreateTaskRequest(
            @NotBlank @Size(max = 200) String title,
            @Size(max = 5000) String description,
            TaskPriority priority
    ) {}

    public record UpdateTaskRequest(
            @Size(min = 1, max = 200) String title,
            @Size(max = 5000) String description,
            TaskStatus status,
            TaskPriority priority
    ) {}

    public record TaskResponse(
            Long id,
            String title,
            String description,
            TaskStatus status,
            TaskPriority priority,
            Long userId,
            Instant createdAt,
            Instant updatedAt,
            Instant completedAt
    ) {
        static TaskResponse from(Task task) {
            return new TaskResponse(task.getId(), task.getTitle(), task.getDescription(), task.getStatus(),
                    task.getPriority(), task.getUserId(), task.getCreatedAt(), task.getUpdatedAt(),
                    task.getCompletedAt());
        }
    }
}

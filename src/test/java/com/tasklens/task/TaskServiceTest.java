package com.tasklens.task;

import com.tasklens.audit.AuditLog;
import com.tasklens.audit.AuditService;
import com.tasklens.exception.ApiException;
import com.tasklens.observability.RequestContext;
import com.tasklens.observability.TasklensMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

    @Mock private TaskRepository taskRepository;
    @Mock private AuditService auditService;

    private SimpleMeterRegistry registry;
    private TaskService taskService;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        taskService = new TaskService(taskRepository, auditService, new TasklensMetrics(registry, true));
        context = RequestContext.detached("req-1");
    }

    @Test
    void createDefaultsToPendingMediumAndAudits() {
        when(taskRepository.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));

        Task task = taskService.create(context, 3L, "Write report", null, null);

        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(TaskPriority.MEDIUM, task.getPriority());
        assertEquals(3L, task.getUserId());
        verify(auditService).record(eq(context), eq(AuditLog.ACTION_TASK_CREATED), eq(3L), eq("task"), any(), anyMap());
        assertEquals(1.0, registry.get(TasklensMetrics.API_CALLS)
                .tags("service", "task_service", "operation", "create_task").counter().count());
    }

    @Test
    void persistenceFailurePropagatesWithoutSideEffects() {
        when(taskRepository.save(any(Task.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(DataAccessResourceFailureException.class,
                () -> taskService.create(context, 3L, "Write report", null, TaskPriority.HIGH));

        verifyNoInteractions(auditService);
        assertNull(registry.find(TasklensMetrics.API_CALLS).counter());
    }

    @Test
    void listPassesFilterAndWindow() {
        when(taskRepository.findOwnedTasks(3L, TaskStatus.IN_PROGRESS, 10, 20)).thenReturn(List.of());

        assertTrue(taskService.list(context, 3L, 10, 20, "in_progress").isEmpty());
    }

    @Test
    void listRejectsBadParameters() {
        assertEquals(HttpStatus.BAD_REQUEST,
                assertThrows(ApiException.class, () -> taskService.list(context, 3L, -1, 10, null)).getStatus());
        assertEquals(HttpStatus.BAD_REQUEST,
                assertThrows(ApiException.class, () -> taskService.list(context, 3L, 0, 0, null)).getStatus());
        assertEquals(HttpStatus.BAD_REQUEST,
                assertThrows(ApiException.class, () -> taskService.list(context, 3L, 0, 10, "done")).getStatus());
        verifyNoInteractions(taskRepository);
    }

    @Test
    void foreignTaskLooksMissing() {
        when(taskRepository.findByIdAndUserId(11L, 3L)).thenReturn(Optional.empty());

        ApiException e = assertThrows(ApiException.class, () -> taskService.get(context, 3L, 11L));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatus());
    }

    @Test
    void completingStampsAndReopeningClears() {
        Task task = new Task(3L, "Write report", null, TaskPriority.LOW);
        when(taskRepository.findByIdAndUserId(11L, 3L)).thenReturn(Optional.of(task));

        taskService.update(context, 3L, 11L, new TaskChanges(null, null, TaskStatus.COMPLETED, null));
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertNotNull(task.getCompletedAt());

        taskService.update(context, 3L, 11L, new TaskChanges(null, null, TaskStatus.IN_PROGRESS, null));
        assertNull(task.getCompletedAt());

        verify(auditService, times(2))
                .record(eq(context), eq(AuditLog.ACTION_TASK_UPDATED), eq(3L), eq("task"), eq(11L), anyMap());
    }

    @Test
    void noOpUpdateWritesNoAudit() {
        Task task = new Task(3L, "Write report", null, TaskPriority.LOW);
        when(taskRepository.findByIdAndUserId(11L, 3L)).thenReturn(Optional.of(task));

        taskService.update(context, 3L, 11L, new TaskChanges("Write report", null, null, TaskPriority.LOW));

        verifyNoInteractions(auditService);
    }

    @Test
    void deleteRemovesAndAudits() {
        Task task = new Task(3L, "Write report", null, null);
        when(taskRepository.findByIdAndUserId(11L, 3L)).thenReturn(Optional.of(task));

        taskService.delete(context, 3L, 11L);

        verify(taskRepository).delete(task);
        verify(auditService).record(eq(context), eq(AuditLog.ACTION_TASK_DELETED), eq(3L), eq("task"), eq(11L), anyMap());
    }
}

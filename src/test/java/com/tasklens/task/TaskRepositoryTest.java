package com.tasklens.task;

import com.tasklens.audit.AuditLog;
import com.tasklens.audit.AuditLogRepository;
import com.tasklens.user.User;
import com.tasklens.user.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class TaskRepositoryTest {

    @Autowired private TaskRepository taskRepository;
    @Autowired private UserRepository userRepository;
    @Autowired private AuditLogRepository auditLogRepository;

    @Test
    void ownedTasksAreScopedFilteredAndWindowed() {
        for (int i = 0; i < 5; i++) {
            taskRepository.save(new Task(1L, "task " + i, null, TaskPriority.MEDIUM));
        }
        Task done = new Task(1L, "done", null, TaskPriority.HIGH);
        done.transitionTo(TaskStatus.COMPLETED);
        taskRepository.save(done);
        taskRepository.save(new Task(2L, "someone else's", null, null));

        List<Task> all = taskRepository.findOwnedTasks(1L, null, 0, 100);
        assertEquals(6, all.size());
        assertTrue(all.stream().allMatch(t -> t.getUserId() == 1L));

        List<Task> completed = taskRepository.findOwnedTasks(1L, TaskStatus.COMPLETED, 0, 100);
        assertEquals(1, completed.size());
        assertEquals("done", completed.get(0).getTitle());

        assertEquals(2, taskRepository.findOwnedTasks(1L, null, 4, 100).size());
        assertEquals(3, taskRepository.findOwnedTasks(1L, null, 0, 3).size());
    }

    @Test
    void taskLookupRequiresOwner() {
        Task task = taskRepository.save(new Task(1L, "mine", null, null));

        assertTrue(taskRepository.findByIdAndUserId(task.getId(), 1L).isPresent());
        assertTrue(taskRepository.findByIdAndUserId(task.getId(), 2L).isEmpty());
    }

    @Test
    void duplicateUserDetection() {
        userRepository.save(new User("a@example.com", "alice", "hash", null));

        assertTrue(userRepository.existsByEmailOrUsername("a@example.com", "other"));
        assertTrue(userRepository.existsByEmailOrUsername("other@example.com", "alice"));
        assertFalse(userRepository.existsByEmailOrUsername("other@example.com", "other"));
        assertTrue(userRepository.findByEmail("a@example.com").isPresent());
    }

    @Test
    void auditRowsComeBackNewestFirst() {
        auditLogRepository.save(AuditLog.of(AuditLog.ACTION_USER_REGISTRATION).withRequestId("r1"));
        auditLogRepository.save(AuditLog.of(AuditLog.ACTION_USER_LOGIN).withRequestId("r2"));

        var page = auditLogRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, 10));

        assertEquals(2, page.getTotalElements());
        assertEquals("r2", page.getContent().get(0).getRequestId());
        assertEquals(1, auditLogRepository.findByRequestId("r1").size());
    }
}

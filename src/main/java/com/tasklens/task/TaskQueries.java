package com.tasklens.task;

import java.util.List;

/**
 * Offset-based task listing. Spring Data pages are page-number based, so the
 * {@code skip}/{@code limit} window is queried directly.
 */
public interface TaskQueries {

    /**
     * The owner's tasks, newest first, optionally restricted to one status.
     */
    List<Task> findOwnedTasks(Long userId, TaskStatus status, int skip, int limit);
}

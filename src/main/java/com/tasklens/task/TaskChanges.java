package com.tasklens.task;

/**
 * Partial task update. Null fields are left unchanged.
 */
public record TaskChanges(String title, String description, TaskStatus status, TaskPriority priority) {
}

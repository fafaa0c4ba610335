package com.tasklens.task;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import java.util.List;

class TaskQueriesImpl implements TaskQueries {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Task> findOwnedTasks(Long userId, TaskStatus status, int skip, int limit) {
        String jpql = "select t from Task t where t.userId = :userId"
                + (status != null ? " and t.status = :status" : "")
                + " order by t.createdAt desc, t.id desc";
        TypedQuery<Task> query = entityManager.createQuery(jpql, Task.class)
                .setParameter("userId", userId);
        if (status != null) {
            query.setParameter("status", status);
        }
        return query.setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }
}

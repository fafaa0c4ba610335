package com.tasklens.task;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long>, TaskQueries {

    Optional<Task> findByIdAndUserId(Long id, Long userId);

    long countByUserId(Long userId);
}

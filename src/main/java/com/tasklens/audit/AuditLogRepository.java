package com.tasklens.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    Page<AuditLog> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    List<AuditLog> findByAction(String action);

    List<AuditLog> findByRequestId(String requestId);
}

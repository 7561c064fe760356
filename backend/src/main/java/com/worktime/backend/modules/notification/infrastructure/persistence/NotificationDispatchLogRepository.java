package com.worktime.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.worktime.backend.modules.notification.domain.NotificationDispatchLog;

public interface NotificationDispatchLogRepository extends JpaRepository<NotificationDispatchLog, Long> {

    List<NotificationDispatchLog> findBySubjectIdOrderByIdAsc(UUID subjectId);
}

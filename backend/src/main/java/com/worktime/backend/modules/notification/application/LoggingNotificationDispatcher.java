package com.worktime.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

import com.worktime.backend.global.config.WorktimeProperties;
import com.worktime.backend.modules.notification.domain.NotificationDispatchLog;
import com.worktime.backend.modules.notification.domain.NotificationDispatchStatus;
import com.worktime.backend.modules.notification.domain.NotificationEvent;
import com.worktime.backend.modules.notification.domain.NotificationPayload;
import com.worktime.backend.modules.notification.domain.NotificationPayload.EmployeeSnapshot;
import com.worktime.backend.modules.notification.infrastructure.persistence.NotificationDispatchLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Default dispatcher: resolves recipients, applies the notification switches and records the outcome in
 * {@code notification_dispatch_log}. Mail delivery reads from that log and is not part of this service.
 */
@Service
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    static final String SKIP_DISABLED = "NOTIFICATIONS_DISABLED";
    static final String SKIP_CATEGORY_DISABLED = "CATEGORY_DISABLED";
    static final String SKIP_NO_RECIPIENT = "NO_RECIPIENT";

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    private final NotificationDispatchLogRepository dispatchLogRepository;
    private final WorktimeProperties.Notification settings;
    private final Clock clock;

    public LoggingNotificationDispatcher(
            NotificationDispatchLogRepository dispatchLogRepository,
            WorktimeProperties properties,
            Clock clock
    ) {
        this.dispatchLogRepository = dispatchLogRepository;
        this.settings = properties.notification();
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void dispatch(NotificationEvent event, NotificationPayload payload) {
        NotificationDispatchLog entry = new NotificationDispatchLog();
        entry.setEventType(event.tag());
        entry.setEmployeeId(payload.employee() != null ? payload.employee().id() : null);
        entry.setSubjectId(payload.subjectId());
        entry.setLoggedAt(OffsetDateTime.now(clock));

        Set<String> recipients = resolveRecipients(event, payload);
        String skipReason = resolveSkipReason(event, recipients);
        if (skipReason != null) {
            entry.setStatus(NotificationDispatchStatus.SKIPPED);
            entry.setSkipReason(skipReason);
            log.info("Notification {} for {} skipped: {}", event.tag(), payload.subjectId(), skipReason);
        } else {
            entry.setStatus(NotificationDispatchStatus.QUEUED);
            entry.setRecipients(String.join(",", recipients));
            log.info("Notification {} for {} queued to {}", event.tag(), payload.subjectId(), recipients);
        }
        dispatchLogRepository.save(entry);
    }

    private String resolveSkipReason(NotificationEvent event, Set<String> recipients) {
        if (!settings.enabled()) {
            return SKIP_DISABLED;
        }
        boolean categoryEnabled = switch (event.category()) {
            case TIME_ENTRY -> settings.categories().timeEntry();
            case LEAVE_REQUEST -> settings.categories().leaveRequest();
        };
        if (!categoryEnabled) {
            return SKIP_CATEGORY_DISABLED;
        }
        return recipients.isEmpty() ? SKIP_NO_RECIPIENT : null;
    }

    /**
     * New submissions go to the manager for review; decisions go back to the employee, and an approved
     * leave also informs the substitute.
     */
    static Set<String> resolveRecipients(NotificationEvent event, NotificationPayload payload) {
        Set<String> recipients = new LinkedHashSet<>();
        switch (event) {
            case TIME_ENTRY_CREATED -> addEmail(recipients, payload.manager());
            case LEAVE_REQUEST_CREATED -> {
                if (payload.manager() != null) {
                    addEmail(recipients, payload.manager());
                    addEmail(recipients, payload.employee());
                }
            }
            case LEAVE_REQUEST_APPROVED -> {
                addEmail(recipients, payload.employee());
                addEmail(recipients, payload.substitute());
            }
            case TIME_ENTRY_APPROVED, LEAVE_REQUEST_DENIED -> addEmail(recipients, payload.employee());
            case LEAVE_REQUEST_CANCELLED -> {
                addEmail(recipients, payload.employee());
                addEmail(recipients, payload.manager());
            }
        }
        return recipients;
    }

    private static void addEmail(Set<String> recipients, EmployeeSnapshot snapshot) {
        if (snapshot != null && snapshot.email() != null && !snapshot.email().isBlank()) {
            recipients.add(snapshot.email());
        }
    }
}

package com.worktime.backend.modules.notification.application;

import com.worktime.backend.modules.notification.domain.NotificationEvent;
import com.worktime.backend.modules.notification.domain.NotificationPayload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Best-effort front of the dispatcher: a failing dispatch is logged and never reaches the caller, so the
 * state transition that triggered it still commits.
 */
@Component
public class NotificationHooks {

    private static final Logger log = LoggerFactory.getLogger(NotificationHooks.class);

    private final NotificationDispatcher dispatcher;

    public NotificationHooks(NotificationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public void fire(NotificationEvent event, NotificationPayload payload) {
        try {
            dispatcher.dispatch(event, payload);
        } catch (RuntimeException ex) {
            log.warn("Dispatch of {} for subject {} failed: {}", event.tag(), payload.subjectId(), ex.getMessage(), ex);
        }
    }
}

package com.worktime.backend.modules.notification.application;

import com.worktime.backend.modules.notification.domain.NotificationEvent;
import com.worktime.backend.modules.notification.domain.NotificationPayload;

/**
 * Delivery side of the hook events. Invoked synchronously when a transition happens; implementations may
 * hand off to asynchronous delivery and are allowed to fail.
 */
public interface NotificationDispatcher {

    void dispatch(NotificationEvent event, NotificationPayload payload);
}

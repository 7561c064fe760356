package com.worktime.backend.modules.notification.domain;

public enum NotificationDispatchStatus {
    QUEUED,
    SKIPPED
}

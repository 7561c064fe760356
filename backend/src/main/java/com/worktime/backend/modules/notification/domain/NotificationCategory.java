package com.worktime.backend.modules.notification.domain;

public enum NotificationCategory {
    TIME_ENTRY,
    LEAVE_REQUEST
}

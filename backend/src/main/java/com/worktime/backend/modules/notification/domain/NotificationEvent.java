package com.worktime.backend.modules.notification.domain;

/**
 * The complete set of hook events. Adding a side effect means adding a constant here.
 */
public enum NotificationEvent {
    TIME_ENTRY_CREATED("timeEntryCreated", NotificationCategory.TIME_ENTRY),
    TIME_ENTRY_APPROVED("timeEntryApproved", NotificationCategory.TIME_ENTRY),
    LEAVE_REQUEST_CREATED("leaveRequestCreated", NotificationCategory.LEAVE_REQUEST),
    LEAVE_REQUEST_APPROVED("leaveRequestApproved", NotificationCategory.LEAVE_REQUEST),
    LEAVE_REQUEST_DENIED("leaveRequestDenied", NotificationCategory.LEAVE_REQUEST),
    LEAVE_REQUEST_CANCELLED("leaveRequestCancelled", NotificationCategory.LEAVE_REQUEST);

    private final String tag;
    private final NotificationCategory category;

    NotificationEvent(String tag, NotificationCategory category) {
        this.tag = tag;
        this.category = category;
    }

    public String tag() {
        return tag;
    }

    public NotificationCategory category() {
        return category;
    }
}

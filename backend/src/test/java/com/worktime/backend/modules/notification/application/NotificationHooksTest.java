package com.worktime.backend.modules.notification.application;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.worktime.backend.modules.employee.domain.Employee;
import com.worktime.backend.modules.notification.domain.NotificationEvent;
import com.worktime.backend.modules.notification.domain.NotificationPayload;
import com.worktime.backend.support.TestEntities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationHooksTest {

    @Mock
    private NotificationDispatcher dispatcher;

    @Test
    void dispatcherFailureIsLoggedNotThrown() {
        Employee employee = TestEntities.employee("00000000-0000-0000-0000-000000000202", "Noah");
        NotificationPayload payload = NotificationPayload.forTimeEntry(employee, employee, null);
        doThrow(new IllegalStateException("mail relay down")).when(dispatcher).dispatch(any(), any());

        NotificationHooks hooks = new NotificationHooks(dispatcher);

        assertThatCode(() -> hooks.fire(NotificationEvent.TIME_ENTRY_CREATED, payload)).doesNotThrowAnyException();
        verify(dispatcher).dispatch(NotificationEvent.TIME_ENTRY_CREATED, payload);
    }
}

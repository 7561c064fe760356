package com.worktime.backend.modules.leave.domain;

import com.worktime.backend.modules.employee.domain.Employee;

/**
 * What the acting employee may do to a request. Administrators decide on any request, their own included;
 * managers only on their reports' requests.
 */
public record LeaveActor(boolean requester, boolean approver) {

    public static LeaveActor of(Employee actor, Employee requester) {
        boolean self = actor.getId() != null && actor.getId().equals(requester.getId());
        boolean approver = actor.isActive()
                && (actor.isAdministrator() || (!self && actor.canApproveFor(requester)));
        return new LeaveActor(self, approver);
    }
}

package com.worktime.backend.modules.leave.domain;

import java.util.Objects;

import com.worktime.backend.global.common.time.DateRange;
import com.worktime.backend.global.error.InvalidInputException;
import com.worktime.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Leave request state machine.
 *
 * <pre>
 * PENDING  --approve--> APPROVED   balance -= days, days stored as chargedDays
 * PENDING  --reject---> REJECTED
 * PENDING  --cancel---> CANCELLED
 * APPROVED --cancel---> CANCELLED  balance += chargedDays
 * </pre>
 *
 * Every other combination is an {@link InvalidTransitionException}. Missing authority is a 403, not a
 * workflow error. The lifecycle only decides; persisting the decision is the caller's job.
 */
public final class LeaveLifecycle {

    public static final String AUTHORITY_REQUIRED = "APPROVAL_AUTHORITY_REQUIRED";

    private final LeaveDayCounter dayCounter;

    public LeaveLifecycle(LeaveDayCounter dayCounter) {
        this.dayCounter = Objects.requireNonNull(dayCounter, "dayCounter");
    }

    public LeaveDecision approve(LeaveStatus current, DateRange period, int balance, LeaveActor actor) {
        requireStatus(current, LeaveStatus.PENDING, LeaveTransition.APPROVE);
        requireApprover(actor);
        int days = dayCounter.count(period);
        if (days > balance) {
            throw new InsufficientBalanceException(days, balance);
        }
        return new LeaveDecision(LeaveStatus.APPROVED, -days, days);
    }

    public LeaveDecision reject(LeaveStatus current, LeaveActor actor, String reason) {
        requireStatus(current, LeaveStatus.PENDING, LeaveTransition.REJECT);
        requireApprover(actor);
        if (reason == null) {
            throw new InvalidInputException("reason", "a rejection needs a reason (it may be empty)");
        }
        return new LeaveDecision(LeaveStatus.REJECTED, 0, 0);
    }

    public LeaveDecision cancel(LeaveStatus current, int chargedDays, LeaveActor actor) {
        if (current != LeaveStatus.PENDING && current != LeaveStatus.APPROVED) {
            throw new InvalidTransitionException(current, LeaveTransition.CANCEL,
                    "a " + current + " request cannot be cancelled");
        }
        if (!actor.requester() && !actor.approver()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, AUTHORITY_REQUIRED,
                    "only the requester or an approver may cancel");
        }
        if (current == LeaveStatus.PENDING) {
            return new LeaveDecision(LeaveStatus.CANCELLED, 0, 0);
        }
        return new LeaveDecision(LeaveStatus.CANCELLED, chargedDays, 0);
    }

    private static void requireStatus(LeaveStatus current, LeaveStatus expected, LeaveTransition transition) {
        if (current != expected) {
            throw new InvalidTransitionException(current, transition,
                    transition + " is only allowed from " + expected + ", request is " + current);
        }
    }

    private static void requireApprover(LeaveActor actor) {
        if (!actor.approver()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, AUTHORITY_REQUIRED,
                    "only the employee's manager or an administrator may decide");
        }
    }
}

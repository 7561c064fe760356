package com.worktime.backend.modules.leave.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.worktime.backend.modules.leave.domain.LeaveRequest;
import com.worktime.backend.modules.leave.domain.LeaveStatus;

public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, UUID> {

    @Query("select r.employee.id from LeaveRequest r where r.id = :requestId")
    Optional<UUID> findEmployeeIdById(@Param("requestId") UUID requestId);

    @Query("""
            select r from LeaveRequest r
             where r.employee.id = :employeeId
               and r.status in :statuses
               and r.startDate <= :to
               and r.endDate >= :from
             order by r.startDate asc
            """)
    List<LeaveRequest> findOverlapping(
            @Param("employeeId") UUID employeeId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to,
            @Param("statuses") Collection<LeaveStatus> statuses
    );

    List<LeaveRequest> findByEmployee_IdOrderByStartDateAsc(UUID employeeId);

    List<LeaveRequest> findByEmployee_IdAndStatusOrderByStartDateAsc(UUID employeeId, LeaveStatus status);

    List<LeaveRequest> findByStatusOrderByStartDateAsc(LeaveStatus status);

    List<LeaveRequest> findAllByOrderByStartDateAsc();
}

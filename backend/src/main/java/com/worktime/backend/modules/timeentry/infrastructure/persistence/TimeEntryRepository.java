package com.worktime.backend.modules.timeentry.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.worktime.backend.modules.timeentry.domain.TimeEntry;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, UUID> {

    @Query("select t.employee.id from TimeEntry t where t.id = :entryId")
    Optional<UUID> findEmployeeIdById(@Param("entryId") UUID entryId);

    @Query("""
            select t from TimeEntry t
             where t.employee.id = :employeeId
               and t.entryDate = :date
             order by t.startAt asc
            """)
    List<TimeEntry> findByEmployeeAndDate(@Param("employeeId") UUID employeeId, @Param("date") LocalDate date);

    @Query("""
            select t from TimeEntry t
             where t.employee.id = :employeeId
               and t.entryDate between :from and :to
             order by t.entryDate asc, t.startAt asc
            """)
    List<TimeEntry> findByEmployeeBetween(
            @Param("employeeId") UUID employeeId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to
    );
}

package com.worktime.backend.modules.employee.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.worktime.backend.modules.employee.domain.Employee;

public interface EmployeeRepository extends JpaRepository<Employee, UUID> {

    /**
     * Row lock that serializes every read-validate-write mutation for one employee.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Employee e where e.id = :id")
    Optional<Employee> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByEmailIgnoreCase(String email);

    Optional<Employee> findByEmailIgnoreCase(String email);

    List<Employee> findByActiveTrueOrderByDisplayNameAsc();

    List<Employee> findAllByOrderByDisplayNameAsc();
}

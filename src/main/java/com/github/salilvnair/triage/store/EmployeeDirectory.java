package com.github.salilvnair.triage.store;

import com.github.salilvnair.triage.model.EmployeeContext;

import java.util.Optional;

/**
 * Optional lookup of employee profiles. An unknown employee is not an error.
 */
@FunctionalInterface
public interface EmployeeDirectory {

    Optional<EmployeeContext> findByEmail(String email);

    static EmployeeDirectory none() {
        return email -> Optional.empty();
    }
}

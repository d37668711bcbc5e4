package com.github.salilvnair.triage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class EmployeeContext {
    String id;
    String email;
    String name;
    String role;
    String department;
    String location;
    @Singular
    List<String> tags;

    public EmployeeMetadata metadata() {
        return new EmployeeMetadata(id, name, role);
    }
}

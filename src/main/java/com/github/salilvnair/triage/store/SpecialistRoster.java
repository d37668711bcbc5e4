package com.github.salilvnair.triage.store;

import com.github.salilvnair.triage.model.Specialist;

import java.util.List;

@FunctionalInterface
public interface SpecialistRoster {
    List<Specialist> findAll();
}

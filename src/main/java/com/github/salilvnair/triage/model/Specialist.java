package com.github.salilvnair.triage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class Specialist {
    String id;
    String email;
    String name;
    @Singular
    List<String> specialties;
    @Singular
    List<String> locations;
    @Singular
    List<String> departments;
    @Singular
    List<String> tags;
    @Builder.Default
    SpecialistAvailability availability = SpecialistAvailability.none();
}

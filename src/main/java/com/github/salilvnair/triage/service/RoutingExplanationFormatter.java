package com.github.salilvnair.triage.service;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.model.EmployeeContext;
import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.Specialist;
import com.github.salilvnair.triage.model.SpecialistMatch;
import com.github.salilvnair.triage.util.TermText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Human readable account of why a run was routed the way it was. Debugging aid only.
 */
@Component
public class RoutingExplanationFormatter {

    public String explain(TriageRun run) {
        SpecialistMatch match = run.getSpecialistMatch();
        return explain(
                run.getExtractedInfo(),
                run.getEmployee(),
                match == null ? null : match.specialist(),
                match == null ? null : match.score()
        );
    }

    public String explain(ExtractedInfo info, EmployeeContext employee, Specialist specialist, Integer score) {
        List<String> parts = new ArrayList<>();

        parts.add("**Request Analysis:**");
        if (info != null) {
            addIfPresent(parts, "- Request Type: ", info.getRequestType());
            addIfPresent(parts, "- Location: ", info.getLocation());
            addIfPresent(parts, "- Department: ", info.getDepartment());
        }

        if (employee != null) {
            parts.add("\n**Employee Context:**");
            parts.add("- " + employee.getName() + " (" + employee.getEmail() + ")");
            parts.add("- Department: " + employee.getDepartment());
            parts.add("- Location: " + employee.getLocation());
            if (!employee.getTags().isEmpty()) {
                parts.add("- Tags: " + String.join(", ", employee.getTags()));
            }
        }

        if (specialist != null) {
            parts.add("\n**Matched Specialist:**");
            parts.add("- " + specialist.getName() + " (" + specialist.getEmail() + ")");
            if (score != null && score > 0) {
                parts.add("- Match Score: " + score + "/100");
            }
            if (!specialist.getSpecialties().isEmpty()) {
                parts.add("- Specialties: " + String.join(", ", specialist.getSpecialties()));
            }
            if (!specialist.getLocations().isEmpty()) {
                parts.add("- Locations: " + String.join(", ", specialist.getLocations()));
            }
        }

        return String.join("\n", parts);
    }

    private static void addIfPresent(List<String> parts, String label, String value) {
        if (TermText.hasText(value)) {
            parts.add(label + value);
        }
    }
}

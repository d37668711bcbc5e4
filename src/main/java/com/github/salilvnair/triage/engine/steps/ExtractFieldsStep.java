package com.github.salilvnair.triage.engine.steps;

import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.pipeline.StepResult;
import com.github.salilvnair.triage.engine.pipeline.TriageStep;
import com.github.salilvnair.triage.extraction.FieldExtractor;
import com.github.salilvnair.triage.model.EmployeeContext;
import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.TriageField;
import com.github.salilvnair.triage.model.TriageStage;
import com.github.salilvnair.triage.util.TermText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class ExtractFieldsStep implements TriageStep {

    private final FieldExtractor fieldExtractor;

    @Override
    public TriageStage stage() {
        return TriageStage.EXTRACTING;
    }

    @Override
    public StepResult execute(TriageRun run) {
        ExtractedInfo extracted = fieldExtractor.extract(run.getMessages());
        run.setExtractedInfo(fillFromEmployee(extracted, run.getEmployee()));
        return new StepResult.Continue();
    }

    /**
     * Department and location default to the employee profile; values the user stated win.
     */
    static ExtractedInfo fillFromEmployee(ExtractedInfo info, EmployeeContext employee) {
        if (employee == null) {
            return info;
        }
        ExtractedInfo filled = info;
        if (!filled.has(TriageField.DEPARTMENT) && TermText.hasText(employee.getDepartment())) {
            filled = filled.with(TriageField.DEPARTMENT, employee.getDepartment());
            log.debug("Department auto-filled from employee profile: {}", employee.getDepartment());
        }
        if (!filled.has(TriageField.LOCATION) && TermText.hasText(employee.getLocation())) {
            filled = filled.with(TriageField.LOCATION, employee.getLocation());
            log.debug("Location auto-filled from employee profile: {}", employee.getLocation());
        }
        return filled;
    }
}

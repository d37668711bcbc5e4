package com.github.salilvnair.triage.scoring;

import com.github.salilvnair.triage.model.EmployeeContext;
import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.Specialist;
import com.github.salilvnair.triage.model.SpecialistAvailability;
import com.github.salilvnair.triage.model.SpecialistMatch;
import com.github.salilvnair.triage.model.SpecialistScore;
import com.github.salilvnair.triage.util.TermText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Additive affinity score between a request and each specialist.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpecialistScorer {

    public static final int AVAILABILITY_WINDOW_DAYS = 7;
    public static final int MINIMUM_QUALIFYING_SCORE = 20;

    static final int AVAILABLE_BONUS = 25;
    static final int BUSY_PENALTY = -10;
    static final int POINTS_PER_SLOT = 2;
    static final int MAX_SLOT_BONUS = 15;
    static final int SPECIALTY_MATCH = 50;
    static final int LOCATION_MATCH = 30;
    static final int DEPARTMENT_MATCH = 20;
    static final int VIP_MATCH = 40;
    static final int SHARED_TAG = 10;
    static final int EMPLOYEE_LOCATION_MATCH = 15;
    static final int EMPLOYEE_DEPARTMENT_MATCH = 10;

    private static final String VIP_TAG = "vip";
    private static final String FALLBACK_REASON = "best available match";

    private final Clock clock;

    public int score(Specialist specialist, ExtractedInfo request, EmployeeContext employee) {
        return score(specialist, request, employee, today());
    }

    public int score(Specialist specialist, ExtractedInfo request, EmployeeContext employee, LocalDate today) {
        ExtractedInfo info = request == null ? ExtractedInfo.empty() : request;
        int score = 0;

        SpecialistAvailability availability = availabilityOf(specialist);
        int slots = availability.slotsWithin(today, AVAILABILITY_WINDOW_DAYS);
        if (slots > 0) {
            score += AVAILABLE_BONUS;
            score += Math.min(slots * POINTS_PER_SLOT, MAX_SLOT_BONUS);
        } else {
            score += BUSY_PENALTY;
        }

        if (matchingSpecialty(specialist, info.getRequestType()) != null) {
            score += SPECIALTY_MATCH;
        }
        if (TermText.containsFolded(specialist.getLocations(), info.getLocation())) {
            score += LOCATION_MATCH;
        }
        if (TermText.containsFolded(specialist.getDepartments(), info.getDepartment())) {
            score += DEPARTMENT_MATCH;
        }

        if (employee != null) {
            Set<String> employeeTags = TermText.foldAll(employee.getTags());
            Set<String> specialistTags = TermText.foldAll(specialist.getTags());
            if (employeeTags.contains(VIP_TAG) && specialistTags.contains(VIP_TAG)) {
                score += VIP_MATCH;
            }
            for (String tag : employeeTags) {
                if (!VIP_TAG.equals(tag) && specialistTags.contains(tag)) {
                    score += SHARED_TAG;
                }
            }
            if (TermText.containsFolded(specialist.getLocations(), employee.getLocation())) {
                score += EMPLOYEE_LOCATION_MATCH;
            }
            if (TermText.containsFolded(specialist.getDepartments(), employee.getDepartment())) {
                score += EMPLOYEE_DEPARTMENT_MATCH;
            }
        }
        return score;
    }

    /**
     * Highest score first; equal scores keep roster order. Specialists without an email cannot
     * be assigned and are left out.
     */
    public List<SpecialistScore> scoreAndRank(ExtractedInfo request,
                                              EmployeeContext employee,
                                              List<Specialist> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        LocalDate today = today();
        List<SpecialistScore> scored = new ArrayList<>();
        for (Specialist candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            if (!TermText.hasText(candidate.getEmail())) {
                log.debug("Skipping specialist {} without an email", candidate.getId());
                continue;
            }
            scored.add(new SpecialistScore(candidate, score(candidate, request, employee, today)));
        }
        scored.sort(Comparator.comparingInt(SpecialistScore::score).reversed());
        return List.copyOf(scored);
    }

    public Optional<SpecialistMatch> selectBest(ExtractedInfo request,
                                                EmployeeContext employee,
                                                List<Specialist> candidates) {
        return selectFromRanked(request, employee, scoreAndRank(request, employee, candidates));
    }

    /**
     * Routing never proceeds without a request type, and only a score of at least
     * {@value #MINIMUM_QUALIFYING_SCORE} qualifies.
     */
    public Optional<SpecialistMatch> selectFromRanked(ExtractedInfo request,
                                                      EmployeeContext employee,
                                                      List<SpecialistScore> ranked) {
        if (request == null || !TermText.hasText(request.getRequestType())) {
            log.debug("No request type extracted yet, cannot route to a specialist");
            return Optional.empty();
        }
        if (ranked == null || ranked.isEmpty()) {
            log.debug("No specialists in roster");
            return Optional.empty();
        }
        SpecialistScore best = ranked.get(0);
        if (best.score() < MINIMUM_QUALIFYING_SCORE) {
            log.debug("No qualifying specialist, best score: {}", best.score());
            return Optional.empty();
        }
        String reason = buildReason(best.specialist(), request, employee, today());
        log.info("Matched specialist {} (score: {}) - {}", best.specialist().getEmail(), best.score(), reason);
        return Optional.of(new SpecialistMatch(best.specialist(), best.score(), reason));
    }

    String buildReason(Specialist specialist, ExtractedInfo request, EmployeeContext employee, LocalDate today) {
        List<String> reasons = new ArrayList<>();

        int slots = availabilityOf(specialist).slotsWithin(today, AVAILABILITY_WINDOW_DAYS);
        if (slots > 0) {
            reasons.add("available soon (" + slots + " slots in next " + AVAILABILITY_WINDOW_DAYS + " days)");
        }
        String specialty = matchingSpecialty(specialist, request.getRequestType());
        if (specialty != null) {
            reasons.add("specializes in " + specialty);
        }
        if (TermText.containsFolded(specialist.getLocations(), request.getLocation())) {
            reasons.add("handles " + request.getLocation() + " region");
        }
        if (TermText.containsFolded(specialist.getDepartments(), request.getDepartment())) {
            reasons.add("works with " + request.getDepartment() + " department");
        }
        if (employee != null
                && TermText.foldAll(employee.getTags()).contains(VIP_TAG)
                && TermText.foldAll(specialist.getTags()).contains(VIP_TAG)) {
            reasons.add("handles VIP clients");
        }
        return reasons.isEmpty() ? FALLBACK_REASON : String.join(", ", reasons);
    }

    /**
     * Bidirectional substring check: "Sales Contract" matches a specialty named "Contract"
     * and a specialty named "Contract Review" matches a request of "Contract".
     */
    static String matchingSpecialty(Specialist specialist, String requestType) {
        if (!TermText.hasText(requestType) || specialist.getSpecialties() == null) {
            return null;
        }
        String request = TermText.fold(requestType);
        for (String specialty : specialist.getSpecialties()) {
            if (!TermText.hasText(specialty)) {
                continue;
            }
            String folded = TermText.fold(specialty);
            if (folded.contains(request) || request.contains(folded)) {
                return specialty;
            }
        }
        return null;
    }

    private static SpecialistAvailability availabilityOf(Specialist specialist) {
        SpecialistAvailability availability = specialist.getAvailability();
        return availability == null ? SpecialistAvailability.none() : availability;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}

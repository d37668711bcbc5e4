package com.github.salilvnair.triage.model;

import java.util.List;

public record LegalTerm(
        String canonicalTerm,
        TermCategory category,
        List<String> synonyms
) {

    public LegalTerm {
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }
}

package com.github.salilvnair.triage.store;

import com.github.salilvnair.triage.model.LegalTerm;

import java.util.List;

@FunctionalInterface
public interface LegalTermStore {
    List<LegalTerm> findAll();
}

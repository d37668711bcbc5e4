package com.github.salilvnair.triage.store.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.salilvnair.triage.model.LegalTerm;
import com.github.salilvnair.triage.store.LegalTermStore;
import com.github.salilvnair.triage.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Synonym table seeded from a JSON resource, read once at startup.
 */
@Slf4j
public class ClasspathLegalTermStore implements LegalTermStore {

    private static final TypeReference<List<LegalTerm>> TERM_LIST = new TypeReference<>() {};

    private final List<LegalTerm> terms;

    public ClasspathLegalTermStore(ResourceLoader resourceLoader, String location) {
        this.terms = load(resourceLoader.getResource(location), location);
        log.info("Loaded {} legal terms from {}", terms.size(), location);
    }

    @Override
    public List<LegalTerm> findAll() {
        return terms;
    }

    private static List<LegalTerm> load(Resource resource, String location) {
        if (!resource.exists()) {
            throw new IllegalStateException("Legal term library not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            List<LegalTerm> loaded = JsonUtil.mapper().readValue(in, TERM_LIST);
            return loaded == null ? List.of() : List.copyOf(loaded);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read legal term library: " + location, e);
        }
    }
}

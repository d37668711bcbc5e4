package com.github.salilvnair.triage.store.provider;

import com.github.salilvnair.triage.model.LegalTerm;
import com.github.salilvnair.triage.model.TermCategory;
import com.github.salilvnair.triage.support.TriageFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClasspathLegalTermStoreTest {

    @Test
    void seedLibraryCoversAllCategories() {
        List<LegalTerm> terms = new ClasspathLegalTermStore(
                new DefaultResourceLoader(), TriageFixtures.SEED_TERMS_LOCATION).findAll();

        assertEquals(11, terms.size());
        assertEquals(5, terms.stream().filter(t -> t.category() == TermCategory.REQUEST_TYPE).count());
        assertEquals(3, terms.stream().filter(t -> t.category() == TermCategory.LOCATION).count());
        assertEquals(3, terms.stream().filter(t -> t.category() == TermCategory.DEPARTMENT).count());
        LegalTerm nda = terms.stream().filter(t -> t.canonicalTerm().equals("NDA")).findFirst().orElseThrow();
        assertTrue(nda.synonyms().contains("confidentiality agreement"));
    }

    @Test
    void missingLibraryFailsFast() {
        assertThrows(IllegalStateException.class,
                () -> new ClasspathLegalTermStore(new DefaultResourceLoader(), "classpath:triage/missing.json"));
    }
}

package com.github.salilvnair.triage.config;

import com.github.salilvnair.triage.document.DocumentAnswerService;
import com.github.salilvnair.triage.engine.core.TriageEngine;
import com.github.salilvnair.triage.engine.hook.TriageTraceRecorder;
import com.github.salilvnair.triage.engine.pipeline.TriagePipelineFactory;
import com.github.salilvnair.triage.llm.core.CompletionClient;
import com.github.salilvnair.triage.model.TriageRule;
import com.github.salilvnair.triage.service.TriageService;
import com.github.salilvnair.triage.store.LegalTermStore;
import com.github.salilvnair.triage.store.TriageRuleStore;
import com.github.salilvnair.triage.support.TriageFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;

class TriageEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TriageEngineAutoConfiguration.class))
            .withBean(CompletionClient.class, () -> mock(CompletionClient.class))
            .withBean(DocumentAnswerService.class, () -> mock(DocumentAnswerService.class));

    @Test
    void registersEngineWithDefaultStores() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(TriageEngine.class));
            assertNotNull(context.getBean(TriageService.class));
            assertEquals(6, context.getBean(TriagePipelineFactory.class).create().steps().size());
            assertEquals(11, context.getBean(LegalTermStore.class).findAll().size());
            assertEquals(0, context.getBean(TriageTraceRecorder.class).size());
        });
    }

    @Test
    void hostStoresReplaceDefaults() {
        List<TriageRule> rules = List.of(TriageFixtures.salesAustraliaRule());
        contextRunner
                .withBean(TriageRuleStore.class, () -> () -> rules)
                .withPropertyValues("triage.engine.trace.capacity=5")
                .run(context -> {
                    assertEquals(rules, context.getBean(TriageRuleStore.class).findAll());
                    assertEquals(5, context.getBean(TriageEngineProperties.class).getTrace().getCapacity());
                });
    }
}

package com.github.salilvnair.triage.config;

import com.github.salilvnair.triage.store.EmployeeDirectory;
import com.github.salilvnair.triage.store.LegalTermStore;
import com.github.salilvnair.triage.store.SpecialistRoster;
import com.github.salilvnair.triage.store.TriageRuleStore;
import com.github.salilvnair.triage.store.provider.ClasspathLegalTermStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;

/**
 * Registers the engine components. Hosts must provide a
 * {@link com.github.salilvnair.triage.llm.core.CompletionClient} and a
 * {@link com.github.salilvnair.triage.document.DocumentAnswerService}; every store has a default.
 */
@AutoConfiguration
@ComponentScan(basePackages = "com.github.salilvnair.triage")
@EnableConfigurationProperties(TriageEngineProperties.class)
public class TriageEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock triageClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public TriageRuleStore triageRuleStore() {
        return List::of;
    }

    @Bean
    @ConditionalOnMissingBean
    public SpecialistRoster specialistRoster() {
        return List::of;
    }

    @Bean
    @ConditionalOnMissingBean
    public LegalTermStore legalTermStore(ResourceLoader resourceLoader, TriageEngineProperties properties) {
        return new ClasspathLegalTermStore(resourceLoader, properties.getLegalTerms().getLocation());
    }

    @Bean
    @ConditionalOnMissingBean
    public EmployeeDirectory employeeDirectory() {
        return EmployeeDirectory.none();
    }

    @Bean(name = "triageTaskExecutor")
    @ConditionalOnMissingBean(name = "triageTaskExecutor")
    public ThreadPoolTaskExecutor triageTaskExecutor(TriageEngineProperties properties) {
        int poolSize = Math.max(1, properties.getExecution().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("triage-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}

package com.github.salilvnair.triage.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "triage.engine")
@Getter
@Setter
public class TriageEngineProperties {

    private Normalizer normalizer = new Normalizer();
    private Classification classification = new Classification();
    private Extraction extraction = new Extraction();
    private Document document = new Document();
    private Execution execution = new Execution();
    private Trace trace = new Trace();
    private LegalTerms legalTerms = new LegalTerms();

    @Getter
    @Setter
    public static class Normalizer {
        private double threshold = 0.7d;
    }

    @Getter
    @Setter
    public static class Classification {
        private boolean completionFallbackEnabled = true;
        private int maxTokens = 10;
    }

    @Getter
    @Setter
    public static class Extraction {
        private int maxTokens = 200;
    }

    @Getter
    @Setter
    public static class Document {
        private int topK = 3;
    }

    @Getter
    @Setter
    public static class Execution {
        private Duration timeout = Duration.ofSeconds(30);
        private int poolSize = 4;
    }

    @Getter
    @Setter
    public static class Trace {
        private int capacity = 100;
    }

    @Getter
    @Setter
    public static class LegalTerms {
        private String location = "classpath:triage/legal-terms.json";
    }
}

package com.github.salilvnair.triage.engine.steps;

import com.github.salilvnair.triage.config.TriageEngineProperties;
import com.github.salilvnair.triage.document.DocumentAnswerService;
import com.github.salilvnair.triage.document.DocumentSearchHit;
import com.github.salilvnair.triage.engine.core.TriageRun;
import com.github.salilvnair.triage.engine.pipeline.StepResult;
import com.github.salilvnair.triage.engine.pipeline.TriageStep;
import com.github.salilvnair.triage.intent.ConversationUtterances;
import com.github.salilvnair.triage.model.DocumentSource;
import com.github.salilvnair.triage.model.ExtractedInfo;
import com.github.salilvnair.triage.model.TriageDecision;
import com.github.salilvnair.triage.model.TriageStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Answers document questions directly; field extraction and routing are skipped.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class DocumentAnswerStep implements TriageStep {

    private final DocumentAnswerService documentAnswerService;
    private final TriageEngineProperties properties;

    @Override
    public TriageStage stage() {
        return TriageStage.DOCUMENT_PATH;
    }

    @Override
    public StepResult execute(TriageRun run) {
        if (!run.isDocumentQuestion()) {
            return new StepResult.Continue();
        }
        String question = ConversationUtterances.latestUserText(run.getMessages());
        List<DocumentSearchHit> hits = documentAnswerService.search(question, properties.getDocument().getTopK());
        if (hits == null) {
            hits = List.of();
        }
        String answer = documentAnswerService.answer(question, hits, run.getMessages(), run.getEmployee());
        List<DocumentSource> sources = hits.stream().map(DocumentSearchHit::toSource).toList();
        log.debug("Document question answered with {} source(s) traceId={}", sources.size(), run.getTraceId());

        ExtractedInfo info = ExtractedInfo.forDocumentQuestion();
        run.setExtractedInfo(info);
        return new StepResult.Stop(
                TriageDecision.documentAnswered(info, answer, sources, run.employeeMetadata())
        );
    }
}

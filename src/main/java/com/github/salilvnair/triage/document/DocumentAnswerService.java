package com.github.salilvnair.triage.document;

import com.github.salilvnair.triage.model.ConversationMessage;
import com.github.salilvnair.triage.model.EmployeeContext;

import java.util.List;

/**
 * Semantic search plus answer generation over the policy corpus. The engine only forwards
 * the question and the employee context; chunking and indexing live behind this seam.
 */
public interface DocumentAnswerService {

    List<DocumentSearchHit> search(String query, int topK);

    String answer(String query,
                  List<DocumentSearchHit> context,
                  List<ConversationMessage> conversation,
                  EmployeeContext employee);
}

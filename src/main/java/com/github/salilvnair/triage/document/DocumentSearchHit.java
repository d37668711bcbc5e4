package com.github.salilvnair.triage.document;

import com.github.salilvnair.triage.model.DocumentSource;

public record DocumentSearchHit(
        String title,
        String category,
        String content,
        double score
) {

    public DocumentSource toSource() {
        return new DocumentSource(title, category);
    }
}

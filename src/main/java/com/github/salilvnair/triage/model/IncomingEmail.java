package com.github.salilvnair.triage.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class IncomingEmail {
    String from;
    String to;
    String subject;
    String body;
    String html;
    OffsetDateTime receivedAt;
    String messageId;
}

package com.github.salilvnair.triage.service;

import com.github.salilvnair.triage.model.IncomingEmail;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.triage.support.TestConstants.EMPLOYEE_EMAIL;
import static com.github.salilvnair.triage.support.TestConstants.USER_TEXT_NDA_REQUEST;
import static org.junit.jupiter.api.Assertions.assertEquals;

class EmailMessageFormatterTest {

    private final EmailMessageFormatter formatter = new EmailMessageFormatter();

    @Test
    void formatPrefixesSubject() {
        IncomingEmail email = IncomingEmail.builder()
                .from(EMPLOYEE_EMAIL)
                .subject("Vendor NDA")
                .body(USER_TEXT_NDA_REQUEST)
                .build();

        assertEquals("Subject: Vendor NDA\n\n" + USER_TEXT_NDA_REQUEST, formatter.format(email));
    }

    @Test
    void formatSkipsReplySubject() {
        IncomingEmail email = IncomingEmail.builder()
                .from(EMPLOYEE_EMAIL)
                .subject("RE: Vendor NDA")
                .body(USER_TEXT_NDA_REQUEST)
                .build();

        assertEquals(USER_TEXT_NDA_REQUEST, formatter.format(email));
    }

    @Test
    void formatFallsBackToStrippedHtml() {
        IncomingEmail email = IncomingEmail.builder()
                .from(EMPLOYEE_EMAIL)
                .body("  ")
                .html("<html><style>p { color: red; }</style><body><p>I need an <b>NDA</b></p>"
                        + "<script>track()</script></body></html>")
                .build();

        assertEquals("I need an NDA", formatter.format(email));
    }
}

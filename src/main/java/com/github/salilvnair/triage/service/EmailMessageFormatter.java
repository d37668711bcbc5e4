package com.github.salilvnair.triage.service;

import com.github.salilvnair.triage.model.IncomingEmail;
import com.github.salilvnair.triage.util.TermText;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns an inbound email into the text of a single user message.
 */
@Component
public class EmailMessageFormatter {

    private static final Pattern STYLE_BLOCK = Pattern.compile("(?is)<style[^>]*>.*?</style>");
    private static final Pattern SCRIPT_BLOCK = Pattern.compile("(?is)<script[^>]*>.*?</script>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String format(IncomingEmail email) {
        String content = email.getBody();
        if (!TermText.hasText(content) && TermText.hasText(email.getHtml())) {
            content = stripHtml(email.getHtml());
        }
        if (content == null) {
            content = "";
        }
        String subject = email.getSubject();
        if (TermText.hasText(subject) && !subject.toLowerCase(Locale.ROOT).startsWith("re:")) {
            return "Subject: " + subject + "\n\n" + content;
        }
        return content;
    }

    static String stripHtml(String html) {
        String text = STYLE_BLOCK.matcher(html).replaceAll("");
        text = SCRIPT_BLOCK.matcher(text).replaceAll("");
        text = TAG.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}

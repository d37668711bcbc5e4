package com.github.salilvnair.triage.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.experimental.UtilityClass;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // greedy: first '{' to last '}' so nested objects stay intact
    private static final Pattern OBJECT_PATTERN = Pattern.compile("\\{[\\s\\S]*}");

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Create empty JSON object */
    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    /** Parse JSON string safely */
    public static JsonNode parseOrNull(String json) {
        if (json == null || json.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return MAPPER.readTree(json);
        } catch (Exception e) {
            return NullNode.getInstance();
        }
    }

    /**
     * Pulls the first JSON object out of free text (completion output often wraps it in prose
     * or code fences). Returns an empty object when nothing parses.
     */
    public static ObjectNode extractObject(String text) {
        if (text == null || text.isBlank()) {
            return object();
        }
        Matcher matcher = OBJECT_PATTERN.matcher(text);
        if (!matcher.find()) {
            return object();
        }
        JsonNode node = parseOrNull(matcher.group());
        return node instanceof ObjectNode objectNode ? objectNode : object();
    }
}

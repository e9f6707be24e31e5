package com.tribunal.records.util;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans caller input before it reaches the engines and masks values written to the log.
 * Values are never escaped here: the engines bind them as statement parameters.
 */
@Component
public class InputSanitizer {

    private static final int MAX_LOGGED_LENGTH = 1000;

    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x1F\\x7F]");

    private static final Pattern SENSITIVE_PAIR = Pattern.compile("(?i)(password|token|secret|key)=[^&\\s,\\]]+");

    /**
     * Trims a string and strips null bytes and control characters.
     * @param input the input string
     * @return the sanitized string, or the input itself when it has no text
     */
    public String sanitizeString(String input) {
        if (!StringUtils.hasText(input)) {
            return input;
        }
        return CONTROL_CHARACTERS.matcher(input.trim()).replaceAll("");
    }

    /**
     * Applies {@link #sanitizeString} to every string value of a request body.
     * Keys and non-string values are kept as they are.
     * @return a new map, or null if the body is null
     */
    public Map<String, Object> sanitizePayload(Map<String, Object> body) {
        if (body == null) {
            return null;
        }
        Map<String, Object> sanitized = new LinkedHashMap<>();
        body.forEach((key, value) ->
                sanitized.put(key, value instanceof String text ? sanitizeString(text) : value));
        return sanitized;
    }

    /**
     * Shortens a string for the log and masks credentials passed as key=value pairs.
     */
    public String sanitizeForLogging(String input) {
        if (!StringUtils.hasText(input)) {
            return input;
        }

        String sanitized = input;
        if (sanitized.length() > MAX_LOGGED_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOGGED_LENGTH) + "...";
        }
        return SENSITIVE_PAIR.matcher(sanitized).replaceAll("$1=***");
    }
}

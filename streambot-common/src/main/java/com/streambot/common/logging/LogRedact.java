package com.streambot.common.logging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials before they reach a log line: client secrets, access
 * tokens and single-use connection tickets.
 */
public final class LogRedact {

    private LogRedact() {
    }

    // -----------------------------------------------------------------------
    // Constants
    // -----------------------------------------------------------------------

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    private static final List<String> DEFAULT_PATTERN_SOURCES = List.of(
            // Query parameters (token URL, websocket endpoint, media upload)
            "[?&](?:ticket|access_token|appsecret)=([^&\\s\"]+)",
            // JSON fields
            "\"(?:clientSecret|accessToken|access_token|ticket)\"\\s*:\\s*\"([^\"]+)\"",
            // Auth headers
            "\\b(?:x-acs-dingtalk-)?access-token\\s*[:=]\\s*([A-Za-z0-9._\\-+=]+)",
            "Authorization\\s*[:=]\\s*Bearer\\s+([A-Za-z0-9._\\-+=]+)");

    private static final List<Pattern> DEFAULT_PATTERNS;
    static {
        List<Pattern> compiled = new ArrayList<>();
        for (String src : DEFAULT_PATTERN_SOURCES) {
            compiled.add(Pattern.compile(src, Pattern.CASE_INSENSITIVE));
        }
        DEFAULT_PATTERNS = Collections.unmodifiableList(compiled);
    }

    // -----------------------------------------------------------------------
    // Public API
    // -----------------------------------------------------------------------

    /**
     * Redact credentials in text using the default patterns.
     */
    public static String redact(String text) {
        return redact(text, DEFAULT_PATTERNS);
    }

    /**
     * Redact credentials in text using custom patterns. Only the last
     * non-empty capture group of each match is masked.
     */
    public static String redact(String text, List<Pattern> patterns) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : patterns) {
            result = redactWithPattern(result, pattern);
        }
        return result;
    }

    /**
     * Mask a single token, preserving start/end characters.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        String start = token.substring(0, KEEP_START);
        String end = token.substring(token.length() - KEEP_END);
        return start + "…" + end;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private static String redactWithPattern(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String fullMatch = matcher.group(0);
            String replacement = redactMatch(fullMatch, matcher);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String redactMatch(String fullMatch, Matcher matcher) {
        String token = fullMatch;
        for (int i = matcher.groupCount(); i >= 1; i--) {
            String group = matcher.group(i);
            if (group != null && !group.isEmpty()) {
                token = group;
                break;
            }
        }
        String masked = maskToken(token);
        if (token.equals(fullMatch)) {
            return masked;
        }
        return fullMatch.replace(token, masked);
    }
}

package com.agentforge.orchestrator.agent;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the terminal {@code <result>...</result>} block out of a model reply.
 *
 * Agents are told to end their answer with a JSON object inside that tag.
 * Anything before it is free-form reasoning and ignored. A fenced
 * {@code ```json} block inside the tag is unwrapped.
 */
public class ResponseParser {

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    private static final Pattern JSON_FENCE = Pattern.compile(
            "^```(?:json)?\\s*\\n(.*?)\\n```$",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /** Content of the first result tag, stripped, or empty if there is none. */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        if (!m.find()) return Optional.empty();

        String body = m.group(1).strip();
        Matcher fence = JSON_FENCE.matcher(body);
        return Optional.of(fence.matches() ? fence.group(1).strip() : body);
    }
}

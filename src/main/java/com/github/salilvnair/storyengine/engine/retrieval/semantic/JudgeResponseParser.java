package com.github.salilvnair.storyengine.engine.retrieval.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.retrieval.model.JudgeVerdict;
import com.github.salilvnair.storyengine.util.JsonUtil;
import lombok.experimental.UtilityClass;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a judge reply. Accepts {@code {"score": 7, "reasoning": "..."}} or free text that starts with
 * the score, e.g. {@code "7.5 - strong overlap with work stress"}.
 */
@UtilityClass
public final class JudgeResponseParser {

    public static final double MIN_SCORE = 0d;
    public static final double MAX_SCORE = 10d;

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(?:score\\s*[:=]\\s*)?(-?\\d+(?:\\.\\d+)?)(?:\\s*/\\s*10)?\\b(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public static JudgeVerdict parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw invalid("Judge returned an empty response");
        }
        String text = raw.trim();
        if (text.startsWith("{")) {
            JsonNode node = JsonUtil.parseOrNull(text);
            if (node == null || !node.isObject()) {
                throw invalid("Judge returned malformed JSON: " + abbreviate(text));
            }
            JsonNode score = node.path("score");
            if (!score.isNumber() && !(score.isTextual() && isNumeric(score.asText()))) {
                throw invalid("Judge JSON has no numeric score: " + abbreviate(text));
            }
            return new JudgeVerdict(clamp(score.asDouble()), node.path("reasoning").asText(""));
        }
        Matcher matcher = LEADING_NUMBER.matcher(text);
        if (!matcher.matches()) {
            throw invalid("Could not parse semantic score from response: " + abbreviate(text));
        }
        double score = Double.parseDouble(matcher.group(1));
        String reasoning = matcher.group(2).replaceFirst("^[\\s\\-:.,]+", "").trim();
        return new JudgeVerdict(clamp(score), reasoning);
    }

    public static double clamp(double score) {
        if (Double.isNaN(score) || Double.isInfinite(score)) {
            throw invalid("Judge score is not a finite number: " + score);
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    private static boolean isNumeric(String value) {
        try {
            Double.parseDouble(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }

    private static StoryEngineException invalid(String message) {
        return new StoryEngineException(StoryEngineErrorCode.JUDGE_INVALID_RESPONSE, message);
    }
}

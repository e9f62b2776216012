package com.github.salilvnair.storyengine.engine.retrieval.semantic;

import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.retrieval.model.ContextSummary;
import com.github.salilvnair.storyengine.engine.retrieval.model.JudgeVerdict;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;
import com.github.salilvnair.storyengine.engine.retrieval.model.StoryMetadata;
import com.github.salilvnair.storyengine.llm.core.LlmClient;
import com.github.salilvnair.storyengine.template.ThymeleafTemplateRenderer;
import com.github.salilvnair.storyengine.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default judge: asks the application's {@link LlmClient} to rate a story against the conversation.
 * Registered by the auto-configuration only when no other {@link SemanticJudge} bean exists.
 */
@Slf4j
public class LlmSemanticJudge implements SemanticJudge {

    private static final String NOT_AVAILABLE = "N/A";

    private final ObjectProvider<LlmClient> llmClientProvider;
    private final ThymeleafTemplateRenderer renderer;
    private final StoryEngineConfig config;

    public LlmSemanticJudge(ObjectProvider<LlmClient> llmClientProvider,
                            ThymeleafTemplateRenderer renderer,
                            StoryEngineConfig config) {
        this.llmClientProvider = llmClientProvider;
        this.renderer = renderer;
        this.config = config;
    }

    @Override
    public JudgeVerdict judge(ContextSummary context, Story story) {
        LlmClient llm = llmClientProvider.getIfAvailable();
        if (llm == null) {
            throw new StoryEngineException(StoryEngineErrorCode.JUDGE_UNAVAILABLE, "No LlmClient bean is configured");
        }
        Map<String, Object> variables = promptVariables(context, story);
        String systemPrompt = renderer.render(config.getSemantic().getSystemPrompt(), variables);
        String userPrompt = renderer.render(config.getSemantic().getUserPrompt(), variables);

        String output = llm.generateText(systemPrompt, userPrompt, JsonUtil.toJson(context));
        JudgeVerdict verdict = JudgeResponseParser.parse(output);
        log.debug("Story {} semantic score: {} - {}", story.getId(), verdict.score(), verdict.reasoning());
        return verdict;
    }

    Map<String, Object> promptVariables(ContextSummary context, Story story) {
        StoryEngineConfig.Semantic semantic = config.getSemantic();
        StoryMetadata metadata = story.getMetadata();
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("context", context.render());
        variables.put("content", truncate(story.getContent(), semantic.getMaxStoryChars()));
        variables.put("trigger", metadata == null ? NOT_AVAILABLE : orNa(metadata.getTriggerDescription()));
        variables.put("emotions", metadata == null ? "" : String.join(", ", metadata.emotionsOrEmpty()));
        variables.put("thought", metadata == null
                ? NOT_AVAILABLE
                : orNa(truncate(metadata.getInternalMonologue(), semantic.getMaxMonologueChars())));
        variables.put("violatedValue", metadata == null ? NOT_AVAILABLE : orNa(metadata.getViolatedValue()));
        return variables;
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() <= max ? value : value.substring(0, Math.max(0, max));
    }
}

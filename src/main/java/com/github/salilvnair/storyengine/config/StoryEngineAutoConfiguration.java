package com.github.salilvnair.storyengine.config;

import com.github.salilvnair.storyengine.engine.retrieval.semantic.LlmSemanticJudge;
import com.github.salilvnair.storyengine.engine.retrieval.semantic.SemanticJudge;
import com.github.salilvnair.storyengine.llm.core.LlmClient;
import com.github.salilvnair.storyengine.template.ThymeleafTemplateRenderer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@ComponentScan(basePackages = "com.github.salilvnair.storyengine")
@Import(StoryEngineAsyncConfiguration.class)
public class StoryEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(SemanticJudge.class)
    public SemanticJudge llmSemanticJudge(ObjectProvider<LlmClient> llmClientProvider,
                                          ThymeleafTemplateRenderer renderer,
                                          StoryEngineConfig config) {
        return new LlmSemanticJudge(llmClientProvider, renderer, config);
    }
}

package com.github.salilvnair.storyengine.annotation;

import com.github.salilvnair.storyengine.config.StoryEngineAutoConfiguration;
import org.springframework.context.annotation.Import;
import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(StoryEngineAutoConfiguration.class)
public @interface EnableStoryEngine {
}

package com.github.salilvnair.storyengine.engine.corpus;

import com.github.salilvnair.storyengine.engine.retrieval.model.Story;

import java.util.List;

/**
 * Read-only source of stories. Provided by the application.
 */
@FunctionalInterface
public interface StoryCorpus {
    List<Story> stories();
}

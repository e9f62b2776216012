package com.github.salilvnair.storyengine.analytics.model;

/**
 * @param repetitionRate share of tellings that repeated an already told story, 0 when nothing was told
 * @param averageGap     mean number of turns between consecutive tellings of the same story, 0 without repeats
 */
public record UsageStats(int totalTold, int uniqueTold, double repetitionRate, double averageGap) {
}

package com.github.salilvnair.storyengine.engine.retrieval.semantic;

import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.retrieval.model.ContextSummary;
import com.github.salilvnair.storyengine.engine.retrieval.model.JudgeVerdict;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.salilvnair.storyengine.support.StateFixtures.plainStory;
import static com.github.salilvnair.storyengine.support.TestConstants.BOOM;
import static com.github.salilvnair.storyengine.support.TestConstants.REASONING_FITS;
import static com.github.salilvnair.storyengine.support.TestConstants.STORY_A;
import static com.github.salilvnair.storyengine.support.TestConstants.STORY_B;
import static com.github.salilvnair.storyengine.support.TestConstants.STORY_C;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SemanticScorerTest {

    private static final ContextSummary CONTEXT =
            new ContextSummary("sid", 2, List.of("work stress"), "work stress", List.of(), List.of(), ContextSummary.MATURITY_NEW);

    @Mock
    private ObjectProvider<SemanticJudge> judgeProvider;

    private StoryEngineConfig config;
    private ExecutorService executor;
    private SemanticScorer scorer;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        config = new StoryEngineConfig();
        executor = Executors.newFixedThreadPool(2);
        scorer = new SemanticScorer(judgeProvider, executor, config);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void scoresEveryStoryAndClampsOutOfRangeValues() {
        when(judgeProvider.getIfAvailable()).thenReturn((context, story) ->
                STORY_A.equals(story.getId()) ? new JudgeVerdict(14d, REASONING_FITS) : new JudgeVerdict(-2d, ""));

        SemanticScores scores = scorer.scoreAll(CONTEXT, List.of(plainStory(STORY_A), plainStory(STORY_B)));

        assertTrue(scores.available());
        assertEquals(10d, scores.scoreOf(STORY_A));
        assertEquals(0d, scores.scoreOf(STORY_B));
        assertEquals(REASONING_FITS, scores.reasoningOf(STORY_A));
    }

    @Test
    void anyThrowingCallMakesTheStageUnavailable() {
        when(judgeProvider.getIfAvailable()).thenReturn((context, story) -> {
            if (STORY_B.equals(story.getId())) {
                throw new IllegalStateException(BOOM);
            }
            return new JudgeVerdict(7d, REASONING_FITS);
        });

        SemanticScores scores = scorer.scoreAll(CONTEXT, List.of(plainStory(STORY_A), plainStory(STORY_B)));

        assertFalse(scores.available());
        assertEquals(StoryEngineErrorCode.JUDGE_CALL_FAILED.name(), scores.failureCode());
        assertTrue(scores.verdicts().isEmpty());
    }

    @Test
    void invalidResponseKeepsItsCode() {
        when(judgeProvider.getIfAvailable()).thenReturn((context, story) -> JudgeResponseParser.parse("no idea"));

        SemanticScores scores = scorer.scoreAll(CONTEXT, List.of(plainStory(STORY_A)));

        assertEquals(StoryEngineErrorCode.JUDGE_INVALID_RESPONSE.name(), scores.failureCode());
    }

    @Test
    void slowJudgeTimesOut() {
        config.getSemantic().setTimeoutMs(100L);
        when(judgeProvider.getIfAvailable()).thenReturn((context, story) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new JudgeVerdict(9d, REASONING_FITS);
        });

        SemanticScores scores = scorer.scoreAll(CONTEXT, List.of(plainStory(STORY_A)));

        assertFalse(scores.available());
        assertEquals(StoryEngineErrorCode.JUDGE_TIMEOUT.name(), scores.failureCode());
    }

    @Test
    void hungCallIsInterruptedAndFreesTheWorkerForTheNextSelection() throws InterruptedException {
        config.getSemantic().setJudgeThreads(1);
        config.getSemantic().setTimeoutMs(200L);
        ExecutorService singleWorker = Executors.newFixedThreadPool(1);
        SemanticScorer singleWorkerScorer = new SemanticScorer(judgeProvider, singleWorker, config);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch interrupted = new CountDownLatch(1);
        when(judgeProvider.getIfAvailable()).thenReturn((context, story) -> {
            if (calls.incrementAndGet() == 1) {
                try {
                    Thread.sleep(10_000L);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(BOOM, e);
                }
            }
            return new JudgeVerdict(8d, REASONING_FITS);
        });
        try {
            SemanticScores first = singleWorkerScorer.scoreAll(CONTEXT, List.of(plainStory(STORY_A)));
            SemanticScores second = singleWorkerScorer.scoreAll(CONTEXT, List.of(plainStory(STORY_A)));

            assertEquals(StoryEngineErrorCode.JUDGE_TIMEOUT.name(), first.failureCode());
            assertTrue(interrupted.await(1, TimeUnit.SECONDS));
            assertTrue(second.available());
            assertEquals(8d, second.scoreOf(STORY_A));
            assertEquals(2, calls.get());
        } finally {
            singleWorker.shutdownNow();
        }
    }

    @Test
    void queuedCallsAreNotChargedForTimeSpentWaitingForAWorker() {
        config.getSemantic().setJudgeThreads(1);
        config.getSemantic().setTimeoutMs(400L);
        ExecutorService singleWorker = Executors.newFixedThreadPool(1);
        SemanticScorer singleWorkerScorer = new SemanticScorer(judgeProvider, singleWorker, config);
        AtomicBoolean cutShort = new AtomicBoolean();
        when(judgeProvider.getIfAvailable()).thenReturn((context, story) -> {
            try {
                Thread.sleep(150L);
            } catch (InterruptedException e) {
                cutShort.set(true);
                Thread.currentThread().interrupt();
            }
            return new JudgeVerdict(5d, REASONING_FITS);
        });
        try {
            // three sequential 150ms calls exceed one 400ms window but each fits its own
            SemanticScores scores = singleWorkerScorer.scoreAll(CONTEXT,
                    List.of(plainStory(STORY_A), plainStory(STORY_B), plainStory(STORY_C)));

            assertTrue(scores.available());
            assertEquals(3, scores.verdicts().size());
            assertFalse(cutShort.get());
        } finally {
            singleWorker.shutdownNow();
        }
    }

    @Test
    void disabledStageNeverAsksForAJudge() {
        config.getSemantic().setEnabled(false);

        SemanticScores scores = scorer.scoreAll(CONTEXT, List.of(plainStory(STORY_A)));

        assertFalse(scores.available());
        assertEquals(StoryEngineErrorCode.JUDGE_UNAVAILABLE.name(), scores.failureCode());
        verifyNoInteractions(judgeProvider);
    }

    @Test
    void missingJudgeIsUnavailable() {
        when(judgeProvider.getIfAvailable()).thenReturn(null);

        SemanticScores scores = scorer.scoreAll(CONTEXT, List.of(plainStory(STORY_A)));

        assertEquals(StoryEngineErrorCode.JUDGE_UNAVAILABLE.name(), scores.failureCode());
    }

    @Test
    void singleScoreThrowsRecoverableErrorOnFailure() {
        when(judgeProvider.getIfAvailable()).thenReturn((context, story) -> {
            throw new IllegalStateException(BOOM);
        });

        StoryEngineException ex = assertThrows(StoryEngineException.class, () -> scorer.score(CONTEXT, plainStory(STORY_A)));

        assertTrue(ex.is(StoryEngineErrorCode.JUDGE_CALL_FAILED));
        assertTrue(ex.isRecoverable());
    }

    @Test
    void singleScoreReturnsClampedValue() {
        when(judgeProvider.getIfAvailable()).thenReturn((context, story) -> new JudgeVerdict(6.5d, REASONING_FITS));

        assertEquals(6.5d, scorer.score(CONTEXT, plainStory(STORY_A)));
    }
}

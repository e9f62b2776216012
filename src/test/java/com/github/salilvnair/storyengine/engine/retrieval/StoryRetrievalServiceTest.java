package com.github.salilvnair.storyengine.engine.retrieval;

import com.github.salilvnair.storyengine.audit.AuditService;
import com.github.salilvnair.storyengine.audit.StoryEngineAuditStage;
import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.helper.ContextSummaryFactory;
import com.github.salilvnair.storyengine.engine.helper.TurnUpdateValidator;
import com.github.salilvnair.storyengine.engine.retrieval.filter.MetadataFilter;
import com.github.salilvnair.storyengine.engine.retrieval.model.JudgeVerdict;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionResult;
import com.github.salilvnair.storyengine.engine.retrieval.model.SelectionStatus;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;
import com.github.salilvnair.storyengine.engine.retrieval.rank.StoryRanker;
import com.github.salilvnair.storyengine.engine.retrieval.semantic.SemanticJudge;
import com.github.salilvnair.storyengine.engine.retrieval.semantic.SemanticScorer;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import com.github.salilvnair.storyengine.engine.state.provider.InMemoryConversationStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.github.salilvnair.storyengine.support.StateFixtures.plainStory;
import static com.github.salilvnair.storyengine.support.StateFixtures.workStressStory;
import static com.github.salilvnair.storyengine.support.TestConstants.CONCEPT_HONESTY;
import static com.github.salilvnair.storyengine.support.TestConstants.INTENT_SEEK_ADVICE;
import static com.github.salilvnair.storyengine.support.TestConstants.OTHER_SESSION_KEY;
import static com.github.salilvnair.storyengine.support.TestConstants.REASONING_FITS;
import static com.github.salilvnair.storyengine.support.TestConstants.SESSION_KEY;
import static com.github.salilvnair.storyengine.support.TestConstants.STORY_A;
import static com.github.salilvnair.storyengine.support.TestConstants.STORY_B;
import static com.github.salilvnair.storyengine.support.TestConstants.TOPIC_WORK_STRESS;
import static com.github.salilvnair.storyengine.support.TestConstants.UNKNOWN_SESSION_KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoryRetrievalServiceTest {

    private static final double DELTA = 1e-9;

    private final List<String> auditedStages = new CopyOnWriteArrayList<>();
    private final CountDownLatch release = new CountDownLatch(1);

    private StoryEngineConfig config;
    private ExecutorService executor;
    private InMemoryConversationStateStore store;
    private SemanticJudge judge;
    private StoryRetrievalService service;

    @BeforeEach
    void setUp() {
        config = new StoryEngineConfig();
        executor = Executors.newFixedThreadPool(2);
        AuditService audit = (stage, sessionKey, payloadJson) -> auditedStages.add(stage);
        store = new InMemoryConversationStateStore(config, new TurnUpdateValidator(config), audit);
        judge = (context, story) -> new JudgeVerdict(8d, REASONING_FITS);

        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        SemanticJudge delegating = (context, story) -> judge.judge(context, story);
        beans.addBean("semanticJudge", delegating);
        SemanticScorer scorer = new SemanticScorer(beans.getBeanProvider(SemanticJudge.class), executor, config);

        service = new StoryRetrievalService(store, new MetadataFilter(config), scorer,
                new StoryRanker(config), new ContextSummaryFactory(config), audit);

        store.updateTurn(SESSION_KEY, List.of(TOPIC_WORK_STRESS), List.of(INTENT_SEEK_ADVICE), List.of(CONCEPT_HONESTY));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void selectsBlendsAndRecordsUsage() {
        SelectionResult result = service.select(SESSION_KEY, candidates(), 3);

        assertEquals(SelectionStatus.SELECTED, result.status());
        assertEquals(List.of(STORY_A), result.storyIds());
        assertEquals(2, result.candidateCount());
        assertEquals(1, result.filteredCount());
        // 0.3 * 5.5 + 0.7 * 8 + 0.1 * 4
        assertEquals(7.65d, result.stories().get(0).finalScore(), DELTA);

        ConversationState state = store.getOrCreate(SESSION_KEY);
        assertEquals(1, state.getRetrievedStoryHistory().size());
        assertEquals(STORY_A, state.getRetrievedStoryHistory().get(0).getStoryId());
        assertEquals(1, state.getRetrievedStoryHistory().get(0).getToldAtTurn());
    }

    @Test
    void slowJudgeDegradesToMetadataOnly() {
        config.getSemantic().setTimeoutMs(100L);
        judge = (context, story) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new JudgeVerdict(10d, REASONING_FITS);
        };

        SelectionResult result = service.select(SESSION_KEY, candidates(), 3);

        assertTrue(result.degraded());
        assertEquals(List.of(STORY_A), result.storyIds());
        assertEquals(5.9d, result.stories().get(0).finalScore(), DELTA);
        assertTrue(auditedStages.contains(StoryEngineAuditStage.SEMANTIC_DEGRADED.value()));
        assertEquals(1, store.getOrCreate(SESSION_KEY).getRetrievedStoryHistory().size());
    }

    @Test
    void rankingIsDeterministic() {
        ConversationState snapshot = store.getOrCreate(SESSION_KEY);
        List<Story> pool = List.of(workStressStory(STORY_B, 4), workStressStory(STORY_A, 4));

        SelectionResult first = service.rank(snapshot, pool, 3);
        SelectionResult second = service.rank(snapshot, pool, 3);

        assertEquals(List.of(STORY_A, STORY_B), first.storyIds());
        assertEquals(first, second);
        assertTrue(store.getOrCreate(SESSION_KEY).getRetrievedStoryHistory().isEmpty());
    }

    @Test
    void nothingRelevantYieldsEmptyAndRecordsNothing() {
        judge = (context, story) -> new JudgeVerdict(0d, "unrelated");

        SelectionResult result = service.select(SESSION_KEY, List.of(plainStory(STORY_A), plainStory(STORY_B)), 3);

        assertEquals(SelectionStatus.EMPTY, result.status());
        assertTrue(result.isEmpty());
        assertTrue(store.getOrCreate(SESSION_KEY).getRetrievedStoryHistory().isEmpty());
    }

    @Test
    void nonPositiveLimitIsRejected() {
        StoryEngineException ex = assertThrows(StoryEngineException.class,
                () -> service.select(SESSION_KEY, candidates(), 0));

        assertTrue(ex.is(StoryEngineErrorCode.INVALID_SELECTION_REQUEST));
    }

    @Test
    void rejectedLimitDoesNotCreateASession() {
        StoryEngineException ex = assertThrows(StoryEngineException.class,
                () -> service.select(UNKNOWN_SESSION_KEY, candidates(), 0));

        assertTrue(ex.is(StoryEngineErrorCode.INVALID_SELECTION_REQUEST));
        assertTrue(store.find(UNKNOWN_SESSION_KEY).isEmpty());
    }

    @Test
    void hungJudgeCallDoesNotStarveTheNextSelection() throws InterruptedException {
        config.getSemantic().setTimeoutMs(200L);
        CountDownLatch interrupted = new CountDownLatch(1);
        judge = (context, story) -> {
            try {
                Thread.sleep(10_000L);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                throw new IllegalStateException("judge call abandoned", e);
            }
            return new JudgeVerdict(10d, REASONING_FITS);
        };

        SelectionResult stalled = service.select(SESSION_KEY, candidates(), 3);

        assertTrue(stalled.degraded());
        assertTrue(interrupted.await(1, TimeUnit.SECONDS));

        judge = (context, story) -> new JudgeVerdict(8d, REASONING_FITS);
        store.updateTurn(OTHER_SESSION_KEY, List.of(TOPIC_WORK_STRESS), List.of(INTENT_SEEK_ADVICE), List.of(CONCEPT_HONESTY));

        SelectionResult next = service.select(OTHER_SESSION_KEY, candidates(), 3);

        assertEquals(SelectionStatus.SELECTED, next.status());
        assertFalse(next.degraded());
        assertEquals(List.of(STORY_A), next.storyIds());
    }

    @Test
    void interruptedSelectionIsCancelledWithoutRecording() {
        try {
            Thread.currentThread().interrupt();

            StoryEngineException ex = assertThrows(StoryEngineException.class,
                    () -> service.select(SESSION_KEY, candidates(), 3));

            assertTrue(ex.is(StoryEngineErrorCode.SELECTION_CANCELLED));
        } finally {
            Thread.interrupted();
        }
        assertTrue(store.getOrCreate(SESSION_KEY).getRetrievedStoryHistory().isEmpty());
        assertTrue(auditedStages.contains(StoryEngineAuditStage.SELECTION_CANCELLED.value()));
    }

    @Test
    void sessionResetDuringSelectionIsNotWrittenBack() {
        judge = (context, story) -> {
            store.reset(SESSION_KEY);
            return new JudgeVerdict(8d, REASONING_FITS);
        };

        SelectionResult result = service.select(SESSION_KEY, candidates(), 3);

        assertEquals(SelectionStatus.SELECTED, result.status());
        ConversationState fresh = store.getOrCreate(SESSION_KEY);
        assertEquals(0, fresh.getTurnCount());
        assertTrue(fresh.getRetrievedStoryHistory().isEmpty());
    }

    @Test
    void duplicateCandidatesCountOnce() {
        SelectionResult result = service.select(SESSION_KEY,
                List.of(workStressStory(STORY_A, 4), workStressStory(STORY_A, 4)), 3);

        assertEquals(1, result.candidateCount());
        assertFalse(result.isEmpty());
    }

    private static List<Story> candidates() {
        return List.of(workStressStory(STORY_A, 4), plainStory(STORY_B));
    }
}

package com.github.salilvnair.storyengine.engine.retrieval.semantic;

import com.github.salilvnair.storyengine.config.StoryEngineAsyncConfiguration;
import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineErrorCode;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.retrieval.model.ContextSummary;
import com.github.salilvnair.storyengine.engine.retrieval.model.JudgeVerdict;
import com.github.salilvnair.storyengine.engine.retrieval.model.Story;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stage 2 adapter around the {@link SemanticJudge}. All candidates are judged concurrently on the
 * judge executor, each call under its own timeout; the first failure of any kind makes the whole
 * stage unavailable for the selection and interrupts the calls still running.
 */
@Slf4j
@Component
public class SemanticScorer {

    private static final long QUEUE_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final ObjectProvider<SemanticJudge> judgeProvider;
    private final ExecutorService executor;
    private final StoryEngineConfig config;

    public SemanticScorer(ObjectProvider<SemanticJudge> judgeProvider,
                          @Qualifier(StoryEngineAsyncConfiguration.JUDGE_EXECUTOR) ExecutorService executor,
                          StoryEngineConfig config) {
        this.judgeProvider = judgeProvider;
        this.executor = executor;
        this.config = config;
    }

    /**
     * Scores one story in [0, 10]. Throws a recoverable {@link StoryEngineException} on any judge
     * failure.
     */
    public double score(ContextSummary context, Story story) {
        SemanticScores scores = scoreAll(context, List.of(story));
        if (!scores.available()) {
            throw new StoryEngineException(StoryEngineErrorCode.valueOf(scores.failureCode()), scores.failureReason());
        }
        return scores.scoreOf(story.getId());
    }

    /**
     * Judges every candidate. Each call gets {@code timeoutMs} from the moment a worker picks it up;
     * a queued call may wait {@code timeoutMs} per wave of {@code judgeThreads} calls ahead of it.
     * Interruption of the calling thread cancels outstanding calls and is rethrown as
     * {@code SELECTION_CANCELLED}.
     */
    public SemanticScores scoreAll(ContextSummary context, List<Story> stories) {
        if (!config.getSemantic().isEnabled()) {
            return SemanticScores.unavailable(StoryEngineErrorCode.JUDGE_UNAVAILABLE.name(), "Semantic scoring disabled");
        }
        SemanticJudge judge = judgeProvider.getIfAvailable();
        if (judge == null) {
            return SemanticScores.unavailable(StoryEngineErrorCode.JUDGE_UNAVAILABLE.name(), "No SemanticJudge bean is configured");
        }
        if (stories.isEmpty()) {
            return SemanticScores.available(Map.of());
        }

        List<JudgeCall> calls = new ArrayList<>(stories.size());
        long submittedAt = System.nanoTime();
        Map<String, JudgeVerdict> verdicts = new LinkedHashMap<>();
        try {
            for (Story story : stories) {
                JudgeCall call = new JudgeCall(story.getId());
                // submit() so that cancel(true) interrupts a call that is already running
                call.future = executor.submit(() -> {
                    call.startedAt.set(System.nanoTime());
                    try {
                        return judge.judge(context, story);
                    } finally {
                        call.finished.countDown();
                    }
                });
                calls.add(call);
            }
            for (int i = 0; i < calls.size(); i++) {
                JudgeCall call = calls.get(i);
                JudgeVerdict verdict = await(call, i, submittedAt);
                if (verdict == null) {
                    throw new StoryEngineException(StoryEngineErrorCode.JUDGE_INVALID_RESPONSE,
                            "Judge returned no verdict for story " + call.storyId);
                }
                verdicts.put(call.storyId, new JudgeVerdict(JudgeResponseParser.clamp(verdict.score()), verdict.reasoning()));
            }
            return SemanticScores.available(verdicts);
        } catch (InterruptedException e) {
            cancelAll(calls);
            Thread.currentThread().interrupt();
            throw new StoryEngineException(StoryEngineErrorCode.SELECTION_CANCELLED, "Interrupted while waiting for the semantic judge", e);
        } catch (TimeoutException e) {
            cancelAll(calls);
            return degrade(StoryEngineErrorCode.JUDGE_TIMEOUT, e.getMessage());
        } catch (ExecutionException e) {
            cancelAll(calls);
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof StoryEngineException see && see.getErrorCode().startsWith("JUDGE_")) {
                return degrade(StoryEngineErrorCode.valueOf(see.getErrorCode()), see.getMessage());
            }
            return degrade(StoryEngineErrorCode.JUDGE_CALL_FAILED, String.valueOf(cause.getMessage()));
        } catch (RejectedExecutionException e) {
            cancelAll(calls);
            return degrade(StoryEngineErrorCode.JUDGE_UNAVAILABLE, "Judge executor rejected the call: " + e.getMessage());
        } catch (CancellationException e) {
            cancelAll(calls);
            return degrade(StoryEngineErrorCode.JUDGE_CALL_FAILED, "Judge call was cancelled");
        } catch (StoryEngineException e) {
            cancelAll(calls);
            return degrade(StoryEngineErrorCode.valueOf(e.getErrorCode()), e.getMessage());
        }
    }

    private JudgeVerdict await(JudgeCall call, int index, long submittedAt)
            throws InterruptedException, ExecutionException, TimeoutException {
        long timeout = TimeUnit.MILLISECONDS.toNanos(config.getSemantic().getTimeoutMs());
        int threads = Math.max(1, config.getSemantic().getJudgeThreads());
        long startBy = submittedAt + timeout * (index / threads + 1);
        while (true) {
            long started = call.startedAt.get();
            boolean running = started != JudgeCall.NOT_STARTED;
            long remaining = (running ? started + timeout : startBy) - System.nanoTime();
            if (remaining <= 0) {
                if (call.future.isDone()) {
                    return call.future.get();
                }
                throw new TimeoutException(running
                        ? "Semantic judge did not answer within " + config.getSemantic().getTimeoutMs() + "ms for story " + call.storyId
                        : "Semantic judge call for story " + call.storyId + " never left the queue");
            }
            // while queued, wake up regularly to notice the call starting
            long wait = running ? remaining : Math.min(remaining, QUEUE_POLL_NANOS);
            if (call.finished.await(wait, TimeUnit.NANOSECONDS)) {
                return call.future.get();
            }
        }
    }

    private SemanticScores degrade(StoryEngineErrorCode code, String reason) {
        log.warn("Semantic judge unavailable ({}), falling back to metadata-only scoring: {}", code, reason);
        return SemanticScores.unavailable(code.name(), reason);
    }

    private void cancelAll(List<JudgeCall> calls) {
        calls.forEach(call -> {
            if (call.future != null) {
                call.future.cancel(true);
            }
        });
    }

    private static final class JudgeCall {
        private static final long NOT_STARTED = Long.MIN_VALUE;

        private final String storyId;
        private final AtomicLong startedAt = new AtomicLong(NOT_STARTED);
        private final CountDownLatch finished = new CountDownLatch(1);
        private Future<JudgeVerdict> future;

        private JudgeCall(String storyId) {
            this.storyId = storyId;
        }
    }
}

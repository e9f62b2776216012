package com.github.salilvnair.storyengine.engine.state.provider;

import com.github.salilvnair.storyengine.audit.AuditService;
import com.github.salilvnair.storyengine.audit.StoryEngineAuditStage;
import com.github.salilvnair.storyengine.config.StoryEngineConfig;
import com.github.salilvnair.storyengine.engine.decay.ContextDecay;
import com.github.salilvnair.storyengine.engine.exception.StoryEngineException;
import com.github.salilvnair.storyengine.engine.helper.TurnUpdateValidator;
import com.github.salilvnair.storyengine.engine.state.ConversationStateStore;
import com.github.salilvnair.storyengine.engine.state.model.ConceptMention;
import com.github.salilvnair.storyengine.engine.state.model.ContextDecayConfig;
import com.github.salilvnair.storyengine.engine.state.model.ConversationFlow;
import com.github.salilvnair.storyengine.engine.state.model.ConversationState;
import com.github.salilvnair.storyengine.engine.state.model.StoryUsage;
import com.github.salilvnair.storyengine.engine.state.model.TurnUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

@Slf4j
@Component
public class InMemoryConversationStateStore implements ConversationStateStore {

    private final StoryEngineConfig config;
    private final TurnUpdateValidator validator;
    private final AuditService audit;
    private final Clock clock;
    private final Map<String, SessionSlot> slots = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryConversationStateStore(StoryEngineConfig config, TurnUpdateValidator validator, AuditService audit) {
        this(config, validator, audit, Clock.systemUTC());
    }

    public InMemoryConversationStateStore(StoryEngineConfig config, TurnUpdateValidator validator,
                                          AuditService audit, Clock clock) {
        this.config = config;
        this.validator = validator;
        this.audit = audit;
        this.clock = clock;
    }

    @Override
    public ConversationState getOrCreate(String sessionKey) {
        validator.requireSessionKey(sessionKey);
        return withSlot(sessionKey, true, ConversationState::copy);
    }

    @Override
    public Optional<ConversationState> find(String sessionKey) {
        if (sessionKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(withSlot(sessionKey, false, ConversationState::copy));
    }

    @Override
    public ConversationState updateTurn(String sessionKey, TurnUpdate update) {
        TurnUpdate normalized;
        try {
            normalized = validator.normalize(sessionKey, update);
        } catch (StoryEngineException e) {
            audit.audit(StoryEngineAuditStage.TURN_REJECTED, sessionKey,
                    Map.of("reason", e.getMessage(), "violations", e.getMetaData() == null ? Map.of() : e.getMetaData()));
            throw e;
        }
        ConversationState updated = withSlot(sessionKey, true, state -> {
            applyTurn(state, normalized);
            return state.copy();
        });

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turn", updated.getTurnCount());
        payload.put("topics", updated.getCurrentTopics());
        payload.put("dominantTheme", updated.dominantTheme());
        payload.put("concepts", updated.getMentionedConcepts().size());
        audit.audit(StoryEngineAuditStage.TURN_UPDATED, sessionKey, payload);
        return updated;
    }

    @Override
    public boolean recordStoryUsage(String sessionKey, String storyId) {
        if (sessionKey == null || storyId == null || storyId.isBlank()) {
            return false;
        }
        Boolean recorded = withSlot(sessionKey, false, state -> {
            state.getRetrievedStoryHistory().add(new StoryUsage(storyId, state.getTurnCount()));
            state.setLastUpdated(clock.instant());
            return Boolean.TRUE;
        });
        if (recorded == null) {
            return false;
        }
        audit.audit(StoryEngineAuditStage.STORY_USAGE_RECORDED, sessionKey, Map.of("storyIds", List.of(storyId)));
        return true;
    }

    @Override
    public boolean recordStoryUsages(String sessionKey, String expectedSessionId, int turn, Collection<String> storyIds) {
        if (sessionKey == null || storyIds == null || storyIds.isEmpty()) {
            return false;
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>(storyIds);
        unique.removeIf(id -> id == null || id.isBlank());
        Boolean recorded = withSlot(sessionKey, false, state -> {
            if (expectedSessionId != null && !expectedSessionId.equals(state.getSessionId())) {
                return Boolean.FALSE;
            }
            for (String storyId : unique) {
                state.getRetrievedStoryHistory().add(new StoryUsage(storyId, turn));
            }
            state.setLastUpdated(clock.instant());
            return Boolean.TRUE;
        });
        if (!Boolean.TRUE.equals(recorded)) {
            log.info("StoryEngine skipped usage recording for session={} (session missing or reset)", sessionKey);
            return false;
        }
        audit.audit(StoryEngineAuditStage.STORY_USAGE_RECORDED, sessionKey,
                Map.of("turn", turn, "storyIds", List.copyOf(unique)));
        return true;
    }

    @Override
    public boolean reset(String sessionKey) {
        if (sessionKey == null) {
            return false;
        }
        SessionSlot slot = slots.get(sessionKey);
        if (slot == null) {
            return false;
        }
        slot.lock.lock();
        try {
            if (slot.state == null || slots.get(sessionKey) != slot) {
                return false;
            }
            slots.remove(sessionKey, slot);
            slot.state = null;
        } finally {
            slot.lock.unlock();
        }
        audit.audit(StoryEngineAuditStage.SESSION_RESET, sessionKey, Map.of());
        return true;
    }

    @Override
    public boolean reconfigure(String sessionKey, ContextDecayConfig decayConfig) {
        validator.validateDecayConfig(decayConfig);
        Boolean applied = withSlot(sessionKey, false, state -> {
            state.setContextDecay(decayConfig.copy());
            ContextDecay.decay(state);
            state.setLastUpdated(clock.instant());
            return Boolean.TRUE;
        });
        if (applied == null) {
            return false;
        }
        audit.audit(StoryEngineAuditStage.SESSION_RECONFIGURED, sessionKey, Map.of("contextDecay", decayConfig));
        return true;
    }

    @Override
    public void restore(ConversationState state) {
        if (state == null) {
            return;
        }
        validator.requireSessionKey(state.getSessionKey());
        ConversationState copy = state.copy();
        if (copy.getContextDecay() == null) {
            copy.setContextDecay(ContextDecayConfig.from(config.getDecay()));
        }
        while (true) {
            SessionSlot slot = slots.computeIfAbsent(copy.getSessionKey(), k -> new SessionSlot());
            slot.lock.lock();
            try {
                if (slots.get(copy.getSessionKey()) != slot) {
                    continue;
                }
                slot.state = copy;
            } finally {
                slot.lock.unlock();
            }
            break;
        }
        audit.audit(StoryEngineAuditStage.SESSION_RESTORED, state.getSessionKey(), Map.of("turn", copy.getTurnCount()));
    }

    @Override
    public int evictInactive(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        List<String> evicted = new ArrayList<>();
        for (Map.Entry<String, SessionSlot> entry : slots.entrySet()) {
            SessionSlot slot = entry.getValue();
            slot.lock.lock();
            try {
                if (slot.state != null && slot.state.getLastUpdated() != null
                        && slot.state.getLastUpdated().isBefore(cutoff)
                        && slots.remove(entry.getKey(), slot)) {
                    slot.state = null;
                    evicted.add(entry.getKey());
                }
            } finally {
                slot.lock.unlock();
            }
        }
        if (!evicted.isEmpty()) {
            log.info("StoryEngine evicted {} inactive session(s) idle longer than {}", evicted.size(), maxIdle);
            audit.audit(StoryEngineAuditStage.SESSIONS_EVICTED, null, Map.of("sessionKeys", evicted));
        }
        return evicted.size();
    }

    private void applyTurn(ConversationState state, TurnUpdate update) {
        int turn = state.getTurnCount() + 1;
        state.setTurnCount(turn);
        mergeTopics(state, update.topics());
        appendIntents(state, update.intents());
        countConcepts(state, update.concepts(), turn);
        updateFlow(state, update.topics(), turn);
        ContextDecay.decay(state);
        state.setLastUpdated(clock.instant());
    }

    private void mergeTopics(ConversationState state, List<String> topics) {
        List<String> current = state.getCurrentTopics();
        for (int i = topics.size() - 1; i >= 0; i--) {
            String topic = topics.get(i);
            current.remove(topic);
            current.add(0, topic);
        }
        int max = Math.max(0, config.getState().getMaxTopics());
        while (current.size() > max) {
            current.remove(current.size() - 1);
        }
    }

    private void appendIntents(ConversationState state, List<String> intents) {
        List<String> history = state.getUserIntentHistory();
        history.addAll(intents);
        int max = Math.max(0, config.getState().getMaxIntents());
        while (history.size() > max) {
            history.remove(0);
        }
    }

    private void countConcepts(ConversationState state, List<String> concepts, int turn) {
        Map<String, ConceptMention> mentioned = state.getMentionedConcepts();
        for (String concept : new LinkedHashSet<>(concepts)) {
            ConceptMention mention = mentioned.get(concept);
            if (mention == null) {
                mentioned.put(concept, ConceptMention.firstSeen(turn));
            } else {
                mention.mentionedAgain(turn);
            }
        }
    }

    // A turn without topics leaves the flow untouched so the topic context can go stale.
    private void updateFlow(ConversationState state, List<String> newTopics, int turn) {
        List<String> topics = state.getCurrentTopics();
        if (newTopics.isEmpty() || topics.isEmpty()) {
            return;
        }
        ConversationFlow flow = state.getConversationFlow();
        String top = topics.get(0);
        if (top.equals(flow.getDominantTheme())) {
            flow.setThemeStabilityCount(flow.getThemeStabilityCount() + 1);
        } else {
            flow.setDominantTheme(top);
            flow.setThemeStabilityCount(1);
            flow.setLastTopicShiftTurn(turn);
        }
        flow.setLastRefreshedTurn(turn);
    }

    /**
     * Runs {@code action} against the live state of {@code sessionKey} while holding its lock.
     * Returns null when the session is absent and {@code create} is false.
     */
    private <T> T withSlot(String sessionKey, boolean create, Function<ConversationState, T> action) {
        while (true) {
            SessionSlot slot = create
                    ? slots.computeIfAbsent(sessionKey, k -> new SessionSlot())
                    : slots.get(sessionKey);
            if (slot == null) {
                return null;
            }
            boolean created = false;
            T result;
            slot.lock.lock();
            try {
                if (slots.get(sessionKey) != slot) {
                    // reset or evicted while we waited
                    continue;
                }
                if (slot.state == null) {
                    if (!create) {
                        return null;
                    }
                    slot.state = ConversationState.create(sessionKey, ContextDecayConfig.from(config.getDecay()));
                    slot.state.setLastUpdated(clock.instant());
                    created = true;
                }
                result = action.apply(slot.state);
            } finally {
                slot.lock.unlock();
            }
            if (created) {
                audit.audit(StoryEngineAuditStage.SESSION_CREATED, sessionKey, Map.of());
            }
            return result;
        }
    }

    private static final class SessionSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private ConversationState state;
    }
}

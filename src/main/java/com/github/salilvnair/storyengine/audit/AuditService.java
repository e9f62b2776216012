package com.github.salilvnair.storyengine.audit;

import com.github.salilvnair.storyengine.util.JsonUtil;

import java.util.Map;

public interface AuditService {
    void audit(String stage, String sessionKey, String payloadJson);

    default void audit(StoryEngineAuditStage stage, String sessionKey, String payloadJson) {
        audit(stage.value(), sessionKey, payloadJson);
    }

    default void audit(StoryEngineAuditStage stage, String sessionKey, Map<String, ?> payload) {
        audit(stage.value(), sessionKey, JsonUtil.toJson(payload == null ? Map.of() : payload));
    }
}

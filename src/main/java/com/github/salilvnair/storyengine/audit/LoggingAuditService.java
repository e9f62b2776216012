package com.github.salilvnair.storyengine.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingAuditService implements AuditService {

    @Override
    public void audit(String stage, String sessionKey, String payloadJson) {
        if (log.isDebugEnabled()) {
            log.debug("StoryEngine audit stage={} session={} payload={}", stage, sessionKey, payloadJson);
        }
    }
}

package com.github.salilvnair.storyengine.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class StoryEngineException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public StoryEngineException(StoryEngineErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public StoryEngineException(StoryEngineErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public StoryEngineException(StoryEngineErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public StoryEngineException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

    public boolean is(StoryEngineErrorCode code) {
        return code != null && code.name().equals(errorCode);
    }
}

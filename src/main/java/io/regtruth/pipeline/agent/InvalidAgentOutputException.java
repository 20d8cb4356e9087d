package io.regtruth.pipeline.agent;

public class InvalidAgentOutputException extends RuntimeException {

    public InvalidAgentOutputException(String message) {
        super(message);
    }

    public InvalidAgentOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.storyarn.core.exception;

import java.io.Serial;

public class FlowNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = -2871947310563904417L;

    public FlowNotFoundException(String message) {
        super(message);
    }
}

package com.robobracket.engine;

import lombok.Getter;

/**
 * Base class for rejected engine operations. Thrown before any returned state is produced,
 * so callers never see a partially applied update.
 */
@Getter
public abstract class BracketEngineException extends RuntimeException {

    private final String code;

    protected BracketEngineException(String code, String message) {
        super(message);
        this.code = code;
    }
}

package com.plotlab.game;

/** Configuration could not be read or is inconsistent. */
public class GameConfigException extends RuntimeException {

    public GameConfigException(String message) {
        super(message);
    }

    public GameConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

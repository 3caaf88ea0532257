package io.github.vishalmysore.legalnet.retrieval;

/**
 * Thrown when a {@link NetworkQuery} is constructed with values the engine
 * does not define behaviour for.
 */
public class InvalidQueryException extends IllegalArgumentException {

    public InvalidQueryException(String message) {
        super(message);
    }
}

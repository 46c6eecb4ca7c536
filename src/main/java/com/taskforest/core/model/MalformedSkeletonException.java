package com.taskforest.core.model;

/**
 * Thrown when an input skeleton lacks the identity fields the engine requires.
 * This is a contract violation by the upstream loader; the engine reports it
 * and keeps processing the remaining skeletons.
 */
public class MalformedSkeletonException extends RuntimeException {

    public MalformedSkeletonException(String message) {
        super(message);
    }
}

package com.taskforest.core.extract;

/**
 * Structural patterns recognised in a parent task's text, declared in priority order.
 * A region claimed by an earlier pattern is invisible to the later ones.
 */
public enum ExtractionPattern {
    /** {@code <new_task>} blocks with a {@code <message>} body, or {@code [new_task in X mode: '...']}. */
    SPAWN_DELIMITER,
    /** Fenced code blocks tagged with a language, emitted as {@code "<language>: <code>"}. */
    FENCED_CODE,
    BULLET,
    NUMBERED,
    HEADING,
    BLOCK_QUOTE
}

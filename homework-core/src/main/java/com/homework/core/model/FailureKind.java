package com.homework.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Pipeline failure taxonomy. Recoverable kinds are handled inside their stage and
 * only logged; the others stop the run and are reported with their step number.
 */
@Getter
@RequiredArgsConstructor
public enum FailureKind {
    EXTRACTION_EMPTY(1, false, "Element extraction produced no elements"),
    STRUCTURE_PARSE_FAILURE(2, true, "Structure reply could not be parsed"),
    STRUCTURE_EMPTY(2, false, "No problems could be recognised"),
    MATCHING_EMPTY(3, false, "No problems survived element matching"),
    ORACLE_EXHAUSTED(4, true, "Content oracle failed after all retries");

    private final int step;
    private final boolean recoverable;
    private final String description;
}

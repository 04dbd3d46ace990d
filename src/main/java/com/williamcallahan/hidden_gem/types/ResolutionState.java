/**
 * States of a single media resolution
 *
 * Features:
 * - IDLE through DONE follow the happy path of a resolution
 * - SATISFIED short-circuits straight to DONE without any provider call
 * - FAILED is only reached on store I/O errors
 */
package com.williamcallahan.hidden_gem.types;

public enum ResolutionState {
    IDLE,
    INSPECTING,
    SATISFIED,
    NEEDS_FETCH,
    FETCHING,
    CATEGORIZING,
    PERSISTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}

package com.williamcallahan.hidden_gem.types;

/**
 * Closed set of third-party media providers
 * - Priority decides the order of the provider walk (lower first)
 */
public enum ProviderId {
    RAWG("RAWG", 0),
    THE_GAMES_DB("TheGamesDB", 1);

    private final String displayName;
    private final int priority;

    ProviderId(String displayName, int priority) {
        this.displayName = displayName;
        this.priority = priority;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getPriority() {
        return priority;
    }
}

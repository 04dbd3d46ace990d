package com.williamcallahan.hidden_gem.types;

import java.util.Objects;

/**
 * Identity of a game for media lookups
 *
 * The title is the canonical catalog spelling and is matched case-sensitively. The platform is an
 * optional hint passed to providers; it does not take part in the storage directory name.
 *
 * @param title catalog title
 * @param platform console or platform qualifier, may be null
 */
public record GameKey(String title, String platform) {

    public GameKey {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Game title must not be blank");
        }
        if (platform != null && platform.isBlank()) {
            platform = null;
        }
    }

    public static GameKey of(String title) {
        return new GameKey(title, null);
    }

    public static GameKey of(String title, String platform) {
        return new GameKey(title, platform);
    }

    /**
     * Filesystem-safe directory name: letters, digits, space, '-' and '_' are kept, the rest is
     * dropped, then spaces become underscores
     */
    public String directoryName() {
        StringBuilder safe = new StringBuilder(title.length());
        for (int i = 0; i < title.length(); i++) {
            char c = title.charAt(i);
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_') {
                safe.append(c);
            }
        }
        String name = safe.toString().strip().replace(' ', '_');
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Game title '" + title + "' has no filesystem-safe characters");
        }
        return name;
    }

    public boolean hasPlatform() {
        return platform != null;
    }

    @Override
    public String toString() {
        return platform == null ? title : title + " (" + platform + ")";
    }

    public boolean sameStorageAs(GameKey other) {
        return other != null && Objects.equals(directoryName(), other.directoryName());
    }
}

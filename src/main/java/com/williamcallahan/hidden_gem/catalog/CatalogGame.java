package com.williamcallahan.hidden_gem.catalog;

import com.williamcallahan.hidden_gem.types.GameKey;

/**
 * One catalog entry
 *
 * @param title canonical title spelling
 * @param manufacturer console manufacturer
 * @param console console name, passed to providers as platform hint
 */
public record CatalogGame(String title, String manufacturer, String console) {

    public GameKey toKey() {
        return GameKey.of(title, console);
    }
}

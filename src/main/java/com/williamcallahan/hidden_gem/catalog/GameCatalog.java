package com.williamcallahan.hidden_gem.catalog;

import java.util.List;

/**
 * Read-only source of the games whose media the engine manages
 */
public interface GameCatalog {

    /**
     * All catalog games in catalog order
     */
    List<CatalogGame> listGames();
}

package com.williamcallahan.hidden_gem.catalog;

import com.williamcallahan.hidden_gem.types.GameKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TsvGameCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void readsTitlesColumnByColumnWithTheirConsoles() {
        List<CatalogGame> games = TsvGameCatalog.parse(List.of(
            "Nintendo\tSega\tNintendo",
            "SNES\tMegadrive\tN64",
            "Super Metroid\tSonic the Hedgehog\tSuper Mario 64",
            "Chrono Trigger\t\tMario Kart 64",
            "\tStreets of Rage 2\t"));

        assertThat(games).containsExactly(
            new CatalogGame("Super Metroid", "Nintendo", "SNES"),
            new CatalogGame("Sonic the Hedgehog", "Sega", "Megadrive"),
            new CatalogGame("Super Mario 64", "Nintendo", "N64"),
            new CatalogGame("Chrono Trigger", "Nintendo", "SNES"),
            new CatalogGame("Mario Kart 64", "Nintendo", "N64"),
            new CatalogGame("Streets of Rage 2", "Sega", "Megadrive"));
    }

    @Test
    void blankHeaderCellsDefaultToUnknown() {
        List<CatalogGame> games = TsvGameCatalog.parse(List.of(
            "\tSony",
            "Arcade\t",
            "Metal Slug\tCrash Bandicoot"));

        assertThat(games).containsExactly(
            new CatalogGame("Metal Slug", "Unknown", "Arcade"),
            new CatalogGame("Crash Bandicoot", "Sony", "Unknown"));
    }

    @Test
    void fileWithoutTitleRowsIsEmpty() {
        assertThat(TsvGameCatalog.parse(List.of("Nintendo", "SNES"))).isEmpty();
        assertThat(TsvGameCatalog.parse(List.of())).isEmpty();
    }

    @Test
    void readsTheCatalogFile() throws Exception {
        Path file = tempDir.resolve("games.tsv");
        Files.writeString(file, "Nintendo\nNES\nThe Legend of Zelda\nMetroid\n", StandardCharsets.UTF_8);

        List<CatalogGame> games = new TsvGameCatalog(file).listGames();

        assertThat(games).extracting(CatalogGame::toKey)
            .containsExactly(GameKey.of("The Legend of Zelda", "NES"), GameKey.of("Metroid", "NES"));
    }

    @Test
    void missingFileIsAnEmptyCatalog() {
        assertThat(new TsvGameCatalog(tempDir.resolve("absent.tsv")).listGames()).isEmpty();
    }
}

package com.williamcallahan.hidden_gem.types;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameKeyTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Super Mario Bros. 3|Super_Mario_Bros_3",
        "Pokémon Red|Pokémon_Red",
        "  Metroid  |Metroid",
        "Castlevania: Symphony of the Night|Castlevania_Symphony_of_the_Night",
        "F-Zero_X|F-Zero_X"
    })
    void directoryNameKeepsOnlySafeCharacters(String title, String expected) {
        assertThat(GameKey.of(title).directoryName()).isEqualTo(expected);
    }

    @Test
    void platformIsAHintOnly() {
        GameKey snes = GameKey.of("Chrono Trigger", "SNES");
        GameKey plain = GameKey.of("Chrono Trigger");

        assertThat(snes).isNotEqualTo(plain);
        assertThat(snes.sameStorageAs(plain)).isTrue();
        assertThat(snes.hasPlatform()).isTrue();
    }

    @Test
    void blankPlatformBecomesNull() {
        assertThat(GameKey.of("Tetris", "  ").platform()).isNull();
    }

    @Test
    void rejectsBlankAndUnsafeOnlyTitles() {
        assertThatThrownBy(() -> GameKey.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GameKey.of("???").directoryName()).isInstanceOf(IllegalArgumentException.class);
    }
}

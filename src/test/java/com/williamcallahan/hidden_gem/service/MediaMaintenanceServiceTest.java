package com.williamcallahan.hidden_gem.service;

import com.williamcallahan.hidden_gem.repository.FileSystemMediaStore;
import com.williamcallahan.hidden_gem.testutil.MediaFixtures;
import com.williamcallahan.hidden_gem.testutil.MutableClock;
import com.williamcallahan.hidden_gem.types.DescriptionSource;
import com.williamcallahan.hidden_gem.types.GameKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MediaMaintenanceServiceTest {

    private static final String LONG_TEXT = "Samus Aran lands on Zebes to recover the stolen Metroid larva. "
        + "She explores a vast planet full of secrets and upgrades.";

    @TempDir
    Path mediaRoot;

    private FileSystemMediaStore store;
    private MediaMaintenanceService maintenanceService;

    @BeforeEach
    void setUp() {
        store = MediaFixtures.store(mediaRoot, new MutableClock(Instant.parse("2026-04-01T00:00:00Z")));
        maintenanceService = new MediaMaintenanceService(store);
    }

    @Test
    void clearsOnlyShortProviderDescriptions() {
        GameKey shortProvider = GameKey.of("Metroid", "NES");
        GameKey longProvider = GameKey.of("Super Metroid", "SNES");
        GameKey shortAdmin = GameKey.of("Kid Icarus", "NES");
        GameKey tagsOnly = GameKey.of("Excitebike", "NES");
        store.setProviderDescriptionIfAbsent(shortProvider, "Action game.");
        store.setProviderDescriptionIfAbsent(longProvider, LONG_TEXT);
        store.setDescription(shortAdmin, "Curated.");
        store.setTags(tagsOnly, Set.of("racing"));

        int removed = maintenanceService.clearShortProviderDescriptions();

        assertThat(removed).isEqualTo(1);
        assertThat(store.readMetadata(shortProvider).hasDescription()).isFalse();
        assertThat(store.readMetadata(longProvider).description()).isEqualTo(LONG_TEXT);
        assertThat(store.readMetadata(shortAdmin).descriptionSource()).isEqualTo(DescriptionSource.ADMIN);
        assertThat(store.readMetadata(tagsOnly).tags()).containsExactly("racing");
    }

    @Test
    void emptyStoreRemovesNothing() {
        assertThat(maintenanceService.clearShortProviderDescriptions()).isZero();
    }
}

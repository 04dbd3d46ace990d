/**
 * Game catalog read from a tab-separated file
 *
 * Layout:
 * - Row 1: manufacturer per column
 * - Row 2: console per column
 * - Further rows: one title per column, blank cells allowed
 *
 * The file is re-read on every call so catalog edits show up without a restart.
 */
package com.williamcallahan.hidden_gem.catalog;

import com.williamcallahan.hidden_gem.config.AppConfigurationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class TsvGameCatalog implements GameCatalog {

    private static final String UNKNOWN = "Unknown";

    private final Path catalogFile;

    @Autowired
    public TsvGameCatalog(AppConfigurationProperties properties) {
        this(Paths.get(properties.getCatalog().getFile()));
    }

    TsvGameCatalog(Path catalogFile) {
        this.catalogFile = catalogFile;
    }

    @Override
    public List<CatalogGame> listGames() {
        if (!Files.isRegularFile(catalogFile)) {
            log.warn("Catalog file {} not found, catalog is empty", catalogFile.toAbsolutePath());
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(catalogFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read catalog " + catalogFile, e);
        }
        return parse(lines);
    }

    static List<CatalogGame> parse(List<String> lines) {
        if (lines.size() < 3) {
            return List.of();
        }
        String[] manufacturers = lines.get(0).split("\t", -1);
        String[] consoles = lines.get(1).split("\t", -1);

        List<CatalogGame> games = new ArrayList<>();
        for (String line : lines.subList(2, lines.size())) {
            String[] titles = line.split("\t", -1);
            for (int i = 0; i < titles.length && i < consoles.length; i++) {
                String title = titles[i].strip();
                if (title.isEmpty()) {
                    continue;
                }
                String manufacturer = i < manufacturers.length && !manufacturers[i].isBlank() ? manufacturers[i].strip() : UNKNOWN;
                String console = consoles[i].isBlank() ? UNKNOWN : consoles[i].strip();
                games.add(new CatalogGame(title, manufacturer, console));
            }
        }
        return games;
    }
}

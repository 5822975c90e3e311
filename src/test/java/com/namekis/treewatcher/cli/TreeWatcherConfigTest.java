package com.namekis.treewatcher.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.namekis.treewatcher.BuildStrategy;
import com.namekis.treewatcher.Forest;
import com.namekis.treewatcher.ListingReader;
import com.namekis.treewatcher.Node;

class TreeWatcherConfigTest {
    @TempDir
    Path dir;

    @Test
    void writesDefaultsWhenMissing() throws Exception {
        Path file = dir.resolve("config.json");
        TreeWatcherConfig config = TreeWatcherConfig.loadOrCreate(file);

        assertEquals(TreeWatcherConfig.DEFAULT_FILE_ICON, config.fileIcon);
        assertEquals(TreeWatcherConfig.DEFAULT_FOLDER_ICON, config.folderIcon);
        assertTrue(Files.exists(file));
        String written = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(written.contains("\"file_icon\""), written);
        assertTrue(written.contains(TreeWatcherConfig.DEFAULT_FOLDER_ICON), written);
    }

    @Test
    void readsIconsAndIgnoresUnknownKeys() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"file_icon\":\"F\",\"folder_icon\":\"D\",\"theme\":\"cosmo\","
                + "\"extension_icons\":{\".JAVA\":\"J\",\"md\":\"M\"}}", StandardCharsets.UTF_8);
        TreeWatcherConfig config = TreeWatcherConfig.loadOrCreate(file);

        Forest forest = BuildStrategy.STACK.build(ListingReader.read(List.of(
                "root", "├── Main.java", "├── README.md", "├── notes", "└── src", "    └── x")));
        List<Node> children = forest.roots().get(0).children();
        assertEquals("D", config.iconFor(forest.roots().get(0)));
        assertEquals("J", config.iconFor(children.get(0)));
        assertEquals("M", config.iconFor(children.get(1)));
        assertEquals("F", config.iconFor(children.get(2)));
        assertEquals("D", config.iconFor(children.get(3)));
    }

    @Test
    void brokenFileFallsBackToDefaults() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
        TreeWatcherConfig config = TreeWatcherConfig.loadOrCreate(file);
        assertEquals(TreeWatcherConfig.DEFAULT_FILE_ICON, config.fileIcon);
        assertTrue(config.extensionIcons.isEmpty());
    }

    @Test
    void nullValuesAreReplaced() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"file_icon\":null,\"extension_icons\":null}", StandardCharsets.UTF_8);
        TreeWatcherConfig config = TreeWatcherConfig.loadOrCreate(file);
        assertEquals(TreeWatcherConfig.DEFAULT_FILE_ICON, config.fileIcon);
        assertNotNull(config.extensionIcons);
    }

    @Test
    void extensions() {
        assertEquals("txt", TreeWatcherConfig.extension("a.TXT"));
        assertEquals("gz", TreeWatcherConfig.extension("x.tar.gz"));
        assertNull(TreeWatcherConfig.extension(".gitignore"));
        assertNull(TreeWatcherConfig.extension("Makefile"));
        assertNull(TreeWatcherConfig.extension("C:."));
    }
}

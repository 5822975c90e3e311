package com.namekis.treewatcher.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.namekis.treewatcher.Node;

import one.util.streamex.EntryStream;

/**
 * Icons shown in front of each entry, read from a {@code config.json} like:
 *
 * <pre>
 * {
 *   "file_icon" : "📄",
 *   "folder_icon" : "📂",
 *   "extension_icons" : { "java" : "☕", "md" : "📝" }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TreeWatcherConfig {
    private static final Logger log = LoggerFactory.getLogger(TreeWatcherConfig.class);
    static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static final String DEFAULT_FILE_ICON = "📄";
    public static final String DEFAULT_FOLDER_ICON = "📂";

    @JsonProperty("file_icon")
    public String fileIcon = DEFAULT_FILE_ICON;
    @JsonProperty("folder_icon")
    public String folderIcon = DEFAULT_FOLDER_ICON;
    @JsonProperty("extension_icons")
    public Map<String, String> extensionIcons = new LinkedHashMap<>();

    /**
     * Reads {@code path}, or writes the defaults there when it does not exist yet. Problems with the file are logged
     * and the defaults are used: icons are never worth failing a load for.
     */
    public static TreeWatcherConfig loadOrCreate(Path path) {
        TreeWatcherConfig config = new TreeWatcherConfig();
        if (Files.exists(path)) {
            try {
                config = MAPPER.readValue(path.toFile(), TreeWatcherConfig.class);
            } catch (IOException e) {
                log.warn("Error loading config {}: {}", path, e.getMessage());
                config = new TreeWatcherConfig();
            }
        } else {
            try {
                MAPPER.writeValue(path.toFile(), config);
                log.debug("Created default config {}", path);
            } catch (IOException e) {
                log.warn("Error creating config {}: {}", path, e.getMessage());
            }
        }
        return config.normalized();
    }

    TreeWatcherConfig normalized() {
        if (fileIcon == null)
            fileIcon = DEFAULT_FILE_ICON;
        if (folderIcon == null)
            folderIcon = DEFAULT_FOLDER_ICON;
        extensionIcons = extensionIcons == null ? new LinkedHashMap<>()
                : EntryStream.of(extensionIcons)
                        .nonNullValues()
                        .mapKeys(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                        .toCustomMap((a, b) -> a, LinkedHashMap::new);
        return this;
    }

    public String iconFor(Node node) {
        if (node.isFolder())
            return folderIcon;
        String ext = extension(node.name());
        return ext == null ? fileIcon : extensionIcons.getOrDefault(ext, fileIcon);
    }

    static String extension(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1)
            return null;
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

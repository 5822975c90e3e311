package com.namekis.treewatcher.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.namekis.treewatcher.BuildStrategy;
import com.namekis.treewatcher.LazyTreeModel;
import com.namekis.treewatcher.ListingReader;

class TreePrinterTest {
    private static final List<String> LISTING = List.of(
            "C:.",
            "├── a",
            "│   ├── a1",
            "│   └── a2",
            "└── b.txt");

    private static String print(TreePrinter printer, LazyTreeModel model) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        printer.print(model, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        return bytes.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static LazyTreeModel model() throws Exception {
        return LazyTreeModel.of(BuildStrategy.RECURSIVE.build(ListingReader.read(LISTING)));
    }

    @Test
    void printsBackTheSameListing() throws Exception {
        String out = print(new TreePrinter(TreePrinter.Glyphs.UNICODE, null, -1), model());
        assertEquals(String.join("\n", LISTING) + "\n", out);
    }

    @Test
    void asciiGlyphsAndIcons() throws Exception {
        TreeWatcherConfig icons = new TreeWatcherConfig();
        icons.fileIcon = "f";
        icons.folderIcon = "d";
        String out = print(new TreePrinter(TreePrinter.Glyphs.ASCII, icons, -1), model());
        assertEquals("d C:.\n+---d a\n|   +---f a1\n|   \\---f a2\n\\---f b.txt\n", out);
    }

    @Test
    void expandLimitLeavesDeeperFoldersClosed() throws Exception {
        LazyTreeModel model = model();
        String out = print(new TreePrinter(TreePrinter.Glyphs.UNICODE, null, 1), model);
        assertEquals("C:.\n├── a\n└── b.txt\n", out);
        assertFalse(model.expand(model.roots().get(0)).get(0).isExpanded());
    }
}

package com.namekis.treewatcher.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import one.util.streamex.StreamEx;

/**
 * Reads a saved listing. {@code tree /F > out.txt} writes the console code page, so after strict UTF-8 the file is
 * tried as GBK, the usual Windows code page for Chinese locales.
 */
public final class ListingFiles {
    private static final Logger log = LoggerFactory.getLogger(ListingFiles.class);
    static final List<Charset> CHARSETS = List.of(StandardCharsets.UTF_8, Charset.forName("GBK"));
    private static final char BOM = '\uFEFF';

    private ListingFiles() {
    }

    public static List<String> readLines(Path file) throws IOException, ListingDecodeException {
        return readLines(file, Files.readAllBytes(file));
    }

    static List<String> readLines(Path file, byte[] content) throws ListingDecodeException {
        CharacterCodingException last = null;
        for (Charset charset : CHARSETS) {
            try {
                String text = decode(content, charset);
                log.debug("Decoded {} as {}", file, charset);
                return lines(text);
            } catch (CharacterCodingException e) {
                log.debug("{} is not {}: {}", file, charset, e.toString());
                last = e;
            }
        }
        throw new ListingDecodeException(file, last);
    }

    static String decode(byte[] content, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(content))
                .toString();
    }

    /** Splits on any line terminator; a trailing terminator adds no empty line and a leading BOM is dropped. */
    static List<String> lines(String text) {
        if (!text.isEmpty() && text.charAt(0) == BOM)
            text = text.substring(1);
        return StreamEx.of(new BufferedReader(new StringReader(text)).lines()).toList();
    }
}

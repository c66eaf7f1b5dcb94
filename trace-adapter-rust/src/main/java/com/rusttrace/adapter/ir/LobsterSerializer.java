package com.rusttrace.adapter.ir;

import com.google.gson.FormattingStyle;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a LobsterDocument to disk.
 * Nulls are written out so that unknown positions appear as {@code "line": null}.
 */
public class LobsterSerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private static final Gson GSON = new GsonBuilder()
        .serializeNulls()
        .disableHtmlEscaping()
        .setFormattingStyle(FormattingStyle.PRETTY.withIndent("    "))
        .create();

    /**
     * Writes {@code document} to {@code outputFile}, creating parent directories as needed.
     */
    public void write(LobsterModel.LobsterDocument document, Path outputFile) {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new SerializerException("Could not create output directory: " + parent, e);
            }
        }

        try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            GSON.toJson(document, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + outputFile + ": " + e.getMessage(), e);
        }
        System.err.println("[trace-adapter] " + document.data.size() + " items written: " + outputFile);
    }

    /** The JSON text {@link #write} would produce. */
    public String toJson(LobsterModel.LobsterDocument document) {
        return GSON.toJson(document);
    }
}

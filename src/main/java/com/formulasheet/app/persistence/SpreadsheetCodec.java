package com.formulasheet.app.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.formulasheet.app.exceptions.SpreadsheetReadWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link SpreadsheetDocument}s as JSON files.
 * Every failure comes out as a {@link SpreadsheetReadWriteException}.
 */
public final class SpreadsheetCodec {

    public static final String FILE_EXTENSION = ".sprd";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SpreadsheetCodec() {
    }

    public static void write(Path path, SpreadsheetDocument document) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), document);
        } catch (IOException e) {
            throw new SpreadsheetReadWriteException("Could not save " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses the file and checks that its version matches {@code expectedVersion}.
     */
    public static SpreadsheetDocument read(Path path, String expectedVersion) {
        SpreadsheetDocument document;
        try {
            document = MAPPER.readValue(path.toFile(), SpreadsheetDocument.class);
        } catch (IOException e) {
            throw new SpreadsheetReadWriteException("Could not read " + path + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new SpreadsheetReadWriteException("File " + path + " is empty");
        }
        if (expectedVersion == null || !expectedVersion.equals(document.getVersion())) {
            throw new SpreadsheetReadWriteException("Mismatched versions: expected " + expectedVersion
                    + " but " + path + " has " + document.getVersion());
        }
        return document;
    }
}

package com.formulasheet.app.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formulasheet.app.exceptions.SpreadsheetReadWriteException;
import com.formulasheet.app.models.Spreadsheet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Saving and loading spreadsheets through ".sprd" files.
 */
class SpreadsheetPersistenceTest {

    private static final Predicate<String> GRID = s -> s.matches("[A-Z][1-9][0-9]?");
    private static final UnaryOperator<String> UPPER = s -> s.toUpperCase(Locale.ROOT);

    @TempDir
    Path dir;

    private Spreadsheet newSheet() {
        return new Spreadsheet(GRID, UPPER, "ps6");
    }

    @Test
    void testSaveThenLoadRestoresContentsAndValues() {
        Spreadsheet saved = newSheet();
        saved.setContentsOfCell("A1", "5");
        saved.setContentsOfCell("B1", "=A1*2");
        saved.setContentsOfCell("C1", "=B1+A1");
        saved.setContentsOfCell("D1", "note");
        saved.setContentsOfCell("E1", "=1/0");
        saved.setContentsOfCell("F1", "2.5");

        Path file = dir.resolve("sheet.sprd");
        saved.save(file);
        assertFalse(saved.isChanged());

        Spreadsheet loaded = new Spreadsheet(file, GRID, UPPER, "ps6");

        assertEquals(saved.getNamesOfAllNonemptyCells(), loaded.getNamesOfAllNonemptyCells());
        for (String name : saved.getNamesOfAllNonemptyCells()) {
            assertEquals(saved.getCellContents(name), loaded.getCellContents(name), name);
            assertEquals(saved.getCellValue(name).getType(), loaded.getCellValue(name).getType(), name);
            assertEquals(saved.getCellValue(name), loaded.getCellValue(name), name);
        }
        assertEquals(15, loaded.getCellValue("C1").getNumber(), 1e-9);
        assertFalse(loaded.isChanged());

        // dependencies were rebuilt, not just values
        loaded.setContentsOfCell("A1", "10");
        assertEquals(30, loaded.getCellValue("C1").getNumber(), 1e-9);
    }

    @Test
    void testDocumentFormat() throws IOException {
        Spreadsheet sheet = newSheet();
        sheet.setContentsOfCell("A1", "2.0");
        sheet.setContentsOfCell("B1", "= a1 + 1");
        sheet.setContentsOfCell("C1", "");

        Path file = dir.resolve("format.sprd");
        sheet.save(file);

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertEquals("ps6", root.get("Version").asText());
        assertEquals("2", root.get("Cells").get("A1").get("StringForm").asText());
        assertEquals("=A1+1", root.get("Cells").get("B1").get("StringForm").asText());
        assertFalse(root.get("Cells").has("C1"));
    }

    @Test
    void testLoadReplaysCellsInAnyOrder() throws IOException {
        Path file = dir.resolve("order.sprd");
        Files.writeString(file, "{\n"
                + "  \"Cells\": {\n"
                + "    \"C1\": { \"StringForm\": \"=B1+A1\" },\n"
                + "    \"B1\": { \"StringForm\": \"=A1*2\" },\n"
                + "    \"A1\": { \"StringForm\": \"5\" }\n"
                + "  },\n"
                + "  \"Version\": \"ps6\"\n"
                + "}", StandardCharsets.UTF_8);

        Spreadsheet loaded = new Spreadsheet(file, GRID, UPPER, "ps6");
        assertEquals(10, loaded.getCellValue("B1").getNumber(), 1e-9);
        assertEquals(15, loaded.getCellValue("C1").getNumber(), 1e-9);
        assertFalse(loaded.isChanged());
    }

    @Test
    void testVersionMismatchFails() {
        Spreadsheet sheet = newSheet();
        sheet.setContentsOfCell("A1", "1");
        Path file = dir.resolve("v.sprd");
        sheet.save(file);

        SpreadsheetReadWriteException ex = assertThrows(SpreadsheetReadWriteException.class,
                () -> new Spreadsheet(file, GRID, UPPER, "ps7"));
        assertTrue(ex.getMessage().contains("Mismatched versions"));
    }

    @Test
    void testMissingFileFails() {
        assertThrows(SpreadsheetReadWriteException.class,
                () -> new Spreadsheet(dir.resolve("nope.sprd"), GRID, UPPER, "ps6"));
    }

    @Test
    void testMalformedJsonFails() throws IOException {
        Path file = dir.resolve("bad.sprd");
        Files.writeString(file, "{ \"Cells\": [", StandardCharsets.UTF_8);
        assertThrows(SpreadsheetReadWriteException.class, () -> new Spreadsheet(file, GRID, UPPER, "ps6"));

        Files.writeString(file, "{ \"Cells\": {}, \"Version\": \"ps6\", \"Extra\": 1 }", StandardCharsets.UTF_8);
        assertThrows(SpreadsheetReadWriteException.class, () -> new Spreadsheet(file, GRID, UPPER, "ps6"));
    }

    @Test
    void testInvalidStoredContentsFail() throws IOException {
        Path file = dir.resolve("invalid.sprd");

        Files.writeString(file, "{ \"Cells\": { \"A1\": { \"StringForm\": \"=2+\" } }, \"Version\": \"ps6\" }",
                StandardCharsets.UTF_8);
        assertThrows(SpreadsheetReadWriteException.class, () -> new Spreadsheet(file, GRID, UPPER, "ps6"));

        Files.writeString(file, "{ \"Cells\": { \"ZZ99\": { \"StringForm\": \"1\" } }, \"Version\": \"ps6\" }",
                StandardCharsets.UTF_8);
        assertThrows(SpreadsheetReadWriteException.class, () -> new Spreadsheet(file, GRID, UPPER, "ps6"));

        Files.writeString(file, "{ \"Cells\": { \"A1\": { \"StringForm\": \"=B1\" }, "
                + "\"B1\": { \"StringForm\": \"=A1\" } }, \"Version\": \"ps6\" }", StandardCharsets.UTF_8);
        assertThrows(SpreadsheetReadWriteException.class, () -> new Spreadsheet(file, GRID, UPPER, "ps6"));

        Files.writeString(file, "{ \"Cells\": { \"A1\": {} }, \"Version\": \"ps6\" }", StandardCharsets.UTF_8);
        assertThrows(SpreadsheetReadWriteException.class, () -> new Spreadsheet(file, GRID, UPPER, "ps6"));
    }

    @Test
    void testSaveToUnwritableLocationFails() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a directory", StandardCharsets.UTF_8);

        Spreadsheet sheet = newSheet();
        sheet.setContentsOfCell("A1", "1");
        assertThrows(SpreadsheetReadWriteException.class, () -> sheet.save(blocker.resolve("x.sprd")));
        assertTrue(sheet.isChanged());
    }

    @Test
    void testOverflowingAndPaddedLiteralsSurviveSaveAndLoad() {
        Spreadsheet sheet = newSheet();
        sheet.setContentsOfCell("A1", "1e400");
        sheet.setContentsOfCell("B1", " 5 ");
        sheet.setContentsOfCell("C1", "=1e400 + B1");

        Path file = dir.resolve("literals.sprd");
        sheet.save(file);
        Spreadsheet loaded = new Spreadsheet(file, GRID, UPPER, "ps6");

        for (String name : sheet.getNamesOfAllNonemptyCells()) {
            assertEquals(sheet.getCellContents(name), loaded.getCellContents(name), name);
            assertEquals(sheet.getCellContents(name).hashCode(), loaded.getCellContents(name).hashCode(), name);
            assertEquals(sheet.getCellValue(name), loaded.getCellValue(name), name);
        }
        assertEquals("1e400", loaded.getCellContents("A1").getStringForm());
        assertEquals(5, loaded.getCellValue("B1").getNumber(), 1e-9);
    }
}

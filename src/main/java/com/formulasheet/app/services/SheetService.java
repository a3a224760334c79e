package com.formulasheet.app.services;

import com.formulasheet.app.config.SpreadsheetProperties;
import com.formulasheet.app.exceptions.SheetNotFoundException;
import com.formulasheet.app.exceptions.SpreadsheetReadWriteException;
import com.formulasheet.app.models.CellContents;
import com.formulasheet.app.models.CellValue;
import com.formulasheet.app.models.CellView;
import com.formulasheet.app.models.Sheet;
import com.formulasheet.app.models.Spreadsheet;
import com.formulasheet.app.persistence.SpreadsheetCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Keeps the open spreadsheet documents, serializes access to each of them,
 * and maps file names onto the storage directory.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All open sheets live here in memory, keyed by ID
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final Predicate<String> cellNameValidator;
    private final UnaryOperator<String> cellNameNormalizer;
    private final String version;
    private final Path storageDirectory;

    public SheetService(SpreadsheetProperties properties) {
        this.cellNameValidator = properties.cellNameValidator();
        this.cellNameNormalizer = properties.cellNameNormalizer();
        this.version = properties.getVersion();
        this.storageDirectory = Paths.get(properties.getStorageDirectory()).toAbsolutePath().normalize();
    }

    /**
     * Creates a new empty spreadsheet and returns its ID.
     */
    public long createSheet() {
        Sheet sheet = new Sheet(new Spreadsheet(cellNameValidator, cellNameNormalizer, version), null);
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {}", sheet.getId());
        return sheet.getId();
    }

    /**
     * Opens a saved spreadsheet from the storage directory and returns its new ID.
     */
    public long openSheet(String fileName) {
        Path file = resolveFile(fileName);
        Spreadsheet spreadsheet = new Spreadsheet(file, cellNameValidator, cellNameNormalizer, version);
        Sheet sheet = new Sheet(spreadsheet, file.getFileName().toString());
        sheets.put(sheet.getId(), sheet);
        log.info("Opened sheet {} from {}", sheet.getId(), file);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    /**
     * Forgets an open sheet. Unsaved changes are lost.
     */
    public void closeSheet(long sheetId) {
        Sheet sheet = sheets.remove(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        if (sheet.getSpreadsheet().isChanged()) {
            log.warn("Closed sheet {} with unsaved changes", sheetId);
        } else {
            log.info("Closed sheet {}", sheetId);
        }
    }

    /**
     * Sets a cell's contents and returns the names of every cell whose value was recomputed,
     * the changed cell first. Invalid names, malformed formulas and cycles are rethrown
     * with the sheet unchanged.
     */
    public List<String> setCellContents(long sheetId, String cellName, String contents) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            return sheet.getSpreadsheet().setContentsOfCell(cellName, contents == null ? "" : contents);
        } catch (RuntimeException ex) {
            log.warn("Rejected contents '{}' for {} on sheet {}: {}", contents, cellName, sheetId, ex.getMessage());
            throw ex;
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public CellView getCell(long sheetId, String cellName) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Spreadsheet spreadsheet = sheet.getSpreadsheet();
            // the lookups validate the name before it is normalized for display
            CellContents contents = spreadsheet.getCellContents(cellName);
            CellValue value = spreadsheet.getCellValue(cellName);
            return new CellView(cellNameNormalizer.apply(cellName), contents, value);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Returns a map of cellName -> displayed value for every non-empty cell.
     * Evaluation errors show as "#ERROR".
     */
    public Map<String, Object> getSheetData(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Spreadsheet spreadsheet = sheet.getSpreadsheet();
            Map<String, Object> data = new LinkedHashMap<>();
            for (String name : spreadsheet.getNamesOfAllNonemptyCells()) {
                data.put(name, spreadsheet.getCellValue(name).toDisplayObject());
            }
            return data;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * The cells a cell reads ("dependees") and the cells reading it ("dependents").
     */
    public Map<String, Set<String>> getDependencies(long sheetId, String cellName) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            Spreadsheet spreadsheet = sheet.getSpreadsheet();
            Map<String, Set<String>> result = new LinkedHashMap<>();
            result.put("dependees", spreadsheet.getDirectDependees(cellName));
            result.put("dependents", spreadsheet.getDirectDependents(cellName));
            return result;
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    /**
     * Saves a sheet into the storage directory. Without a file name, the name it was
     * last opened from or saved to is reused. Returns the file name written.
     */
    public String saveSheet(long sheetId, String fileName) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().writeLock().lock();
        try {
            String target = fileName != null && !fileName.isBlank() ? fileName : sheet.getFileName();
            Path file = resolveFile(target);
            sheet.getSpreadsheet().save(file);
            sheet.setFileName(file.getFileName().toString());
            log.info("Saved sheet {} to {}", sheetId, file);
            return sheet.getFileName();
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public boolean isChanged(long sheetId) {
        Sheet sheet = getSheet(sheetId);

        sheet.getLock().readLock().lock();
        try {
            return sheet.getSpreadsheet().isChanged();
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Maps a bare file name into the storage directory, adding ".sprd" when missing.
     * Names that would point anywhere else are refused.
     */
    private Path resolveFile(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new SpreadsheetReadWriteException("A file name is required");
        }
        String name = fileName.strip();
        if (!name.toLowerCase(Locale.ROOT).endsWith(SpreadsheetCodec.FILE_EXTENSION)) {
            name = name + SpreadsheetCodec.FILE_EXTENSION;
        }
        Path file = storageDirectory.resolve(name).normalize();
        if (!storageDirectory.equals(file.getParent())) {
            throw new SpreadsheetReadWriteException("File name " + fileName + " must not contain a path");
        }
        return file;
    }
}

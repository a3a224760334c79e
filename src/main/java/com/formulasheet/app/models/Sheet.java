package com.formulasheet.app.models;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A spreadsheet document opened in the service:
 * - Has a unique ID
 * - The Spreadsheet itself (cells, dependency graph, changed flag)
 * - The file name it was last opened from or saved to, if any
 * - A read/write lock, since the Spreadsheet does no locking of its own
 */
public class Sheet {

    // Generates unique IDs for newly opened sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final Spreadsheet spreadsheet;
    private volatile String fileName;

    // One writer at a time; readers share
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(Spreadsheet spreadsheet, String fileName) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.spreadsheet = spreadsheet;
        this.fileName = fileName;
    }

    public long getId() {
        return id;
    }

    public Spreadsheet getSpreadsheet() {
        return spreadsheet;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}

package com.formulasheet.app.controllers;

import com.formulasheet.app.models.CellView;
import com.formulasheet.app.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for working with spreadsheet documents.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Creates a new empty spreadsheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet() {
        return ResponseEntity.ok(sheetService.createSheet());
    }

    /**
     * POST /sheet/open?fileName=budget
     * Opens "budget.sprd" from the storage directory, returns the new sheetId.
     * A missing file, a version mismatch or invalid stored contents give a 400 READ_WRITE error.
     */
    @PostMapping("/open")
    public ResponseEntity<Long> openSheet(@RequestParam String fileName) {
        return ResponseEntity.ok(sheetService.openSheet(fileName));
    }

    /**
     * PUT /sheet/{sheetId}/cell/{cellName}
     * Body: raw contents, e.g. "5", "hello" or "=A1*2". An empty body clears the cell.
     * Returns the cells whose values were recomputed, the changed cell first.
     * Bad names, malformed formulas and circular references give a 400 and change nothing.
     */
    @PutMapping("/{sheetId}/cell/{cellName}")
    public ResponseEntity<List<String>> setCellContents(
            @PathVariable long sheetId,
            @PathVariable String cellName,
            @RequestBody(required = false) String contents
    ) {
        return ResponseEntity.ok(sheetService.setCellContents(sheetId, cellName, contents));
    }

    /**
     * GET /sheet/{sheetId}/cell/{cellName}
     * Returns the contents and value of one cell; never-set cells have empty contents.
     */
    @GetMapping("/{sheetId}/cell/{cellName}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String cellName) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, cellName));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the values of all non-empty cells,
     * in the format: { "A1": 5.0, "B1": "hello", "C1": "#ERROR" }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/cell/{cellName}/dependencies
     * Returns { "dependees": [...cells it reads], "dependents": [...cells reading it] }.
     */
    @GetMapping("/{sheetId}/cell/{cellName}/dependencies")
    public ResponseEntity<Map<String, Set<String>>> getDependencies(@PathVariable long sheetId,
                                                                    @PathVariable String cellName) {
        return ResponseEntity.ok(sheetService.getDependencies(sheetId, cellName));
    }

    /**
     * POST /sheet/{sheetId}/save?fileName=budget
     * Saves to "budget.sprd" in the storage directory and returns the file name.
     * Without fileName the sheet's current file is overwritten.
     */
    @PostMapping("/{sheetId}/save")
    public ResponseEntity<String> saveSheet(@PathVariable long sheetId,
                                            @RequestParam(required = false) String fileName) {
        return ResponseEntity.ok(sheetService.saveSheet(sheetId, fileName));
    }

    /**
     * GET /sheet/{sheetId}/changed
     * True when the sheet has changes that were not saved yet.
     */
    @GetMapping("/{sheetId}/changed")
    public ResponseEntity<Boolean> isChanged(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.isChanged(sheetId));
    }

    /**
     * DELETE /sheet/{sheetId}
     * Closes the sheet. Unsaved changes are discarded.
     */
    @DeleteMapping("/{sheetId}")
    public ResponseEntity<Void> closeSheet(@PathVariable long sheetId) {
        sheetService.closeSheet(sheetId);
        return ResponseEntity.noContent().build();
    }
}

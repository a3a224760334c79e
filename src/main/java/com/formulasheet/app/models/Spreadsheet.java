package com.formulasheet.app.models;

import com.formulasheet.app.exceptions.CircularReferenceException;
import com.formulasheet.app.exceptions.FormulaFormatException;
import com.formulasheet.app.exceptions.InvalidNameException;
import com.formulasheet.app.exceptions.SpreadsheetReadWriteException;
import com.formulasheet.app.formula.Formula;
import com.formulasheet.app.graph.DependencyGraph;
import com.formulasheet.app.persistence.SpreadsheetCodec;
import com.formulasheet.app.persistence.SpreadsheetDocument;
import com.formulasheet.app.persistence.SpreadsheetDocument.StoredCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A single spreadsheet document:
 * - a map of normalized cell name -> Cell (contents + cached value)
 * - a dependency graph saying which cells each formula reads
 * - the name validator, name normalizer and version tag it was created with
 * - a flag telling whether it changed since it was last saved or loaded
 * <p>
 * After every successful {@link #setContentsOfCell}, each cell that depends on the changed
 * one, directly or indirectly, holds a value computed from the new state. A change that would
 * create a cycle is rejected and leaves nothing modified.
 * <p>
 * Not thread-safe: callers serialize mutations (see {@link Sheet}).
 */
public class Spreadsheet {

    private static final Logger log = LoggerFactory.getLogger(Spreadsheet.class);

    private static final Pattern NUMBER_LITERAL = Pattern.compile(
            "[+-]?(?:\\d+\\.\\d*|\\d*\\.\\d+|\\d+)(?:[eE][+-]?\\d+)?");

    private final Map<String, Cell> cells = new LinkedHashMap<>();
    private final DependencyGraph graph = new DependencyGraph();

    private final Predicate<String> isValid;
    private final UnaryOperator<String> normalize;
    private final String version;

    private boolean changed;

    /**
     * An empty spreadsheet accepting every legal name unchanged, version "default".
     */
    public Spreadsheet() {
        this(s -> true, s -> s, "default");
    }

    public Spreadsheet(Predicate<String> isValid, UnaryOperator<String> normalize, String version) {
        this.isValid = Objects.requireNonNull(isValid);
        this.normalize = Objects.requireNonNull(normalize);
        this.version = Objects.requireNonNull(version);
    }

    /**
     * Loads a saved spreadsheet. The file's version must equal {@code version}; every stored
     * cell is then replayed through {@link #setContentsOfCell}, so formulas, dependencies and
     * values are rebuilt and validated exactly as if they had been typed in.
     *
     * @throws SpreadsheetReadWriteException on I/O or JSON errors, a version mismatch,
     *                                       or stored contents that fail validation
     */
    public Spreadsheet(Path file, Predicate<String> isValid, UnaryOperator<String> normalize, String version) {
        this(isValid, normalize, version);

        SpreadsheetDocument document = SpreadsheetCodec.read(file, version);
        Map<String, StoredCell> stored = document.getCells() != null ? document.getCells() : Collections.emptyMap();
        try {
            for (Map.Entry<String, StoredCell> entry : stored.entrySet()) {
                StoredCell cell = entry.getValue();
                if (cell == null || cell.getStringForm() == null) {
                    throw new SpreadsheetReadWriteException("Cell " + entry.getKey() + " has no StringForm");
                }
                setContentsOfCell(entry.getKey(), cell.getStringForm());
            }
        } catch (InvalidNameException | FormulaFormatException | CircularReferenceException e) {
            throw new SpreadsheetReadWriteException("Invalid contents in " + file + ": " + e.getMessage(), e);
        }
        changed = false;
        log.debug("Loaded {} cells from {}", stored.size(), file);
    }

    public String getVersion() {
        return version;
    }

    /**
     * True if this spreadsheet was modified since it was created, saved or loaded.
     */
    public boolean isChanged() {
        return changed;
    }

    /**
     * Sets the contents of a cell and recomputes everything that depends on it.
     * <ul>
     *   <li>text that parses as a finite number, ignoring surrounding whitespace, becomes NUMBER contents;</li>
     *   <li>text starting with "=" becomes a FORMULA built from the rest;</li>
     *   <li>anything else is TEXT (the empty string clears the cell).</li>
     * </ul>
     *
     * @return the changed cell followed by every cell depending on it, directly or indirectly,
     * in an order where each cell comes after all the cells it reads
     * @throws InvalidNameException        if the name is illegal or rejected by the validator
     * @throws FormulaFormatException      if the formula text is malformed
     * @throws CircularReferenceException  if the formula would create a cycle; nothing changes
     */
    public List<String> setContentsOfCell(String name, String content) {
        String cellName = normalizeName(name);
        Objects.requireNonNull(content, "content");

        CellContents contents = parseContents(content);
        List<String> affected;
        switch (contents.getType()) {
            case FORMULA:
                affected = setFormula(cellName, contents);
                break;
            case NUMBER:
            case TEXT:
            default:
                affected = setLiteral(cellName, contents);
                break;
        }

        changed = true;
        recalculate(affected);
        log.debug("Set {} to '{}', recalculated {}", cellName, content, affected);
        return affected;
    }

    /**
     * The contents of the named cell; empty text if it was never set.
     */
    public CellContents getCellContents(String name) {
        Cell cell = cells.get(normalizeName(name));
        return cell != null ? cell.getContents() : CellContents.empty();
    }

    /**
     * The value of the named cell; empty text if it was never set.
     */
    public CellValue getCellValue(String name) {
        Cell cell = cells.get(normalizeName(name));
        return cell != null ? cell.getValue() : CellValue.empty();
    }

    /**
     * Names of all cells whose contents are not the empty string, in creation order.
     */
    public Set<String> getNamesOfAllNonemptyCells() {
        return cells.values().stream()
                .filter(cell -> !cell.isEmpty())
                .map(Cell::getName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Cells whose formulas read the named cell.
     */
    public Set<String> getDirectDependents(String name) {
        return graph.getDependents(normalizeName(name));
    }

    /**
     * Cells the named cell's formula reads.
     */
    public Set<String> getDirectDependees(String name) {
        return graph.getDependees(normalizeName(name));
    }

    /**
     * Writes every non-empty cell and the version tag to {@code file} and clears the changed flag.
     *
     * @throws SpreadsheetReadWriteException if the file cannot be written
     */
    public void save(Path file) {
        Map<String, StoredCell> stored = new LinkedHashMap<>();
        for (Cell cell : cells.values()) {
            if (!cell.isEmpty()) {
                stored.put(cell.getName(), new StoredCell(cell.getContents().getStringForm()));
            }
        }
        SpreadsheetCodec.write(file, new SpreadsheetDocument(stored, version));
        changed = false;
        log.debug("Saved {} cells to {}", stored.size(), file);
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private String normalizeName(String name) {
        if (name == null || !Formula.isVariable(name)) {
            throw new InvalidNameException("Cell name " + name + " is not valid");
        }
        String normalized = normalize.apply(name);
        if (normalized == null || !Formula.isVariable(normalized) || !isValid.test(normalized)) {
            throw new InvalidNameException("Cell name " + name + " is not valid");
        }
        return normalized;
    }

    private CellContents parseContents(String content) {
        String trimmed = content.strip();
        if (NUMBER_LITERAL.matcher(trimmed).matches()) {
            double number = Double.parseDouble(trimmed);
            // an overflowing literal has no numeric string form, so it stays text
            if (Double.isFinite(number)) {
                return CellContents.number(number);
            }
        }
        if (content.startsWith("=")) {
            return CellContents.formula(new Formula(content.substring(1), normalize, isValid));
        }
        return CellContents.text(content);
    }

    private List<String> setFormula(String name, CellContents contents) {
        // Keep the old dependees to roll back if the new ones close a cycle
        Set<String> previous = graph.getDependees(name);
        graph.replaceDependees(name, contents.getFormula().getVariables());

        List<String> order;
        try {
            order = getCellsToRecalculate(name);
        } catch (CircularReferenceException ex) {
            graph.replaceDependees(name, previous);
            throw ex;
        }
        storeContents(name, contents);
        return order;
    }

    private List<String> setLiteral(String name, CellContents contents) {
        graph.replaceDependees(name, Collections.emptySet());
        storeContents(name, contents);
        Cell cell = cells.get(name);
        if (cell != null) {
            cell.setValue(contents.toLiteralValue());
        }
        return getCellsToRecalculate(name);
    }

    private void storeContents(String name, CellContents contents) {
        Cell cell = cells.get(name);
        if (cell != null) {
            cell.setContents(contents);
        } else if (!contents.isEmpty()) {
            cells.put(name, new Cell(name, contents));
        }
    }

    /**
     * Depth-first walk over the dependents of {@code start}. Each cell is prepended once all of
     * its dependents are done, giving a topological order that begins with {@code start}.
     * Reaching a cell that is still on the current path means there is a cycle.
     */
    private List<String> getCellsToRecalculate(String start) {
        LinkedList<String> order = new LinkedList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        Deque<Frame> path = new ArrayDeque<>();

        visited.add(start);
        onPath.add(start);
        path.push(new Frame(start, graph.getDependents(start).iterator()));
        while (!path.isEmpty()) {
            Frame frame = path.peek();
            if (frame.pending.hasNext()) {
                String dependent = frame.pending.next();
                if (onPath.contains(dependent)) {
                    throw new CircularReferenceException("Setting " + start
                            + " would create a circular dependency through " + dependent);
                }
                if (visited.add(dependent)) {
                    onPath.add(dependent);
                    path.push(new Frame(dependent, graph.getDependents(dependent).iterator()));
                }
            } else {
                path.pop();
                onPath.remove(frame.name);
                order.addFirst(frame.name);
            }
        }
        return new ArrayList<>(order);
    }

    // A cell on the current walk and the dependents still to visit from it
    private static final class Frame {
        private final String name;
        private final Iterator<String> pending;

        private Frame(String name, Iterator<String> pending) {
            this.name = name;
            this.pending = pending;
        }
    }

    private void recalculate(List<String> order) {
        for (String name : order) {
            Cell cell = cells.get(name);
            if (cell == null) {
                continue;
            }
            CellContents contents = cell.getContents();
            switch (contents.getType()) {
                case FORMULA:
                    cell.setValue(contents.getFormula().evaluate(this::lookup));
                    break;
                case NUMBER:
                case TEXT:
                    // value always mirrors the contents
                    break;
            }
        }
    }

    /**
     * Numeric value of a cell, for formula evaluation.
     */
    private Double lookup(String name) {
        Cell cell = cells.get(name);
        if (cell != null && cell.getValue().isNumber()) {
            return cell.getValue().getNumber();
        }
        throw new IllegalArgumentException("Cell " + name + " does not have a numeric value.");
    }
}

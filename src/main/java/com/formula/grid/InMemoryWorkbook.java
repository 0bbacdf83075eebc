package com.formula.grid;

import com.formula.exception.FormulaException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Workbook keeping its sheets in insertion order.
 * The first sheet added is active until {@link #setActive(String)} is called.
 */
public class InMemoryWorkbook implements Workbook {

    private final Map<String, View> sheets = new LinkedHashMap<>();
    private String active;

    /**
     * Create an empty sheet and add it to the workbook.
     */
    public InMemorySheet addSheet(String name) {
        InMemorySheet sheet = new InMemorySheet(name);
        addSheet(sheet);
        return sheet;
    }

    public void addSheet(View sheet) {
        if (sheets.containsKey(sheet.name())) {
            throw new FormulaException("Duplicate sheet name: " + sheet.name());
        }
        sheets.put(sheet.name(), sheet);
        if (active == null) {
            active = sheet.name();
        }
    }

    public void setActive(String name) {
        if (!sheets.containsKey(name)) {
            throw new FormulaException("Unknown sheet: " + name);
        }
        this.active = name;
    }

    @Override
    public List<View> sheets() {
        return new ArrayList<>(sheets.values());
    }

    @Override
    public Optional<View> sheet(String name) {
        return Optional.ofNullable(sheets.get(name));
    }

    @Override
    public Optional<View> activeSheet() {
        return active == null ? Optional.empty() : sheet(active);
    }
}

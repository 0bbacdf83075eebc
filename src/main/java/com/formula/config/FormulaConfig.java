package com.formula.config;

import com.formula.parse.ScanMode;

import java.util.Map;

/**
 * Configuration of a formula engine.
 *
 * @param name           Engine name, used in logs
 * @param builtins       Whether the builtin functions are available to formulas
 * @param cycleDetection Whether a circular reference raises an exception; when off it evaluates to {@code #REF!}
 * @param scanMode       Lexer mode used to parse formulas
 * @param constants      Named constants defined on top of the builtins (numbers, text or booleans)
 */
public record FormulaConfig(
        String name,
        boolean builtins,
        boolean cycleDetection,
        ScanMode scanMode,
        Map<String, Object> constants
) {

    public FormulaConfig {
        constants = constants == null ? Map.of() : Map.copyOf(constants);
        scanMode = scanMode == null ? ScanMode.FORMULA : scanMode;
    }

    /**
     * Configuration used when no file is given: builtins on, strict cycle detection, no constants.
     */
    public static FormulaConfig defaults() {
        return new FormulaConfig("default-engine", true, true, ScanMode.FORMULA, Map.of());
    }
}

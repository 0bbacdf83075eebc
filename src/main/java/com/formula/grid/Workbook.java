package com.formula.grid;

import java.util.List;
import java.util.Optional;

/**
 * Ordered collection of named sheets, one of them being active.
 */
public interface Workbook {

    List<View> sheets();

    Optional<View> sheet(String name);

    /**
     * Sheet used for unqualified references.
     */
    Optional<View> activeSheet();
}

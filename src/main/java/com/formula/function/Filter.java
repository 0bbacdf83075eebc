package com.formula.function;

import com.formula.value.Value;

/**
 * Data to aggregate together with the predicate selecting the values that count.
 *
 * @param predicate Test for each value
 * @param source    Value to aggregate, a scalar or an array
 */
public record Filter(Predicate predicate, Value source) {
}

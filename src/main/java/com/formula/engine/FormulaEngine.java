package com.formula.engine;

import com.formula.ast.Expr;
import com.formula.ast.ExprDumper;
import com.formula.config.FormulaConfig;
import com.formula.context.Context;
import com.formula.context.Environment;
import com.formula.context.ReferenceTracker;
import com.formula.context.ScopedContext;
import com.formula.context.WorkbookContext;
import com.formula.eval.Evaluator;
import com.formula.function.Builtins;
import com.formula.grid.Workbook;
import com.formula.parse.FormulaParser;
import com.formula.parse.Grammar;
import com.formula.value.BooleanValue;
import com.formula.value.NumberValue;
import com.formula.value.TextValue;
import com.formula.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Entry point of the formula engine: parses formulas and evaluates them.
 * <p>
 * The engine itself is stateless and can be shared. Every parse uses a fresh parser and
 * every context built by the engine gets its own {@link ReferenceTracker}.
 */
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    private final FormulaConfig config;
    private final Grammar grammar;
    private final Evaluator evaluator;
    private final Environment constants;

    public FormulaEngine() {
        this(FormulaConfig.defaults());
    }

    public FormulaEngine(FormulaConfig config) {
        this.config = config;
        this.grammar = Grammar.formula();
        this.evaluator = new Evaluator();
        this.constants = buildEnvironment(config);
        log.info("Created formula engine: {} with {} names defined", config.name(), countNames());
    }

    public FormulaConfig getConfig() {
        return config;
    }

    /**
     * Parse a formula.
     *
     * @throws com.formula.exception.SyntaxException if the text is not a valid formula
     */
    public Expr parse(String text) {
        Expr expr = new FormulaParser(grammar, config.scanMode()).parse(text);
        if (log.isDebugEnabled()) {
            log.debug("Parsed '{}' as {}", text, ExprDumper.dump(expr));
        }
        return expr;
    }

    public Value evaluate(Expr expr, Context ctx) {
        return evaluator.evaluate(expr, ctx);
    }

    public Value evaluate(String text, Context ctx) {
        return evaluate(parse(text), ctx);
    }

    /**
     * Copy a formula to a cell {@code lines} rows and {@code columns} columns away.
     * Absolute references are kept.
     *
     * @throws com.formula.exception.InvalidAddressException if a reference moves before row or column 1
     */
    public Expr relocate(Expr expr, long lines, long columns) {
        return expr.cloneWithOffset(lines, columns);
    }

    /**
     * Environment holding the builtins (if enabled) and the configured constants.
     */
    public Environment rootEnvironment() {
        return constants;
    }

    /**
     * Default resolution chain for a workbook: the workbook first, then the constants and builtins.
     */
    public Context context(Workbook workbook) {
        return new WorkbookContext(constants, workbook, newTracker(), evaluator);
    }

    /**
     * Fresh scope stack with the root environment at the bottom.
     */
    public ScopedContext scope() {
        ScopedContext scope = new ScopedContext(newTracker(), evaluator);
        scope.push(new Environment(constants));
        return scope;
    }

    private ReferenceTracker newTracker() {
        return new ReferenceTracker(config.cycleDetection());
    }

    private int countNames() {
        int count = constants.names().size();
        if (constants.getParent() instanceof Environment parent) {
            count += parent.names().size();
        }
        return count;
    }

    private static Environment buildEnvironment(FormulaConfig config) {
        Environment root = config.builtins() ? Builtins.environment() : new Environment();
        Environment env = new Environment(root);
        for (Map.Entry<String, Object> entry : config.constants().entrySet()) {
            env.define(entry.getKey(), toValue(entry.getValue()));
        }
        return env;
    }

    private static Value toValue(Object raw) {
        if (raw instanceof Number n) {
            return new NumberValue(n.doubleValue());
        }
        if (raw instanceof Boolean b) {
            return BooleanValue.of(b);
        }
        return new TextValue(String.valueOf(raw));
    }
}

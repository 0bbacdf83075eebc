package com.formula.function;

import com.formula.context.Environment;
import com.formula.value.BooleanValue;
import com.formula.value.FunctionValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Registry of the builtin functions.
 * <p>
 * Every function is registered under its lower-case and upper-case name, so that
 * {@code sum(A1:A3)} and {@code SUM(A1:A3)} both work. The constants {@code true} and
 * {@code false} are registered the same way.
 */
public final class Builtins {

    private static final Logger log = LoggerFactory.getLogger(Builtins.class);

    private Builtins() {
    }

    /**
     * All builtin functions.
     */
    public static List<FunctionValue> functions() {
        List<FunctionValue> list = new ArrayList<>();
        list.addAll(MathFunctions.functions());
        list.addAll(TextFunctions.functions());
        list.addAll(LogicalFunctions.functions());
        list.addAll(InfoFunctions.functions());
        list.addAll(ReducerFunctions.functions());
        return Collections.unmodifiableList(list);
    }

    /**
     * Create a root environment holding every builtin.
     */
    public static Environment environment() {
        Environment env = new Environment();
        register(env);
        return env;
    }

    /**
     * Define every builtin in the given environment.
     */
    public static void register(Environment env) {
        List<FunctionValue> functions = functions();
        for (FunctionValue fn : functions) {
            define(env, fn.name(), fn);
        }
        env.define("true", BooleanValue.TRUE);
        env.define("TRUE", BooleanValue.TRUE);
        env.define("false", BooleanValue.FALSE);
        env.define("FALSE", BooleanValue.FALSE);
        log.debug("Registered {} builtin functions", functions.size());
    }

    private static void define(Environment env, String name, FunctionValue fn) {
        env.define(name.toLowerCase(Locale.ROOT), fn);
        env.define(name.toUpperCase(Locale.ROOT), fn);
    }
}

package com.plotlab.expr.functions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Closed set of functions and constants an expression may reference.
 *
 * A registry is built once and is read-only afterwards; the parser resolves
 * every identifier against it, so nothing outside this table can be reached
 * from expression text.
 */
public final class FunctionRegistry {

    /** Name of the free variable; reserved and never registrable. */
    public static final String VARIABLE = "x";

    /** Numeric implementation of a registered function. */
    public interface NumericFunction {
        /**
         * @throws DomainException when the arguments are outside the function's real domain
         */
        double apply(double[] args);
    }

    public static final class Function {
        public final String name;
        public final int minArity;
        public final int maxArity;
        private final NumericFunction impl;

        Function(String name, int minArity, int maxArity, NumericFunction impl) {
            this.name = name;
            this.minArity = minArity;
            this.maxArity = maxArity;
            this.impl = impl;
        }

        public boolean acceptsArity(int n) {
            return n >= minArity && n <= maxArity;
        }

        public String arityDescription() {
            return minArity == maxArity ? Integer.toString(minArity) : minArity + " to " + maxArity;
        }

        public double apply(double[] args) {
            return impl.apply(args);
        }

        @Override
        public String toString() {
            return name + "/" + arityDescription();
        }
    }

    private static volatile FunctionRegistry standard;

    private final Map<String, Function> functions;
    private final Map<String, Double> constants;

    private FunctionRegistry(Builder b) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(b.functions));
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(b.constants));
    }

    /** The process-wide registry holding {@link MathFunctions}. */
    public static FunctionRegistry standard() {
        FunctionRegistry r = standard;
        if (r == null) {
            synchronized (FunctionRegistry.class) {
                r = standard;
                if (r == null) {
                    Builder b = builder();
                    MathFunctions.register(b);
                    r = b.build();
                    standard = r;
                }
            }
        }
        return r;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Function function(String name) {
        return functions.get(name);
    }

    public boolean isConstant(String name) {
        return constants.containsKey(name);
    }

    public double constant(String name) {
        Double v = constants.get(name);
        if (v == null) throw new IllegalArgumentException("Unknown constant: " + name);
        return v;
    }

    public static final class Builder {
        private final Map<String, Function> functions = new LinkedHashMap<>();
        private final Map<String, Double> constants = new LinkedHashMap<>();

        private Builder() {}

        public Builder function(String name, int arity, NumericFunction impl) {
            return function(name, arity, arity, impl);
        }

        public Builder function(String name, int minArity, int maxArity, NumericFunction impl) {
            checkName(name);
            if (minArity < 1 || maxArity < minArity) {
                throw new IllegalArgumentException("Invalid arity for " + name + ": " + minArity + ".." + maxArity);
            }
            functions.put(name, new Function(name, minArity, maxArity, impl));
            return this;
        }

        public Builder constant(String name, double value) {
            checkName(name);
            constants.put(name, value);
            return this;
        }

        public FunctionRegistry build() {
            return new FunctionRegistry(this);
        }

        private void checkName(String name) {
            if (name == null || name.isEmpty()) throw new IllegalArgumentException("Name must not be empty");
            if (VARIABLE.equals(name)) throw new IllegalArgumentException("'" + VARIABLE + "' is reserved for the variable");
            if (functions.containsKey(name) || constants.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate registration: " + name);
            }
        }
    }
}

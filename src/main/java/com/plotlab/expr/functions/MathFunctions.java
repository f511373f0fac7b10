package com.plotlab.expr.functions;

/**
 * The fixed function and constant set available to expressions.
 *
 * Arguments outside a function's real domain raise {@link DomainException}
 * instead of producing a complex or NaN value; the same rule holds for target
 * formulas and player input, so both are always scored on equal terms.
 *
 * Functions:
 *   sin cos tan asin acos atan
 *   sinh cosh tanh
 *   sqrt log log10 exp
 *   abs floor ceil round
 *   pow
 * Constants:
 *   pi e
 */
public final class MathFunctions {

    private MathFunctions() {}

    public static void register(FunctionRegistry.Builder registry) {

        // ---- trigonometric ----
        registry.function("sin", 1, args -> Math.sin(args[0]));
        registry.function("cos", 1, args -> Math.cos(args[0]));
        registry.function("tan", 1, args -> Math.tan(args[0]));

        registry.function("asin", 1, args -> {
            requireUnitInterval("asin", args[0]);
            return Math.asin(args[0]);
        });

        registry.function("acos", 1, args -> {
            requireUnitInterval("acos", args[0]);
            return Math.acos(args[0]);
        });

        registry.function("atan", 1, args -> Math.atan(args[0]));

        // ---- hyperbolic ----
        registry.function("sinh", 1, args -> Math.sinh(args[0]));
        registry.function("cosh", 1, args -> Math.cosh(args[0]));
        registry.function("tanh", 1, args -> Math.tanh(args[0]));

        // ---- exponential / logarithmic ----
        registry.function("sqrt", 1, args -> {
            if (args[0] < 0) throw new DomainException("sqrt() of negative number");
            return Math.sqrt(args[0]);
        });

        // log(x) or log(x, base)
        registry.function("log", 1, 2, args -> {
            requirePositive("log()", args[0]);
            if (args.length == 1) return Math.log(args[0]);
            double base = args[1];
            requirePositive("log() base", base);
            if (base == 1.0) throw new DomainException("log() base must not be 1");
            return Math.log(args[0]) / Math.log(base);
        });

        registry.function("log10", 1, args -> {
            requirePositive("log10()", args[0]);
            return Math.log10(args[0]);
        });

        registry.function("exp", 1, args -> Math.exp(args[0]));

        // ---- rounding / absolute ----
        registry.function("abs", 1, args -> Math.abs(args[0]));
        registry.function("floor", 1, args -> Math.floor(args[0]));
        registry.function("ceil", 1, args -> Math.ceil(args[0]));
        // half-to-even, so round(2.5) == 2
        registry.function("round", 1, args -> Math.rint(args[0]));

        // ---- power ----
        registry.function("pow", 2, args -> power(args[0], args[1]));

        registry.constant("pi", Math.PI);
        registry.constant("e", Math.E);
    }

    /**
     * Real power shared by {@code pow()} and the {@code **} operator.
     *
     * @throws DomainException for a negative base with a fractional exponent,
     *                         or zero raised to a negative power
     */
    public static double power(double base, double exponent) {
        if (base < 0 && exponent != Math.rint(exponent) && Double.isFinite(exponent)) {
            throw new DomainException("fractional power of negative number");
        }
        if (base == 0 && exponent < 0) {
            throw new DomainException("zero raised to a negative power");
        }
        return Math.pow(base, exponent);
    }

    // ===================== HELPERS =====================

    private static void requirePositive(String what, double v) {
        if (!(v > 0)) {
            throw new DomainException(what + " requires a positive argument, got " + v);
        }
    }

    private static void requireUnitInterval(String fn, double v) {
        if (v < -1.0 || v > 1.0) {
            throw new DomainException(fn + "() argument outside [-1, 1]");
        }
    }
}

package com.lazystream.core;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Addition in the operands' own boxed type. */
final class Numbers {
    private Numbers() {}

    @SuppressWarnings("unchecked")
    static <T extends Number> T add(T a, T b) {
        if (a.getClass() != b.getClass()) {
            throw new IllegalArgumentException(
                "Cannot add " + a.getClass().getSimpleName() + " and " + b.getClass().getSimpleName());
        }
        Number sum;
        if (a instanceof Integer x) sum = x + (Integer) b;
        else if (a instanceof Long x) sum = x + (Long) b;
        else if (a instanceof Double x) sum = x + (Double) b;
        else if (a instanceof Float x) sum = x + (Float) b;
        else if (a instanceof Short x) sum = (short) (x + (Short) b);
        else if (a instanceof Byte x) sum = (byte) (x + (Byte) b);
        else if (a instanceof BigInteger x) sum = x.add((BigInteger) b);
        else if (a instanceof BigDecimal x) sum = x.add((BigDecimal) b);
        else throw new IllegalArgumentException("Unsupported number type: " + a.getClass().getName());
        return (T) sum;
    }
}

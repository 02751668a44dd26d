package ir.value.constants;

import ir.type.IntegerType;
import ir.value.Value;

/**
 * Integer constant of a fixed bit width. The payload is kept sign-extended
 * from the width, so every operation here wraps modulo 2^width.
 */
public class ConstantInt extends Value {
    private final long value;

    public ConstantInt(IntegerType type, long value) {
        super(type, "");
        this.value = signExtend(value, type.getBitWidth());
    }

    public static ConstantInt get(IntegerType type, long value) {
        return new ConstantInt(type, value);
    }

    private static long signExtend(long v, int width) {
        int shift = Long.SIZE - width;
        return (v << shift) >> shift;
    }

    public IntegerType getIntegerType() {
        return (IntegerType) getType();
    }

    public int getBitWidth() {
        return getIntegerType().getBitWidth();
    }

    /** signed value */
    public long getValue() { return value; }

    /** the raw bit pattern, zero extended to 64 bits */
    public long getZExtValue() {
        return value & getIntegerType().getMask();
    }

    public boolean isZero() { return value == 0; }

    /** bit pattern 1, i.e. also i1 true */
    public boolean isOne() { return getZExtValue() == 1; }

    /**
     * power-of-two test on the unsigned bit pattern,
     * so the sign bit alone (e.g. i32 0x80000000) counts
     */
    public boolean isPowerOf2() {
        long bits = getZExtValue();
        return bits != 0 && (bits & (bits - 1)) == 0;
    }

    /**
     * @return log2 of the bit pattern, or -1 if it is not a power of two
     */
    public int exactLogBase2() {
        if (!isPowerOf2()) {
            return -1;
        }
        return Long.numberOfTrailingZeros(getZExtValue());
    }

    /**
     * same width and same bits
     */
    public boolean bitEquals(ConstantInt other) {
        return other != null
            && getBitWidth() == other.getBitWidth()
            && value == other.value;
    }

    private ConstantInt rhsOf(Value other, String op) {
        if (other instanceof ConstantInt rhs && rhs.getBitWidth() == getBitWidth()) {
            return rhs;
        }
        throw new UnsupportedOperationException(op + ": not both ConstantInt of " + getType().toIR());
    }

    public ConstantInt add(Value other) {
        return new ConstantInt(getIntegerType(), this.value + rhsOf(other, "add").value);
    }

    public ConstantInt sub(Value other) {
        return new ConstantInt(getIntegerType(), this.value - rhsOf(other, "sub").value);
    }

    @Override
    public String getReference() {
        return Long.toString(value);
    }

    @Override
    public String toIR() {
        return getType().toIR() + " " + value;
    }
}

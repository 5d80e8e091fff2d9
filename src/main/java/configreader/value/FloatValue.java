package configreader.value;

import java.math.BigDecimal;

public final class FloatValue extends NumberValue {

    private final double value;

    private FloatValue(double value) {
        this.value = value;
    }

    public static FloatValue of(double value) {
        return new FloatValue(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.FLOAT;
    }

    @Override
    public boolean isIntegral() {
        return false;
    }

    @Override
    public long longValue() {
        return (long) value;
    }

    @Override
    public double doubleValue() {
        return value;
    }

    @Override
    public String render() {
        if (Double.isNaN(value)) {
            return "float('nan')";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "float('inf')" : "float('-inf')";
        }
        return format(value);
    }

    @Override
    public String toString() {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return format(value);
    }

    @Override
    public Object toJava() {
        return value;
    }

    // Plain notation between 1e-4 and 1e16, scientific outside.
    static String format(double d) {
        String s = Double.toString(d);
        int exp = s.indexOf('E');
        if (exp < 0) {
            return s;
        }
        int exponent = Integer.parseInt(s.substring(exp + 1));
        if (exponent < -4 || exponent >= 16) {
            return s.substring(0, exp) + "e" + (exponent < 0 ? "" : "+") + exponent;
        }
        String plain = new BigDecimal(s).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }
}

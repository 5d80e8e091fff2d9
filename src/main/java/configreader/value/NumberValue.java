package configreader.value;

/**
 * Common base of {@code bool}, {@code int} and {@code float}. The three share
 * one numeric tower: {@code True == 1 == 1.0}.
 */
public abstract class NumberValue extends Value {

    NumberValue() {
    }

    /**
     * True for {@code int} and {@code bool}.
     */
    public abstract boolean isIntegral();

    public abstract long longValue();

    public abstract double doubleValue();

    @Override
    public boolean isTruthy() {
        return isIntegral() ? longValue() != 0 : doubleValue() != 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumberValue)) {
            return false;
        }
        NumberValue other = (NumberValue) o;
        if (isIntegral() && other.isIntegral()) {
            return longValue() == other.longValue();
        }
        if (!isIntegral() && !other.isIntegral()) {
            return doubleValue() == other.doubleValue();
        }
        long integral = isIntegral() ? longValue() : other.longValue();
        double floating = isIntegral() ? other.doubleValue() : doubleValue();
        return isExactLong(floating) && (long) floating == integral;
    }

    @Override
    public int hashCode() {
        if (isIntegral()) {
            return Long.hashCode(longValue());
        }
        double d = doubleValue();
        return isExactLong(d) ? Long.hashCode((long) d) : Double.hashCode(d);
    }

    static boolean isExactLong(double d) {
        return d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63;
    }
}

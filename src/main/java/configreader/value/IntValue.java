package configreader.value;

public final class IntValue extends NumberValue {

    private final long value;

    private IntValue(long value) {
        this.value = value;
    }

    public static IntValue of(long value) {
        return new IntValue(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.INT;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public long longValue() {
        return value;
    }

    @Override
    public double doubleValue() {
        return value;
    }

    @Override
    public String render() {
        return Long.toString(value);
    }

    @Override
    public Object toJava() {
        return value;
    }
}

package configreader.value;

public final class BoolValue extends NumberValue {

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    private final boolean value;

    private BoolValue(boolean value) {
        this.value = value;
    }

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.BOOL;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public long longValue() {
        return value ? 1L : 0L;
    }

    @Override
    public double doubleValue() {
        return value ? 1.0 : 0.0;
    }

    @Override
    public String render() {
        return value ? "True" : "False";
    }

    @Override
    public Object toJava() {
        return value;
    }
}

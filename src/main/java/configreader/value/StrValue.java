package configreader.value;

import java.util.Objects;

public final class StrValue extends Value {

    private final String value;

    private StrValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static StrValue of(String value) {
        return new StrValue(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.STR;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public String render() {
        return quote(value);
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StrValue && ((StrValue) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    static String quote(String s) {
        StringBuilder out = new StringBuilder(s.length() + 2).append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\':
                    out.append("\\\\");
                    break;
                case '\'':
                    out.append("\\'");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\r':
                    out.append("\\r");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
                    break;
            }
        }
        return out.append('\'').toString();
    }
}

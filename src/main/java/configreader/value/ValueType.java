package configreader.value;

public enum ValueType {
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    STR("str"),
    LIST("list"),
    SET("set"),
    MAP("dict"),
    SEQUENCE("sequence");

    private final String typeName;

    ValueType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}

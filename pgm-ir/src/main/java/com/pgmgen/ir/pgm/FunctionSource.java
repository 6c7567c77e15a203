package com.pgmgen.ir.pgm;

/**
 * assign 函数的来源项：变量名或被调函数名
 */
public final class FunctionSource {

    public enum SourceType {
        VARIABLE("variable"),
        FUNCTION("function");

        private final String jsonName;

        SourceType(String jsonName) {
            this.jsonName = jsonName;
        }

        public String getJsonName() {
            return jsonName;
        }
    }

    private final String name;
    private final SourceType type;

    public FunctionSource(String name, SourceType type) {
        this.name = name;
        this.type = type;
    }

    public static FunctionSource variable(String name) {
        return new FunctionSource(name, SourceType.VARIABLE);
    }

    public static FunctionSource function(String name) {
        return new FunctionSource(name, SourceType.FUNCTION);
    }

    public String getName() {
        return name;
    }

    public SourceType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionSource)) return false;
        FunctionSource that = (FunctionSource) o;
        return type == that.type && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + type.hashCode();
    }

    @Override
    public String toString() {
        return type.getJsonName() + ":" + name;
    }
}

package com.pgmgen.ir.pgm;

/**
 * 容器的参数或变量。domain 未知时为 null。
 */
public final class TypedVariable {
    private final String name;
    private final Domain domain;

    public TypedVariable(String name, Domain domain) {
        this.name = name;
        this.domain = domain;
    }

    public String getName() {
        return name;
    }

    public Domain getDomain() {
        return domain;
    }

    public boolean hasDomain() {
        return domain != null;
    }

    @Override
    public String toString() {
        return domain != null ? name + ": " + domain : name;
    }
}

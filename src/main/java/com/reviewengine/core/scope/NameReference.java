package com.reviewengine.core.scope;

import java.util.Objects;

/**
 * One read of an identifier at a source line.
 */
public final class NameReference {

    private final String name;
    private final int line;

    public NameReference(String name, int line) {
        this.name = name;
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NameReference)) return false;
        NameReference other = (NameReference) o;
        return line == other.line && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, line);
    }

    @Override
    public String toString() {
        return name + "@" + line;
    }
}

package com.pgslang.compiler.ast.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 以 :: 分隔的限定名，如 root::math::add
 */
public final class QualifiedName {
    public static final String SEPARATOR = "::";

    private final List<String> parts;

    public QualifiedName(List<String> parts) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Qualified name must have at least one part");
        }
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public static QualifiedName of(String... parts) {
        List<String> list = new ArrayList<>(parts.length);
        Collections.addAll(list, parts);
        return new QualifiedName(list);
    }

    public List<String> getParts() {
        return parts;
    }

    public int size() {
        return parts.size();
    }

    public boolean isSimple() {
        return parts.size() == 1;
    }

    public String getFirst() {
        return parts.get(0);
    }

    public String getLast() {
        return parts.get(parts.size() - 1);
    }

    public String getFullName() {
        return String.join(SEPARATOR, parts);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof QualifiedName && ((QualifiedName) o).parts.equals(parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return getFullName();
    }
}

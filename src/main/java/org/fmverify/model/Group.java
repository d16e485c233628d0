package org.fmverify.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Gruppo strutturale: vincolo sui figli di un padre secondo la sua tipologia.
 * I figli sono mantenuti nell'ordine di inserimento, senza duplicati.
 */
public final class Group {

    private final String parent;
    private final GroupKind kind;
    private final List<String> children;

    public Group(String parent, GroupKind kind, List<String> children) {
        if (parent == null || parent.isBlank()) {
            throw new IllegalArgumentException("Padre del gruppo non può essere null o vuoto");
        }
        this.parent = parent;
        this.kind = Objects.requireNonNull(kind, "Tipologia gruppo non può essere null");
        this.children = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(children)));
    }

    public String getParent() {
        return parent;
    }

    public GroupKind getKind() {
        return kind;
    }

    public List<String> getChildren() {
        return children;
    }

    public boolean contains(String feature) {
        return children.contains(feature);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Group)) return false;
        Group other = (Group) o;
        return parent.equals(other.parent) && kind == other.kind && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parent, kind, children);
    }

    @Override
    public String toString() {
        return parent + " " + kind.getKeyword() + children;
    }
}

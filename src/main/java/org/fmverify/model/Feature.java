package org.fmverify.model;

import java.util.Objects;

/**
 * Feature del modello: punto di decisione booleano con nome, flag di astrattezza
 * e riferimento debole (per nome) al padre. La radice non ha padre.
 */
public final class Feature {

    private final String name;
    private final boolean isAbstract;
    private final String parent;

    public Feature(String name, boolean isAbstract, String parent) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nome feature non può essere null o vuoto");
        }
        this.name = name;
        this.isAbstract = isAbstract;
        this.parent = parent;
    }

    public String getName() {
        return name;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    /**
     * @return nome del padre, null per la radice
     */
    public String getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Feature)) return false;
        Feature other = (Feature) o;
        return isAbstract == other.isAbstract && name.equals(other.name) && Objects.equals(parent, other.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, isAbstract, parent);
    }

    @Override
    public String toString() {
        return name + (isAbstract ? " {abstract}" : "") + (parent == null ? "" : " <- " + parent);
    }
}

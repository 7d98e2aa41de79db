package com.example.contractlens.domain;

/**
 * An entity that is looked up by name when two models are compared.
 */
public interface Named {
    String name();

    /** Key used for name-keyed lookups; defaults to the declared name. */
    default String key() {
        return name();
    }
}

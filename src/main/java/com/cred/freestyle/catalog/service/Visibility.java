package com.cred.freestyle.catalog.service;

/**
 * How an actor may see an aggregate, in order of precedence.
 *
 * @author Catalog Team
 */
public enum Visibility {
    OWNED,
    PUBLIC,
    ORGANIZATIONAL,
    NONE;

    public boolean isVisible() {
        return this != NONE;
    }
}

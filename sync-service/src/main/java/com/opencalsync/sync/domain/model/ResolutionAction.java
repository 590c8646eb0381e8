package com.opencalsync.sync.domain.model;

/**
 * How the losing members of a conflict are removed during resolution.
 */
public enum ResolutionAction {
    DELETE,
    DEACTIVATE
}

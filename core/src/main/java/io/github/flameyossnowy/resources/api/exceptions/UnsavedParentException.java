package io.github.flameyossnowy.resources.api.exceptions;

import io.github.flameyossnowy.resources.api.relationship.Relationship;
import io.github.flameyossnowy.resources.api.resource.Resource;

/**
 * Thrown when an association is read from a parent that was never saved, so no
 * key exists to look its children up by.
 */
public class UnsavedParentException extends RuntimeException {
    private final transient Relationship relationship;

    public UnsavedParentException(Relationship relationship, Resource parent) {
        super("Cannot read relationship '" + relationship.name() + "' of an unsaved " + parent.model().name());
        this.relationship = relationship;
    }

    public Relationship getRelationship() {
        return relationship;
    }
}

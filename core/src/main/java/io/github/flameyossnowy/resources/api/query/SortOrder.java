package io.github.flameyossnowy.resources.api.query;

public enum SortOrder {
    ASC,
    DESC
}

package io.github.flameyossnowy.resources.api.query;

/**
 * Keys of the option maps accepted by {@link Query#Query} and {@link Query#update}.
 * <ul>
 *     <li>{@code FIELDS} - property names or {@code Property} instances</li>
 *     <li>{@code LINKS} - relationship names or {@code Relationship} instances</li>
 *     <li>{@code CONDITIONS} - {@code Condition} instances</li>
 *     <li>{@code ORDER} - {@code Direction} instances</li>
 *     <li>{@code LIMIT}, {@code OFFSET} - integers</li>
 *     <li>{@code RELOAD} - boolean, overwrite already loaded clean attributes</li>
 * </ul>
 */
public enum QueryOption {
    FIELDS,
    LINKS,
    CONDITIONS,
    ORDER,
    LIMIT,
    OFFSET,
    RELOAD
}

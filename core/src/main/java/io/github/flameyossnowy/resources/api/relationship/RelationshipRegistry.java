package io.github.flameyossnowy.resources.api.relationship;

import io.github.flameyossnowy.resources.api.meta.Model;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Relationships declared on one model, kept per repository name. A repository
 * other than the model's default starts as a copy of the default declarations.
 */
public final class RelationshipRegistry {
    private final Model owner;
    private final Map<String, Map<String, Relationship>> relationships = new ConcurrentHashMap<>();

    @ApiStatus.Internal
    public RelationshipRegistry(@NotNull Model owner) {
        this.owner = owner;
    }

    public @NotNull Map<String, Relationship> relationships(@NotNull String repositoryName) {
        return Collections.unmodifiableMap(declarations(repositoryName));
    }

    public @Nullable Relationship get(@NotNull String repositoryName, @NotNull String name) {
        return declarations(repositoryName).get(name);
    }

    /**
     * Declares a relationship where the owner is the parent. Cardinality and the
     * presence of {@code through} pick the variant: a through relationship makes a
     * {@link ManyToMany}, a max above one a {@link OneToMany}, anything else a
     * {@link OneToOne}.
     *
     * @throws IllegalArgumentException if {@code through} names an unknown relationship
     */
    public @NotNull Relationship has(@NotNull Cardinality cardinality, @NotNull String name, @NotNull RelationshipOptions options) {
        return has(owner.defaultRepositoryName(), cardinality, name, options);
    }

    /**
     * Same as {@link #has(Cardinality, String, RelationshipOptions)}, but only visible
     * within {@code repositoryName}.
     */
    public @NotNull Relationship has(@NotNull String repositoryName, @NotNull Cardinality cardinality,
                                     @NotNull String name, @NotNull RelationshipOptions options) {
        Relationship through = resolveThrough(repositoryName, options);

        Relationship.Definition definition = new Relationship.Definition(
            name,
            ModelReference.of(owner),
            target(name, options, cardinality.max() > 1),
            cardinality,
            through,
            repositoryName,
            options.repository() != null ? options.repository() : repositoryName,
            options.parentKey(),
            options.childKey(),
            owner.registry()
        );

        Relationship relationship;
        if (through != null) {
            relationship = new ManyToMany(definition);
        } else if (cardinality.max() > 1) {
            relationship = new OneToMany(definition);
        } else {
            relationship = new OneToOne(definition);
        }
        return declare(repositoryName, relationship);
    }

    /**
     * Declares a relationship where the owner is the child, holding the key of one
     * parent.
     */
    public @NotNull ManyToOne belongsTo(@NotNull String name, @NotNull RelationshipOptions options) {
        return belongsTo(owner.defaultRepositoryName(), name, options);
    }

    public @NotNull ManyToOne belongsTo(@NotNull String repositoryName, @NotNull String name, @NotNull RelationshipOptions options) {
        if (options.hasThrough()) {
            throw new IllegalArgumentException("belongsTo '" + name + "' in " + owner + " cannot go through another relationship");
        }

        ManyToOne relationship = new ManyToOne(new Relationship.Definition(
            name,
            target(name, options, false),
            ModelReference.of(owner),
            Cardinality.range(0, 1),
            null,
            options.repository() != null ? options.repository() : repositoryName,
            repositoryName,
            options.parentKey(),
            options.childKey(),
            owner.registry()
        ));
        return (ManyToOne) declare(repositoryName, relationship);
    }

    /**
     * Copies every declaration for a subclass of the owner, pointing references to the
     * owner at the subclass. Through relationships are remapped to their copies.
     */
    @ApiStatus.Internal
    public @NotNull RelationshipRegistry cloneFor(@NotNull Model subclass) {
        RelationshipRegistry clone = new RelationshipRegistry(subclass);
        for (Map.Entry<String, Map<String, Relationship>> entry : relationships.entrySet()) {
            Map<String, Relationship> copies = clone.declarations(entry.getKey());
            synchronized (entry.getValue()) {
                for (Relationship relationship : entry.getValue().values()) {
                    Relationship through = relationship.through() == null ? null : copies.get(relationship.through().name());
                    copies.put(relationship.name(), relationship.cloneFor(subclass, owner, through));
                }
            }
        }
        return clone;
    }

    private Relationship declare(String repositoryName, Relationship relationship) {
        Map<String, Relationship> declarations = declarations(repositoryName);
        synchronized (declarations) {
            declarations.put(relationship.name(), relationship);
        }
        for (Model descendant : owner.descendants()) {
            RelationshipRegistry registry = descendant.relationships();
            Relationship through = relationship.through() == null
                ? null
                : registry.get(repositoryName, relationship.through().name());
            registry.declare(repositoryName, relationship.cloneFor(descendant, owner, through));
        }
        return relationship;
    }

    private Map<String, Relationship> declarations(String repositoryName) {
        String defaultName = owner.defaultRepositoryName();
        Map<String, Relationship> existing = relationships.get(repositoryName);
        if (existing != null) {
            return existing;
        }
        Map<String, Relationship> defaults = relationships.computeIfAbsent(defaultName, ignored -> new LinkedHashMap<>());
        if (repositoryName.equals(defaultName)) {
            return defaults;
        }
        return relationships.computeIfAbsent(repositoryName, ignored -> {
            synchronized (defaults) {
                return new LinkedHashMap<>(defaults);
            }
        });
    }

    private @Nullable Relationship resolveThrough(String repositoryName, RelationshipOptions options) {
        if (options.through() != null) {
            return options.through();
        }
        String throughName = options.throughName();
        if (throughName == null) {
            return null;
        }

        Relationship through = get(repositoryName, throughName);
        if (through == null) {
            throw new IllegalArgumentException(
                "through refers to an unknown relationship " + throughName + " in " + owner + " within the " + repositoryName + " repository");
        }
        return through;
    }

    private static ModelReference target(String name, RelationshipOptions options, boolean plural) {
        if (options.model() != null) {
            return ModelReference.of(options.model());
        }
        if (options.modelName() != null) {
            return ModelReference.deferred(options.modelName());
        }
        return ModelReference.deferred(modelName(name, plural));
    }

    /**
     * {@code order_lines} becomes {@code OrderLine}; {@code category} becomes {@code Category}.
     */
    static @NotNull String modelName(@NotNull String relationshipName, boolean plural) {
        String singular = relationshipName;
        if (plural) {
            if (singular.endsWith("ies") && singular.length() > 3) {
                singular = singular.substring(0, singular.length() - 3) + 'y';
            } else if (singular.endsWith("s") && singular.length() > 1) {
                singular = singular.substring(0, singular.length() - 1);
            }
        }

        StringBuilder builder = new StringBuilder(singular.length());
        boolean upper = true;
        for (int i = 0; i < singular.length(); i++) {
            char c = singular.charAt(i);
            if (c == '_') {
                upper = true;
            } else {
                builder.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return builder.toString();
    }
}

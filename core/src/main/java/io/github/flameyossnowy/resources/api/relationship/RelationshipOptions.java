package io.github.flameyossnowy.resources.api.relationship;

import io.github.flameyossnowy.resources.api.meta.Model;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Options of a relationship declaration.
 *
 * @param model the target model, when it is already declared
 * @param modelName the target model's name, resolved on first use
 * @param throughName the relationship a many-to-many goes through, by name
 * @param through the relationship a many-to-many goes through
 * @param repository the repository of the far side
 * @param childKey child key property names overriding the derived ones
 * @param parentKey parent key property names overriding the parent model's key
 */
public record RelationshipOptions(
    @Nullable Model model,
    @Nullable String modelName,
    @Nullable String throughName,
    @Nullable Relationship through,
    @Nullable String repository,
    @Nullable List<String> childKey,
    @Nullable List<String> parentKey
) {
    private static final RelationshipOptions NONE = new RelationshipOptions(null, null, null, null, null, null, null);

    public static @NotNull RelationshipOptions none() {
        return NONE;
    }

    public static @NotNull Builder builder() {
        return new Builder();
    }

    public boolean hasThrough() {
        return through != null || throughName != null;
    }

    public static final class Builder {
        private Model model;
        private String modelName;
        private String throughName;
        private Relationship through;
        private String repository;
        private List<String> childKey;
        private List<String> parentKey;

        private Builder() {
        }

        @Contract("_ -> this")
        public Builder model(@NotNull Model model) {
            this.model = model;
            this.modelName = null;
            return this;
        }

        /**
         * Names a model that may not be declared yet.
         */
        @Contract("_ -> this")
        public Builder model(@NotNull String modelName) {
            this.modelName = modelName;
            this.model = null;
            return this;
        }

        @Contract("_ -> this")
        public Builder through(@NotNull String relationshipName) {
            this.throughName = relationshipName;
            this.through = null;
            return this;
        }

        @Contract("_ -> this")
        public Builder through(@NotNull Relationship relationship) {
            this.through = relationship;
            this.throughName = null;
            return this;
        }

        @Contract("_ -> this")
        public Builder repository(@NotNull String repositoryName) {
            this.repository = repositoryName;
            return this;
        }

        @Contract("_ -> this")
        public Builder childKey(@NotNull String... names) {
            this.childKey = keyNames("childKey", names);
            return this;
        }

        @Contract("_ -> this")
        public Builder parentKey(@NotNull String... names) {
            this.parentKey = keyNames("parentKey", names);
            return this;
        }

        public RelationshipOptions build() {
            return new RelationshipOptions(model, modelName, throughName, through, repository, childKey, parentKey);
        }

        private static List<String> keyNames(String option, String[] names) {
            if (names.length == 0) {
                throw new IllegalArgumentException(option + " needs at least one property name");
            }
            return List.of(names);
        }
    }
}

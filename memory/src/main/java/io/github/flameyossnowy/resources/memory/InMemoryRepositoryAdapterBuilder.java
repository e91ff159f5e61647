package io.github.flameyossnowy.resources.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Objects;

public class InMemoryRepositoryAdapterBuilder {
    private String name = "memory";
    private ObjectMapper objectMapper;

    InMemoryRepositoryAdapterBuilder() {
    }

    /**
     * The name reported in errors.
     */
    public InMemoryRepositoryAdapterBuilder withName(String name) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        return this;
    }

    /**
     * The mapper converting attribute values to and from stored JSON.
     */
    public InMemoryRepositoryAdapterBuilder withObjectMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
        return this;
    }

    public InMemoryRepositoryAdapter build() {
        ObjectMapper mapper = objectMapper;
        if (mapper == null) {
            mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        }
        return new InMemoryRepositoryAdapter(name, mapper);
    }
}

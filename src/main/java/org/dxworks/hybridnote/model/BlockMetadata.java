package org.dxworks.hybridnote.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive data a parser derives from a block: heading level, id, TODO state and
 * ordered properties. Immutable; use the {@code with*} methods to derive a changed copy.
 */
public final class BlockMetadata {

    private static final BlockMetadata EMPTY = new BlockMetadata(null, null, null, Map.of());

    private final Integer headingLevel; // nullable, >= 1
    private final String id; // nullable
    private final String todoState; // nullable
    private final Map<String, String> properties;

    private BlockMetadata(Integer headingLevel, String id, String todoState, Map<String, String> properties) {
        if (headingLevel != null && headingLevel < 1) {
            throw new IllegalArgumentException("Heading level must be >= 1, was " + headingLevel);
        }
        this.headingLevel = headingLevel;
        this.id = id;
        this.todoState = todoState;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static BlockMetadata empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Integer getHeadingLevel() {
        return headingLevel;
    }

    public String getId() {
        return id;
    }

    public String getTodoState() {
        return todoState;
    }

    /**
     * Properties in the order the parser found them.
     */
    public Map<String, String> getProperties() {
        return properties;
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    public boolean isEmpty() {
        return headingLevel == null && id == null && todoState == null && properties.isEmpty();
    }

    public BlockMetadata withHeadingLevel(Integer level) {
        return new BlockMetadata(level, id, todoState, properties);
    }

    public BlockMetadata withId(String newId) {
        return new BlockMetadata(headingLevel, newId, todoState, properties);
    }

    public BlockMetadata withTodoState(String state) {
        return new BlockMetadata(headingLevel, id, state, properties);
    }

    public BlockMetadata withProperty(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Map<String, String> copy = new LinkedHashMap<>(properties);
        copy.put(key, value);
        return new BlockMetadata(headingLevel, id, todoState, copy);
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .headingLevel(headingLevel)
                .id(id)
                .todoState(todoState);
        properties.forEach(builder::property);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockMetadata other)) return false;
        return Objects.equals(headingLevel, other.headingLevel)
                && Objects.equals(id, other.id)
                && Objects.equals(todoState, other.todoState)
                && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(headingLevel, id, todoState, properties);
    }

    @Override
    public String toString() {
        return "BlockMetadata{headingLevel=" + headingLevel + ", id=" + id
                + ", todoState=" + todoState + ", properties=" + properties + "}";
    }

    public static final class Builder {
        private Integer headingLevel;
        private String id;
        private String todoState;
        private final Map<String, String> properties = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder headingLevel(Integer level) {
            this.headingLevel = level;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder todoState(String todoState) {
            this.todoState = todoState;
            return this;
        }

        public Builder property(String key, String value) {
            properties.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public BlockMetadata build() {
            if (headingLevel == null && id == null && todoState == null && properties.isEmpty()) {
                return EMPTY;
            }
            return new BlockMetadata(headingLevel, id, todoState, properties);
        }
    }
}

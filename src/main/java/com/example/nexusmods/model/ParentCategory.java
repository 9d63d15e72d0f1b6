package com.example.nexusmods.model;

import com.example.nexusmods.codec.ParentCategoryCodec;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.OptionalInt;

/**
 * Parent reference of a {@link GameCategory}.
 * <p>
 * On the wire this is either a category id or the literal {@code false}.
 * {@code 0} is a valid id, so the absence of a parent is its own variant
 * rather than a null or zero.
 */
@JsonDeserialize(using = ParentCategoryCodec.Deserializer.class)
@JsonSerialize(using = ParentCategoryCodec.Serializer.class)
public sealed interface ParentCategory {

    static ParentCategory of(int categoryId) {
        return new Parent(categoryId);
    }

    static ParentCategory none() {
        return NoParent.INSTANCE;
    }

    /**
     * Id of the parent category, empty for top-level categories.
     */
    OptionalInt parentId();

    record Parent(int categoryId) implements ParentCategory {
        public Parent {
            if (categoryId < 0) {
                throw new IllegalArgumentException("Category id must be non-negative: " + categoryId);
            }
        }

        @Override
        public OptionalInt parentId() {
            return OptionalInt.of(categoryId);
        }
    }

    record NoParent() implements ParentCategory {
        static final NoParent INSTANCE = new NoParent();

        @Override
        public OptionalInt parentId() {
            return OptionalInt.empty();
        }
    }
}

package org.neuralchilli.chadoxml.domain;

import java.util.List;

/**
 * Shared argument checks for entity records.
 */
final class Entities {

    private Entities() {
    }

    static String requireId(String id, String type) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(type + " id cannot be null or empty");
        }
        return id;
    }

    static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}

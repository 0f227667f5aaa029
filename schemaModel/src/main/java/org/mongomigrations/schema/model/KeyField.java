package org.mongomigrations.schema.model;

/**
 * One entry of a key specification: a field path with either a sort direction
 * (1 / -1) or a special index type such as {@code text}, {@code 2dsphere} or {@code hashed}.
 */
public record KeyField(
    String path,
    Integer direction,
    String type
) {

    public KeyField {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Key field path must not be empty");
        }
        if ((direction == null) == (type == null)) {
            throw new IllegalArgumentException(
                "Key field '" + path + "' must have exactly one of a direction or an index type");
        }
        if (direction != null && direction == 0) {
            throw new IllegalArgumentException("Key field '" + path + "' has a zero direction");
        }
        if (type != null && !type.matches("[A-Za-z0-9]+")) {
            throw new IllegalArgumentException("Key field '" + path + "' has an invalid index type: " + type);
        }
    }

    public static KeyField ascending(String path) {
        return new KeyField(path, 1, null);
    }

    public static KeyField descending(String path) {
        return new KeyField(path, -1, null);
    }

    public static KeyField ofType(String path, String type) {
        return new KeyField(path, null, type);
    }

    public boolean isDirectional() {
        return direction != null;
    }
}

package im.arun.jsonnav.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One step of a {@link NodePath}: either an object property name or an array index.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PathSegment {
    String name;
    int index;

    public static PathSegment name(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Property name must not be null");
        }
        return new PathSegment(name, -1);
    }

    public static PathSegment index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Array index must not be negative: " + index);
        }
        return new PathSegment(null, index);
    }

    public boolean isIndex() {
        return name == null;
    }

    /**
     * Display label used for tree nodes: the property name, or {@code [i]} for array elements.
     */
    public String label() {
        return isIndex() ? "[" + index + "]" : name;
    }

    @Override
    public String toString() {
        return label();
    }
}

package fr.lapetina.config.binder;

import java.lang.reflect.Type;
import java.util.List;

/**
 * How a target type is rebuilt from flattened configuration keys.
 *
 * Shapes reference nested types rather than nested shapes, so recursive types resolve
 * lazily while binding.
 */
public interface TypeShape {

    /**
     * A single value parsed from a string.
     */
    record Scalar(Class<?> type) implements TypeShape {
    }

    /**
     * An {@code Optional} around another shape.
     */
    record OptionalValue(Type valueType) implements TypeShape {
    }

    /**
     * A collection or array filled from indexed children.
     */
    record Sequence(Class<?> containerType, Type elementType) implements TypeShape {
    }

    /**
     * A map filled from every child.
     */
    record Mapping(Class<?> mapType, Class<?> keyType, Type valueType) implements TypeShape {
    }

    /**
     * A record or a mutable class whose properties bind to child keys.
     */
    record Structure(Class<?> type, List<Property> properties, boolean immutable) implements TypeShape {
        public Structure {
            properties = List.copyOf(properties);
        }
    }

    /**
     * A type the binder cannot handle.
     */
    record Unsupported(Type type, String reason) implements TypeShape {
    }
}

package fr.lapetina.config.binder;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves and caches the {@link TypeShape} of target types by reflection.
 *
 * Resolution order:
 * - {@code Optional<T>}
 * - Types known to {@link ValueParsers}
 * - Arrays and collections
 * - Maps
 * - Records
 * - Concrete classes with a no-argument constructor
 *
 * Static, transient and final fields of classes are not bound.
 */
final class TypeShapes {

    private final ValueParsers valueParsers;
    private final Map<Type, TypeShape> cache = new ConcurrentHashMap<>();

    TypeShapes(ValueParsers valueParsers) {
        this.valueParsers = Objects.requireNonNull(valueParsers, "valueParsers");
    }

    TypeShape resolve(Type type) {
        return cache.computeIfAbsent(type, this::inspect);
    }

    private TypeShape inspect(Type type) {
        Class<?> raw = rawType(type);
        if (raw == null) {
            return new TypeShape.Unsupported(type, "generic type variables cannot be bound");
        }
        if (raw == Optional.class) {
            return new TypeShape.OptionalValue(typeArgument(type, 0));
        }
        if (valueParsers.supports(raw)) {
            return new TypeShape.Scalar(raw);
        }
        if (raw.isArray()) {
            Type component = type instanceof GenericArrayType
                    ? ((GenericArrayType) type).getGenericComponentType()
                    : raw.getComponentType();
            return new TypeShape.Sequence(raw, component);
        }
        if (Collection.class.isAssignableFrom(raw)) {
            return new TypeShape.Sequence(raw, typeArgument(type, 0));
        }
        if (Map.class.isAssignableFrom(raw)) {
            Class<?> keyType = rawType(typeArgument(type, 0));
            if (keyType == null) {
                return new TypeShape.Unsupported(type, "map key type is not a class");
            }
            return new TypeShape.Mapping(raw, keyType, typeArgument(type, 1));
        }
        if (raw.isRecord()) {
            return recordShape(raw);
        }
        if (raw.isPrimitive() || raw.isInterface() || Modifier.isAbstract(raw.getModifiers())
                || raw == Object.class) {
            return new TypeShape.Unsupported(type, "no value parser or structure for " + raw.getName());
        }
        return classShape(raw);
    }

    private static TypeShape recordShape(Class<?> type) {
        List<Property> properties = new ArrayList<>();
        for (RecordComponent component : type.getRecordComponents()) {
            properties.add(Property.ofComponent(
                    component.getName(),
                    keyOf(component.getName(), component.getAnnotation(ConfigurationKey.class)),
                    component.getGenericType(),
                    component.isAnnotationPresent(Required.class),
                    component.getAccessor()));
        }
        return new TypeShape.Structure(type, properties, true);
    }

    private static TypeShape classShape(Class<?> type) {
        List<Property> properties = new ArrayList<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers)
                        || Modifier.isFinal(modifiers) || field.isSynthetic()) {
                    continue;
                }
                properties.add(Property.ofField(
                        keyOf(field.getName(), field.getAnnotation(ConfigurationKey.class)),
                        field.isAnnotationPresent(Required.class),
                        field,
                        findSetter(current, field)));
            }
        }
        return new TypeShape.Structure(type, properties, false);
    }

    private static String keyOf(String name, ConfigurationKey annotation) {
        return annotation == null ? name : annotation.value();
    }

    private static Method findSetter(Class<?> owner, Field field) {
        String name = field.getName();
        String setterName = "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
        try {
            return owner.getDeclaredMethod(setterName, field.getType());
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    static Constructor<?> noArgConstructor(Class<?> type) throws NoSuchMethodException {
        Constructor<?> constructor = type.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor;
    }

    static Constructor<?> canonicalConstructor(Class<?> recordType) throws NoSuchMethodException {
        RecordComponent[] components = recordType.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
        }
        Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
        constructor.setAccessible(true);
        return constructor;
    }

    /**
     * Returns the class behind a type, or {@code null} for type variables.
     */
    static Class<?> rawType(Type type) {
        if (type instanceof Class<?>) {
            return (Class<?>) type;
        }
        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        if (type instanceof GenericArrayType) {
            Class<?> component = rawType(((GenericArrayType) type).getGenericComponentType());
            return component == null ? null : component.arrayType();
        }
        if (type instanceof WildcardType) {
            return rawType(((WildcardType) type).getUpperBounds()[0]);
        }
        return null;
    }

    /**
     * Returns a type argument, defaulting to {@code String} for raw types.
     */
    private static Type typeArgument(Type type, int index) {
        if (type instanceof ParameterizedType) {
            Type argument = ((ParameterizedType) type).getActualTypeArguments()[index];
            return argument instanceof WildcardType ? ((WildcardType) argument).getUpperBounds()[0] : argument;
        }
        return String.class;
    }
}

package fr.lapetina.config.binder;

import com.fasterxml.jackson.core.type.TypeReference;
import fr.lapetina.config.domain.exception.BindException;
import fr.lapetina.config.domain.exception.BindException.BindFailure;
import fr.lapetina.config.domain.model.ConfigurationKeyComparator;
import fr.lapetina.config.tree.Configuration;
import fr.lapetina.config.tree.ConfigurationSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rebuilds typed values from configuration keys.
 *
 * Binding rules:
 * - Scalars are parsed from the value at their key
 * - Sequences take the children whose key is an unsigned integer, sorted numerically and
 *   renumbered from 0, so {@code 0, 1, 4} fill positions {@code 0, 1, 2}
 * - Maps take every child, keys decoded with {@link MapKeyCodec}
 * - Records and mutable classes bind each property to the child key of the same name,
 *   ignoring case
 *
 * Binding into an existing instance is a deep merge: keys absent from the configuration
 * leave the current values untouched. Assignments are staged and only applied once the
 * whole bind succeeded, so a failed bind leaves the target unchanged.
 *
 * Two index keys with the same numeric value, such as {@code 1} and {@code 01}, are
 * ordered by their text and the first one wins; the others are skipped with a warning.
 */
public final class ConfigurationBinder {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationBinder.class);

    private static final Comparator<ConfigurationSection> INDEX_ORDER =
            Comparator.<ConfigurationSection, String>comparing(ConfigurationSection::getKey,
                            ConfigurationKeyComparator::compareUnsignedIntegers)
                    .thenComparing(ConfigurationSection::getKey);

    private final ValueParsers valueParsers;
    private final MapKeyCodec mapKeyCodec;
    private final TypeShapes typeShapes;

    public ConfigurationBinder() {
        this(ValueParsers.defaults());
    }

    public ConfigurationBinder(ValueParsers valueParsers) {
        this.valueParsers = Objects.requireNonNull(valueParsers, "valueParsers");
        this.mapKeyCodec = new MapKeyCodec(valueParsers);
        this.typeShapes = new TypeShapes(valueParsers);
    }

    /**
     * Creates a new instance of the type bound to the configuration.
     *
     * @throws BindException if a value is invalid, or if the type is a scalar and the
     *                       configuration has no value
     */
    public <T> T reify(Configuration configuration, Class<T> type) {
        @SuppressWarnings("unchecked")
        T result = (T) reifyType(configuration, type);
        return result;
    }

    /**
     * Creates a new instance of a generic type, such as {@code List<Endpoint>}.
     */
    public <T> T reify(Configuration configuration, TypeReference<T> type) {
        @SuppressWarnings("unchecked")
        T result = (T) reifyType(configuration, type.getType());
        return result;
    }

    /**
     * Deep-merges the configuration into an existing instance.
     *
     * Mutable classes are updated in place. Records, collections and scalars cannot be,
     * so the rebuilt value is returned instead.
     *
     * @return the bound value
     */
    public <T> T bind(Configuration configuration, T instance) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(instance, "instance");
        Staged staged = bind(configuration, typeShapes.resolve(instance.getClass()), instance);
        if (!staged.present()) {
            return instance;
        }
        staged.commit();
        @SuppressWarnings("unchecked")
        T result = (T) staged.value();
        return result;
    }

    /**
     * Binds the section at {@code key} into the instance, if that section exists.
     */
    public <T> T bindAt(Configuration configuration, String key, T instance) {
        ConfigurationSection section = configuration.getSection(key);
        return section.exists() ? bind(section, instance) : instance;
    }

    /**
     * Reads and converts the value of a key.
     */
    public <T> Optional<T> getValue(Configuration configuration, String key, Class<T> type) {
        return getValueOfType(configuration, key, type);
    }

    public <T> Optional<T> getValue(Configuration configuration, String key, TypeReference<T> type) {
        return getValueOfType(configuration, key, type.getType());
    }

    /**
     * Reads and converts the value of a key, or returns the default when it is absent.
     */
    public <T> T getValueOrDefault(Configuration configuration, String key, Class<T> type, T defaultValue) {
        return getValue(configuration, key, type).orElse(defaultValue);
    }

    /**
     * Reads and converts the value of a key that must be present.
     *
     * @throws BindException with {@link BindFailure#MISSING_REQUIRED_VALUE} when absent
     */
    public <T> T getRequiredValue(Configuration configuration, String key, Class<T> type) {
        return getValue(configuration, key, type).orElseThrow(() -> new BindException(
                BindFailure.MISSING_REQUIRED_VALUE, configuration.getSection(key).getPath(), "no value defined"));
    }

    public ValueParsers getValueParsers() {
        return valueParsers;
    }

    private <T> Optional<T> getValueOfType(Configuration configuration, String key, Type type) {
        ConfigurationSection section = configuration.getSection(key);
        Staged staged = bind(section, typeShapes.resolve(type), null);
        if (!staged.present()) {
            return Optional.empty();
        }
        staged.commit();
        @SuppressWarnings("unchecked")
        T value = (T) staged.value();
        return Optional.ofNullable(value);
    }

    private Object reifyType(Configuration configuration, Type type) {
        Objects.requireNonNull(configuration, "configuration");
        TypeShape shape = typeShapes.resolve(type);
        Staged staged = bind(configuration, shape, null);
        if (staged.present()) {
            staged.commit();
            return staged.value();
        }
        return emptyValue(configuration, shape);
    }

    private Object emptyValue(Configuration node, TypeShape shape) {
        String path = pathOf(node);
        if (shape instanceof TypeShape.Structure) {
            TypeShape.Structure structure = (TypeShape.Structure) shape;
            if (structure.immutable()) {
                return constructRecord(structure, new Object[structure.properties().size()], path, true);
            }
            return instantiate(structure.type(), path);
        }
        if (shape instanceof TypeShape.Sequence) {
            return newSequence((TypeShape.Sequence) shape, List.of(), path);
        }
        if (shape instanceof TypeShape.Mapping) {
            return newMap(((TypeShape.Mapping) shape).mapType(), path);
        }
        if (shape instanceof TypeShape.OptionalValue) {
            return Optional.empty();
        }
        if (shape instanceof TypeShape.Unsupported) {
            throw new BindException(BindFailure.UNSUPPORTED_TYPE, path, ((TypeShape.Unsupported) shape).reason());
        }
        throw new BindException(BindFailure.MISSING_REQUIRED_VALUE, path, "no value defined");
    }

    private Staged bind(Configuration node, TypeShape shape, Object existing) {
        if (shape instanceof TypeShape.Scalar) {
            return bindScalar(node, (TypeShape.Scalar) shape);
        }
        if (shape instanceof TypeShape.OptionalValue) {
            return bindOptional(node, (TypeShape.OptionalValue) shape, existing);
        }
        if (shape instanceof TypeShape.Sequence) {
            return bindSequence(node, (TypeShape.Sequence) shape, existing);
        }
        if (shape instanceof TypeShape.Mapping) {
            return bindMapping(node, (TypeShape.Mapping) shape, existing);
        }
        if (shape instanceof TypeShape.Structure) {
            TypeShape.Structure structure = (TypeShape.Structure) shape;
            return structure.immutable()
                    ? bindRecord(node, structure, existing)
                    : bindClass(node, structure, existing);
        }
        TypeShape.Unsupported unsupported = (TypeShape.Unsupported) shape;
        if (!exists(node)) {
            return Staged.ABSENT;
        }
        throw new BindException(BindFailure.UNSUPPORTED_TYPE, pathOf(node), unsupported.reason());
    }

    private Staged bindScalar(Configuration node, TypeShape.Scalar scalar) {
        Optional<String> value = valueOf(node);
        if (value.isEmpty()) {
            return Staged.ABSENT;
        }
        try {
            return Staged.of(valueParsers.parse(scalar.type(), value.get()));
        } catch (RuntimeException e) {
            throw new BindException(BindFailure.PARSE_FAILURE, pathOf(node),
                    "'" + value.get() + "' is not a valid " + scalar.type().getSimpleName(), e);
        }
    }

    private Staged bindOptional(Configuration node, TypeShape.OptionalValue optional, Object existing) {
        Object current = existing instanceof Optional<?> ? ((Optional<?>) existing).orElse(null) : null;
        Staged inner = bind(node, typeShapes.resolve(optional.valueType()), current);
        if (!inner.present()) {
            return Staged.ABSENT;
        }
        return new Staged(true, Optional.ofNullable(inner.value()), inner.commits());
    }

    private Staged bindSequence(Configuration node, TypeShape.Sequence sequence, Object existing) {
        List<ConfigurationSection> indexed = indexedChildren(node);
        if (indexed.isEmpty()) {
            // an empty array is stored as an empty value
            return valueOf(node).filter(String::isEmpty).isPresent()
                    ? Staged.of(newSequence(sequence, List.of(), pathOf(node)))
                    : Staged.ABSENT;
        }

        List<Object> current = existingElements(existing);
        TypeShape elementShape = typeShapes.resolve(sequence.elementType());
        List<Object> elements = new ArrayList<>(indexed.size());
        List<Assignment> commits = new ArrayList<>();

        for (int rank = 0; rank < indexed.size(); rank++) {
            Object previous = rank < current.size() ? current.get(rank) : null;
            Staged element = bind(indexed.get(rank), elementShape, previous);
            if (element.present()) {
                elements.add(element.value());
                commits.addAll(element.commits());
            } else {
                log.debug("Skipping sequence element without value: {}", indexed.get(rank).getPath());
            }
        }
        return new Staged(true, newSequence(sequence, elements, pathOf(node)), commits);
    }

    /**
     * Returns the children usable as sequence positions, in position order.
     */
    private static List<ConfigurationSection> indexedChildren(Configuration node) {
        List<ConfigurationSection> candidates = new ArrayList<>();
        for (ConfigurationSection child : node.getChildren()) {
            if (ConfigurationKeyComparator.isUnsignedInteger(child.getKey())) {
                candidates.add(child);
            }
        }
        candidates.sort(INDEX_ORDER);

        List<ConfigurationSection> indexed = new ArrayList<>(candidates.size());
        for (ConfigurationSection candidate : candidates) {
            if (!indexed.isEmpty()) {
                ConfigurationSection last = indexed.get(indexed.size() - 1);
                if (ConfigurationKeyComparator.compareUnsignedIntegers(last.getKey(), candidate.getKey()) == 0) {
                    log.warn("Ignoring sequence element '{}': index already bound from '{}'",
                            candidate.getPath(), last.getPath());
                    continue;
                }
            }
            indexed.add(candidate);
        }
        return indexed;
    }

    private static List<Object> existingElements(Object existing) {
        if (existing instanceof Collection<?>) {
            return new ArrayList<>((Collection<?>) existing);
        }
        if (existing != null && existing.getClass().isArray()) {
            int length = Array.getLength(existing);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(existing, i));
            }
            return elements;
        }
        return List.of();
    }

    private Staged bindMapping(Configuration node, TypeShape.Mapping mapping, Object existing) {
        List<ConfigurationSection> children = node.getChildren();
        String path = pathOf(node);
        if (children.isEmpty()) {
            return valueOf(node).filter(String::isEmpty).isPresent()
                    ? Staged.of(newMap(mapping.mapType(), path))
                    : Staged.ABSENT;
        }

        Map<Object, Object> result = newMap(mapping.mapType(), path);
        if (existing instanceof Map<?, ?>) {
            result.putAll((Map<?, ?>) existing);
        }

        TypeShape valueShape = typeShapes.resolve(mapping.valueType());
        Map<Object, String> decodedKeys = new HashMap<>();
        List<Assignment> commits = new ArrayList<>();

        for (ConfigurationSection child : children) {
            Object key;
            try {
                key = mapKeyCodec.decode(child.getKey(), mapping.keyType());
            } catch (RuntimeException e) {
                throw new BindException(BindFailure.PARSE_FAILURE, child.getPath(),
                        "'" + child.getKey() + "' is not a valid " + mapping.keyType().getSimpleName() + " key", e);
            }
            String previousKey = decodedKeys.putIfAbsent(key, child.getKey());
            if (previousKey != null) {
                throw new BindException(BindFailure.AMBIGUOUS_KEY, path,
                        "keys '" + previousKey + "' and '" + child.getKey() + "' both decode to " + key);
            }

            Staged value = bind(child, valueShape, result.get(key));
            if (value.present()) {
                result.put(key, value.value());
                commits.addAll(value.commits());
            }
        }
        return new Staged(true, result, commits);
    }

    private Staged bindClass(Configuration node, TypeShape.Structure structure, Object existing) {
        if (!exists(node)) {
            return Staged.ABSENT;
        }
        String path = pathOf(node);
        Object target = existing != null ? existing : instantiate(structure.type(), path);
        List<Assignment> commits = new ArrayList<>();

        for (Property property : structure.properties()) {
            ConfigurationSection child = node.getSection(property.getKey());
            Staged value = bind(child, typeShapes.resolve(property.getType()), read(property, target, path));
            if (value.present()) {
                commits.addAll(value.commits());
                commits.add(new Assignment(property, target, value.value(), path));
            } else if (property.isRequired()) {
                throw new BindException(BindFailure.MISSING_REQUIRED_VALUE, child.getPath(), "no value defined");
            }
        }
        return new Staged(true, target, commits);
    }

    private Staged bindRecord(Configuration node, TypeShape.Structure structure, Object existing) {
        if (!exists(node)) {
            return Staged.ABSENT;
        }
        String path = pathOf(node);
        List<Property> properties = structure.properties();
        Object[] arguments = new Object[properties.size()];
        List<Assignment> commits = new ArrayList<>();

        for (int i = 0; i < properties.size(); i++) {
            Property property = properties.get(i);
            ConfigurationSection child = node.getSection(property.getKey());
            Object current = existing != null ? read(property, existing, path) : null;
            Staged value = bind(child, typeShapes.resolve(property.getType()), current);
            if (value.present()) {
                arguments[i] = value.value();
                commits.addAll(value.commits());
            } else if (property.isRequired()) {
                throw new BindException(BindFailure.MISSING_REQUIRED_VALUE, child.getPath(), "no value defined");
            } else {
                arguments[i] = current;
            }
        }
        return new Staged(true, constructRecord(structure, arguments, path, false), commits);
    }

    private static Object constructRecord(TypeShape.Structure structure, Object[] arguments,
                                          String path, boolean checkRequired) {
        List<Property> properties = structure.properties();
        for (int i = 0; i < arguments.length; i++) {
            Property property = properties.get(i);
            if (arguments[i] == null && checkRequired && property.isRequired()) {
                throw new BindException(BindFailure.MISSING_REQUIRED_VALUE,
                        path.isEmpty() ? property.getKey() : path + ":" + property.getKey(), "no value defined");
            }
            Class<?> type = TypeShapes.rawType(property.getType());
            if (arguments[i] == null && type != null && type.isPrimitive()) {
                arguments[i] = Array.get(Array.newInstance(type, 1), 0);
            }
        }
        try {
            return TypeShapes.canonicalConstructor(structure.type()).newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw new BindException(BindFailure.INSTANTIATION_FAILURE, path,
                    "constructor of " + structure.type().getSimpleName() + " rejected the values", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new BindException(BindFailure.INSTANTIATION_FAILURE, path,
                    "cannot construct " + structure.type().getSimpleName(), e);
        }
    }

    private static Object instantiate(Class<?> type, String path) {
        try {
            return TypeShapes.noArgConstructor(type).newInstance();
        } catch (NoSuchMethodException e) {
            throw new BindException(BindFailure.INSTANTIATION_FAILURE, path,
                    type.getSimpleName() + " has no no-argument constructor", e);
        } catch (InvocationTargetException e) {
            throw new BindException(BindFailure.INSTANTIATION_FAILURE, path,
                    "constructor of " + type.getSimpleName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new BindException(BindFailure.INSTANTIATION_FAILURE, path,
                    "cannot instantiate " + type.getSimpleName(), e);
        }
    }

    private static Object read(Property property, Object target, String path) {
        try {
            return property.read(target);
        } catch (InvocationTargetException e) {
            throw new BindException(BindFailure.INSTANTIATION_FAILURE, path,
                    "cannot read '" + property.getName() + "'", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new BindException(BindFailure.INSTANTIATION_FAILURE, path,
                    "cannot read '" + property.getName() + "'", e);
        }
    }

    private Object newSequence(TypeShape.Sequence sequence, List<Object> elements, String path) {
        Class<?> type = sequence.containerType();
        if (type.isArray()) {
            Object array = Array.newInstance(type.getComponentType(), elements.size());
            for (int i = 0; i < elements.size(); i++) {
                Array.set(array, i, elements.get(i));
            }
            return array;
        }

        Collection<Object> collection;
        if (type.isAssignableFrom(ArrayList.class)) {
            collection = new ArrayList<>(elements.size());
        } else if (type.isAssignableFrom(LinkedHashSet.class)) {
            collection = new LinkedHashSet<>();
        } else if (type == SortedSet.class || type == NavigableSet.class) {
            collection = new TreeSet<>();
        } else if (type == Queue.class || type.isAssignableFrom(ArrayDeque.class)) {
            collection = new ArrayDeque<>();
        } else {
            @SuppressWarnings("unchecked")
            Collection<Object> created = (Collection<Object>) instantiate(type, path);
            collection = created;
        }
        collection.addAll(elements);
        return collection;
    }

    private static Map<Object, Object> newMap(Class<?> type, String path) {
        if (type.isAssignableFrom(LinkedHashMap.class)) {
            return new LinkedHashMap<>();
        }
        if (type == SortedMap.class || type == NavigableMap.class) {
            return new TreeMap<>();
        }
        if (type == ConcurrentMap.class) {
            return new ConcurrentHashMap<>();
        }
        @SuppressWarnings("unchecked")
        Map<Object, Object> created = (Map<Object, Object>) instantiate(type, path);
        return created;
    }

    private static Optional<String> valueOf(Configuration node) {
        return node instanceof ConfigurationSection ? ((ConfigurationSection) node).getValue() : Optional.empty();
    }

    private static boolean exists(Configuration node) {
        return node instanceof ConfigurationSection
                ? ((ConfigurationSection) node).exists()
                : !node.getChildren().isEmpty();
    }

    private static String pathOf(Configuration node) {
        return node instanceof ConfigurationSection ? ((ConfigurationSection) node).getPath() : "";
    }

    /**
     * A property assignment on an existing instance, applied on commit.
     */
    private record Assignment(Property property, Object target, Object value, String path) {
    }

    private record Applied(Assignment assignment, Object previous) {
    }

    /**
     * A bound value whose side effects on existing instances are deferred.
     */
    private record Staged(boolean present, Object value, List<Assignment> commits) {

        static final Staged ABSENT = new Staged(false, null, List.of());

        static Staged of(Object value) {
            return new Staged(true, value, List.of());
        }

        /**
         * Applies every assignment. When one fails, the assignments already applied are
         * reverted in reverse order before the failure is reported.
         */
        void commit() {
            Deque<Applied> applied = new ArrayDeque<>(commits.size());
            for (Assignment assignment : commits) {
                Property property = assignment.property();
                try {
                    Object previous = property.read(assignment.target());
                    property.write(assignment.target(), assignment.value());
                    applied.push(new Applied(assignment, previous));
                } catch (InvocationTargetException e) {
                    rollback(applied);
                    throw new BindException(BindFailure.INSTANTIATION_FAILURE, assignment.path(),
                            "setter of '" + property.getName() + "' rejected the value", e.getCause());
                } catch (ReflectiveOperationException e) {
                    rollback(applied);
                    throw new BindException(BindFailure.INSTANTIATION_FAILURE, assignment.path(),
                            "cannot write '" + property.getName() + "'", e);
                }
            }
        }

        private static void rollback(Deque<Applied> applied) {
            while (!applied.isEmpty()) {
                Applied entry = applied.pop();
                Assignment assignment = entry.assignment();
                try {
                    assignment.property().restore(assignment.target(), entry.previous());
                } catch (IllegalAccessException e) {
                    log.error("Failed to restore '{}' at '{}'", assignment.property().getName(), assignment.path(), e);
                }
            }
        }
    }
}

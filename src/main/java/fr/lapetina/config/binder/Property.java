package fr.lapetina.config.binder;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * A bindable member of a structure: a record component or a mutable field.
 */
public final class Property {

    private final String name;
    private final String key;
    private final Type type;
    private final boolean required;
    private final Method accessor;
    private final Field field;
    private final Method setter;

    private Property(String name, String key, Type type, boolean required,
                     Method accessor, Field field, Method setter) {
        this.name = name;
        this.key = key;
        this.type = type;
        this.required = required;
        this.accessor = accessor;
        this.field = field;
        this.setter = setter;
    }

    static Property ofComponent(String name, String key, Type type, boolean required, Method accessor) {
        accessor.setAccessible(true);
        return new Property(name, key, type, required, accessor, null, null);
    }

    static Property ofField(String key, boolean required, Field field, Method setter) {
        field.setAccessible(true);
        if (setter != null) {
            setter.setAccessible(true);
        }
        return new Property(field.getName(), key, field.getGenericType(), required, null, field, setter);
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the configuration key this property binds to.
     */
    public String getKey() {
        return key;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    Object read(Object target) throws ReflectiveOperationException {
        Objects.requireNonNull(target, "target");
        return accessor != null ? accessor.invoke(target) : field.get(target);
    }

    /**
     * Assigns a value, through the setter when the class declares one.
     *
     * @throws InvocationTargetException if the setter rejected the value
     */
    void write(Object target, Object value) throws ReflectiveOperationException {
        if (setter != null) {
            setter.invoke(target, value);
        } else {
            field.set(target, value);
        }
    }

    /**
     * Puts back a value read before a failed commit, bypassing the setter.
     */
    void restore(Object target, Object value) throws IllegalAccessException {
        field.set(target, value);
    }

    @Override
    public String toString() {
        return "Property{name='" + name + "', key='" + key + "'}";
    }
}

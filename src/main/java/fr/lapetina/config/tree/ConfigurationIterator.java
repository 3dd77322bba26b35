package fr.lapetina.config.tree;

import fr.lapetina.config.domain.model.PathMode;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Lazy depth-first walk over the resolved configuration tree.
 *
 * Children are expanded only when their parent is visited, so a walk that stops early
 * never queries the rest of the tree.
 */
final class ConfigurationIterator implements Iterator<Map.Entry<String, String>> {

    private final Deque<ConfigurationSection> stack = new ArrayDeque<>();
    private final int prefixLength;
    private Map.Entry<String, String> next;

    ConfigurationIterator(Configuration start, PathMode mode) {
        if (start instanceof ConfigurationSection) {
            ConfigurationSection section = (ConfigurationSection) start;
            prefixLength = mode == PathMode.RELATIVE ? section.getPath().length() + 1 : 0;
            if (mode == PathMode.ABSOLUTE) {
                Optional<String> value = section.getValue();
                value.ifPresent(v -> next = new AbstractMap.SimpleImmutableEntry<>(section.getPath(), v));
            }
        } else {
            prefixLength = 0;
        }
        pushChildren(start.getChildren());
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public Map.Entry<String, String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Map.Entry<String, String> result = next;
        next = null;
        return result;
    }

    private Map.Entry<String, String> advance() {
        while (!stack.isEmpty()) {
            ConfigurationSection section = stack.pop();
            pushChildren(section.getChildren());
            Optional<String> value = section.getValue();
            if (value.isPresent()) {
                String key = section.getPath().substring(prefixLength);
                return new AbstractMap.SimpleImmutableEntry<>(key, value.get());
            }
        }
        return null;
    }

    private void pushChildren(List<ConfigurationSection> children) {
        ListIterator<ConfigurationSection> it = children.listIterator(children.size());
        while (it.hasPrevious()) {
            stack.push(it.previous());
        }
    }
}

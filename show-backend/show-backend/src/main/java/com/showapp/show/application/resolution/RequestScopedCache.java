package com.showapp.show.application.resolution;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Memoizes lookups for the duration of one request. A fresh instance is
 * created for every request and dropped when it completes.
 * <p>
 * Not thread-safe: a request is resolved on a single thread.
 */
public class RequestScopedCache {

    private final Map<Object, Object> values = new HashMap<>();

    /**
     * Returns the value stored under {@code key}, computing it with
     * {@code producer} on first use. If the producer throws, nothing is stored
     * and the next call for the same key runs the producer again.
     */
    @SuppressWarnings("unchecked")
    public <T> T memoize(Object key, Supplier<T> producer) {
        if (values.containsKey(key)) {
            return (T) values.get(key);
        }
        T value = producer.get();
        values.put(key, value);
        return value;
    }

    boolean contains(Object key) {
        return values.containsKey(key);
    }

    int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }
}

package com.lazystream.config;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/** Named predicates, transforms and producers that stream definitions refer to by name. */
public final class OpRegistry {
    private final Map<String, Predicate<Object>> filters = new ConcurrentHashMap<>();
    private final Map<String, Function<Object, Object>> transforms = new ConcurrentHashMap<>();
    private final Map<String, Supplier<Object>> producers = new ConcurrentHashMap<>();

    /** Elements that are not instances of {@code type} fail the filter with {@link ClassCastException}. */
    public <T> OpRegistry registerFilter(String name, Class<T> type, Predicate<? super T> predicate) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(predicate, "predicate");
        filters.put(Objects.requireNonNull(name, "name"), value -> predicate.test(type.cast(value)));
        return this;
    }

    public <T> OpRegistry registerTransform(String name, Class<T> type, Function<? super T, ?> transform) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(transform, "transform");
        transforms.put(Objects.requireNonNull(name, "name"), value -> transform.apply(type.cast(value)));
        return this;
    }

    public OpRegistry registerProducer(String name, Supplier<?> producer) {
        Objects.requireNonNull(producer, "producer");
        producers.put(Objects.requireNonNull(name, "name"), producer::get);
        return this;
    }

    public boolean hasFilter(String name) { return filters.containsKey(name); }

    public boolean hasTransform(String name) { return transforms.containsKey(name); }

    public boolean hasProducer(String name) { return producers.containsKey(name); }

    public Predicate<Object> getFilter(String name) {
        Predicate<Object> filter = filters.get(name);
        if (filter == null) throw new IllegalArgumentException("Unknown filter: " + name);
        return filter;
    }

    public Function<Object, Object> getTransform(String name) {
        Function<Object, Object> transform = transforms.get(name);
        if (transform == null) throw new IllegalArgumentException("Unknown transform: " + name);
        return transform;
    }

    public Supplier<Object> getProducer(String name) {
        Supplier<Object> producer = producers.get(name);
        if (producer == null) throw new IllegalArgumentException("Unknown producer: " + name);
        return producer;
    }
}

package com.leadgen.instrument.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 多参数操作的调用参数：位置参数（顺序敏感）与命名参数（顺序无关）。
 *
 * <pre>{@code
 * CallArguments args = CallArguments.of("plumbers", "Leeds").with("radiusKm", 10);
 * }</pre>
 */
public final class CallArguments {

    private final List<Object> positional;
    private final Map<String, Object> named;

    private CallArguments(List<Object> positional, Map<String, Object> named) {
        this.positional = Collections.unmodifiableList(positional);
        this.named = Collections.unmodifiableMap(named);
    }

    public static CallArguments of(Object... positional) {
        return new CallArguments(new ArrayList<>(Arrays.asList(positional)), new LinkedHashMap<>());
    }

    public static CallArguments named(Map<String, ?> named) {
        return new CallArguments(new ArrayList<>(), new LinkedHashMap<>(named));
    }

    /**
     * 返回追加了一个命名参数的新实例。
     */
    public CallArguments with(String name, Object value) {
        Objects.requireNonNull(name, "argument name");
        Map<String, Object> copy = new LinkedHashMap<>(named);
        copy.put(name, value);
        return new CallArguments(new ArrayList<>(positional), copy);
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> named() {
        return named;
    }

    public Object get(int index) {
        return positional.get(index);
    }

    public Object get(String name) {
        return named.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallArguments other)) return false;
        return positional.equals(other.positional) && named.equals(other.named);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, named);
    }

    @Override
    public String toString() {
        return "CallArguments{positional=" + positional + ", named=" + named + "}";
    }
}

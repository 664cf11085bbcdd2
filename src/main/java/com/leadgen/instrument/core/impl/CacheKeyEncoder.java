package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.KeyDerivationException;
import com.leadgen.instrument.model.CallArguments;

import java.lang.reflect.Array;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 将调用参数确定性地编码为缓存键。
 *
 * 支持：null、字符串、基本类型包装类、BigDecimal/BigInteger、枚举、UUID、URI、java.time 值类型、
 * 数组、List（顺序敏感）、Set 与 Map（按元素编码排序，顺序无关）、Optional、record（按分量）、
 * 以及 {@link CallArguments}（位置参数顺序敏感，命名参数按名称排序）。
 * 其他类型（包括 StringBuilder 等可变字符序列）没有稳定的结构相等性，编码时抛出
 * {@link KeyDerivationException}。record 的分量通过其访问器读取，调用方无权访问的 record 同样被拒绝。
 */
public class CacheKeyEncoder {

    public String encode(Object input) {
        StringBuilder sb = new StringBuilder();
        append(sb, input, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    private void append(StringBuilder sb, Object value, Set<Object> visiting) {
        if (value == null) {
            sb.append("null");
            return;
        }
        if (value instanceof String str) {
            sb.append("s").append(str.length()).append(':').append(str);
            return;
        }
        if (value instanceof Boolean || value instanceof Character
                || value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte
                || value instanceof Double || value instanceof Float
                || value instanceof BigInteger) {
            sb.append(value.getClass().getSimpleName()).append(':').append(value);
            return;
        }
        if (value instanceof BigDecimal d) {
            // 1.0 与 1.00 视为同一个键
            sb.append("BigDecimal:").append(d.stripTrailingZeros().toPlainString());
            return;
        }
        if (value instanceof Enum<?> e) {
            sb.append("enum:").append(e.getDeclaringClass().getName()).append('.').append(e.name());
            return;
        }
        if (value instanceof UUID || value instanceof URI || isTimeValue(value)) {
            sb.append(value.getClass().getSimpleName()).append(':').append(value);
            return;
        }
        if (value instanceof Optional<?> opt) {
            sb.append("opt(");
            append(sb, opt.orElse(null), visiting);
            sb.append(')');
            return;
        }

        // 以下为容器类型，需要检测循环引用
        if (!visiting.add(value)) {
            throw new KeyDerivationException("Cyclic argument structure of type "
                    + value.getClass().getName() + " cannot be encoded as a cache key");
        }
        try {
            if (value instanceof CallArguments args) {
                sb.append("args(");
                appendSequence(sb, args.positional(), visiting);
                sb.append(';');
                appendUnordered(sb, args.named(), visiting);
                sb.append(')');
            } else if (value instanceof List<?> list) {
                appendSequence(sb, list, visiting);
            } else if (value.getClass().isArray()) {
                int length = Array.getLength(value);
                List<Object> elements = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    elements.add(Array.get(value, i));
                }
                appendSequence(sb, elements, visiting);
            } else if (value instanceof Set<?> set) {
                List<String> encoded = new ArrayList<>(set.size());
                for (Object element : set) {
                    StringBuilder part = new StringBuilder();
                    append(part, element, visiting);
                    encoded.add(part.toString());
                }
                Collections.sort(encoded);
                sb.append("set{").append(String.join(",", encoded)).append('}');
            } else if (value instanceof Map<?, ?> map) {
                appendUnordered(sb, map, visiting);
            } else if (value instanceof Record) {
                appendRecord(sb, value, visiting);
            } else {
                throw new KeyDerivationException("Argument of type " + value.getClass().getName()
                        + " has no deterministic cache key encoding");
            }
        } finally {
            visiting.remove(value);
        }
    }

    private void appendSequence(StringBuilder sb, List<?> elements, Set<Object> visiting) {
        sb.append('[');
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            append(sb, elements.get(i), visiting);
        }
        sb.append(']');
    }

    private void appendUnordered(StringBuilder sb, Map<?, ?> map, Set<Object> visiting) {
        List<String> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            StringBuilder part = new StringBuilder();
            append(part, entry.getKey(), visiting);
            part.append('=');
            append(part, entry.getValue(), visiting);
            entries.add(part.toString());
        }
        Collections.sort(entries);
        sb.append("map{").append(String.join(",", entries)).append('}');
    }

    private void appendRecord(StringBuilder sb, Object record, Set<Object> visiting) {
        Class<?> type = record.getClass();
        sb.append(type.getName()).append('(');
        RecordComponent[] components = type.getRecordComponents();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            RecordComponent component = components[i];
            sb.append(component.getName()).append('=');
            Object componentValue;
            try {
                componentValue = component.getAccessor().invoke(record);
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new KeyDerivationException("Cannot read record component '" + component.getName()
                        + "' of " + type.getName() + ": " + e.getMessage());
            }
            append(sb, componentValue, visiting);
        }
        sb.append(')');
    }

    private static boolean isTimeValue(Object value) {
        Package pkg = value.getClass().getPackage();
        return pkg != null && pkg.getName().equals("java.time");
    }
}

package com.agentflow.workflow.type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Parsed form of a config type string. Supported: {@code str}, {@code int}, {@code float}, {@code bool},
 * {@code list}, {@code list[T]}, {@code dict}, {@code dict[K,V]}, {@code object}.
 * Element and value types are null for the untyped {@code list} and {@code dict}.
 */
public final class FieldType {

    private static final String SUPPORTED = "str, int, float, bool, list, dict, list[T], dict[K,V], object";

    private final FieldKind kind;
    private final FieldType elementType;
    private final FieldType keyType;
    private final String name;

    private FieldType(FieldKind kind, FieldType elementType, FieldType keyType, String name) {
        this.kind = kind;
        this.elementType = elementType;
        this.keyType = keyType;
        this.name = name;
    }

    public static FieldType of(FieldKind kind) {
        return new FieldType(kind, null, null, canonicalName(kind));
    }

    public static FieldType listOf(FieldType element) {
        return new FieldType(FieldKind.LIST, element, null, element != null ? "list[" + element.name + "]" : "list");
    }

    /**
     * Parses a type string.
     *
     * @throws TypeParseException when the string is empty or names an unknown type
     */
    public static FieldType parse(String typeString) {
        if (typeString == null || typeString.isBlank()) {
            throw new TypeParseException(String.valueOf(typeString), "type string cannot be empty");
        }
        String s = typeString.trim();
        switch (s) {
            case "str":
                return of(FieldKind.STRING);
            case "int":
                return of(FieldKind.INTEGER);
            case "float":
                return of(FieldKind.FLOAT);
            case "bool":
                return of(FieldKind.BOOLEAN);
            case "object":
                return of(FieldKind.OBJECT);
            case "list":
                return new FieldType(FieldKind.LIST, null, null, "list");
            case "dict":
                return new FieldType(FieldKind.DICT, null, null, "dict");
            default:
                break;
        }
        if (s.startsWith("list[") && s.endsWith("]")) {
            FieldType element = parse(s.substring(5, s.length() - 1));
            return new FieldType(FieldKind.LIST, element, null, s);
        }
        if (s.startsWith("dict[") && s.endsWith("]")) {
            String inner = s.substring(5, s.length() - 1);
            int comma = inner.indexOf(',');
            if (comma < 0) {
                throw new TypeParseException(s, "dict requires key and value types, e.g. dict[str, int]");
            }
            FieldType key = parse(inner.substring(0, comma));
            FieldType value = parse(inner.substring(comma + 1));
            return new FieldType(FieldKind.DICT, value, key, s);
        }
        throw new TypeParseException(s, "unknown type. Supported: " + SUPPORTED);
    }

    /** True when {@link #parse(String)} would succeed. */
    public static boolean isValid(String typeString) {
        try {
            parse(typeString);
            return true;
        } catch (TypeParseException e) {
            return false;
        }
    }

    private static String canonicalName(FieldKind kind) {
        switch (kind) {
            case STRING: return "str";
            case INTEGER: return "int";
            case FLOAT: return "float";
            case BOOLEAN: return "bool";
            case LIST: return "list";
            case DICT: return "dict";
            default: return "object";
        }
    }

    public FieldKind getKind() {
        return kind;
    }

    /** Element type of a list, or value type of a dict; null when untyped. */
    public FieldType getElementType() {
        return elementType;
    }

    public FieldType getKeyType() {
        return keyType;
    }

    public String getName() {
        return name;
    }

    public boolean isList() {
        return kind == FieldKind.LIST;
    }

    /**
     * Checks a runtime value against this type. Integers accept whole {@link Number}s,
     * floats accept any number, lists and dicts check their element types when declared.
     */
    public boolean accepts(Object value) {
        if (value == null) return false;
        switch (kind) {
            case STRING:
                return value instanceof String;
            case INTEGER:
                return isWholeNumber(value);
            case FLOAT:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case LIST:
                if (!(value instanceof List<?> list)) return false;
                if (elementType == null) return true;
                for (Object item : list) {
                    if (!elementType.accepts(item)) return false;
                }
                return true;
            case DICT:
                if (!(value instanceof Map<?, ?> map)) return false;
                if (elementType == null) return true;
                for (Object v : map.values()) {
                    if (!elementType.accepts(v)) return false;
                }
                return true;
            case OBJECT:
                return value instanceof Map;
            default:
                return false;
        }
    }

    /**
     * Normalizes an accepted value: integers become {@link Long}, floats become {@link Double},
     * lists are normalized element by element. Callers check {@link #accepts(Object)} first.
     */
    public Object normalize(Object value) {
        if (value == null) return null;
        switch (kind) {
            case INTEGER:
                return ((Number) value).longValue();
            case FLOAT:
                return ((Number) value).doubleValue();
            case LIST:
                if (elementType == null || !(value instanceof List<?> list)) return value;
                return list.stream().map(elementType::normalize).collect(Collectors.toList());
            default:
                return value;
        }
    }

    private static boolean isWholeNumber(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof BigInteger) return true;
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldType that = (FieldType) o;
        return kind == that.kind && Objects.equals(elementType, that.elementType) && Objects.equals(keyType, that.keyType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, elementType, keyType);
    }

    @Override
    public String toString() {
        return name;
    }
}

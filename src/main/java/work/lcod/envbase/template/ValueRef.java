package work.lcod.envbase.template;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value supplied for a template property or a child stack parameter: a literal, a {@code Ref} or an
 * {@code Fn::GetAtt}.
 */
public interface ValueRef {
    /** CloudFormation JSON form of this value. */
    Object toJson();

    static ValueRef ref(String logicalName) {
        return new Ref(logicalName);
    }

    static ValueRef getAtt(String logicalName, String attribute) {
        return new GetAtt(logicalName, attribute);
    }

    static ValueRef literal(Object value) {
        return new Literal(value);
    }

    /** Wraps anything that is not already a {@link ValueRef} as a literal. */
    static ValueRef of(Object value) {
        return value instanceof ValueRef ref ? ref : new Literal(value);
    }

    record Ref(String logicalName) implements ValueRef {
        public Ref {
            Objects.requireNonNull(logicalName, "logicalName");
        }

        @Override
        public Object toJson() {
            return Map.of("Ref", logicalName);
        }
    }

    record GetAtt(String logicalName, String attribute) implements ValueRef {
        public GetAtt {
            Objects.requireNonNull(logicalName, "logicalName");
            Objects.requireNonNull(attribute, "attribute");
        }

        @Override
        public Object toJson() {
            return Map.of("Fn::GetAtt", List.of(logicalName, attribute));
        }
    }

    record Literal(Object value) implements ValueRef {
        @Override
        public Object toJson() {
            return value;
        }
    }

    /** Replaces every nested {@link ValueRef} in a property tree by its JSON form. */
    static Object expand(Object value) {
        if (value instanceof ValueRef ref) {
            return expand(ref.toJson());
        }
        if (value instanceof Map<?, ?> map) {
            var out = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), expand(entry.getValue()));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(ValueRef::expand).toList();
        }
        return value;
    }
}

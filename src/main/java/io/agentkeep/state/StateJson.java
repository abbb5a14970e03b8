package io.agentkeep.state;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.TypeResolverBuilder;
import com.fasterxml.jackson.databind.jsontype.impl.ClassNameIdResolver;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Jackson setup for persisted state: ISO-8601 instants, lenient on unknown fields.
 *
 * <p>Values held in {@code Object} slots (step outputs, context and parameter values, memory
 * metadata) carry their class name in an {@code @class} property, so a {@code Long} or a
 * record comes back as itself instead of an {@code Integer} or a map. Strings, booleans,
 * integers and doubles stay plain JSON. Only classes from {@link #DEFAULT_TRUSTED_PACKAGES}
 * and the extra packages passed to {@link #configure(ObjectMapper, Collection)} are
 * accepted when reading.</p>
 */
public final class StateJson {

    public static final String TYPE_PROPERTY = "@class";

    public static final List<String> DEFAULT_TRUSTED_PACKAGES = List.of(
            "java.lang.", "java.util.", "java.time.", "java.math.", "io.agentkeep.");

    private StateJson() {
    }

    public static ObjectMapper newMapper() {
        return configure(new ObjectMapper());
    }

    public static ObjectMapper configure(ObjectMapper base) {
        return configure(base, List.of());
    }

    /**
     * Applies the persisted-state settings to an existing mapper, such as the one
     * Spring Boot provides, and returns a copy so the shared mapper stays untouched.
     *
     * @param trustedPackages package prefixes of application types allowed in {@code Object} slots
     */
    public static ObjectMapper configure(ObjectMapper base, Collection<String> trustedPackages) {
        PolymorphicTypeValidator validator = validator(trustedPackages);
        TypeResolverBuilder<?> typing = new ObjectMapper.DefaultTypeResolverBuilder(
                ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT, validator)
                .init(JsonTypeInfo.Id.CLASS, new PortableClassIdResolver(validator))
                .inclusion(JsonTypeInfo.As.PROPERTY)
                .typeProperty(TYPE_PROPERTY);

        ObjectMapper mapper = base.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        mapper.setDefaultTyping(typing);
        return mapper;
    }

    private static PolymorphicTypeValidator validator(Collection<String> trustedPackages) {
        BasicPolymorphicTypeValidator.Builder builder = BasicPolymorphicTypeValidator.builder()
                .allowIfSubTypeIsArray();
        for (String prefix : DEFAULT_TRUSTED_PACKAGES) {
            builder.allowIfSubType(prefix);
        }
        if (trustedPackages != null) {
            for (String prefix : trustedPackages) {
                if (prefix != null && !prefix.isBlank()) {
                    builder.allowIfSubType(prefix.strip());
                }
            }
        }
        return builder.build();
    }

    /**
     * Writes collection and map implementations that cannot be instantiated by name
     * ({@code List.of()}, {@code Arrays.asList}, unmodifiable views) as their public
     * mutable counterparts.
     */
    static final class PortableClassIdResolver extends ClassNameIdResolver {

        PortableClassIdResolver(PolymorphicTypeValidator validator) {
            super(TypeFactory.defaultInstance().constructType(Object.class), TypeFactory.defaultInstance(), validator);
        }

        @Override
        public String idFromValue(Object value) {
            return super.idFromValueAndType(value, portableType(value, value.getClass()));
        }

        @Override
        public String idFromValueAndType(Object value, Class<?> type) {
            return super.idFromValueAndType(value, portableType(value, type));
        }

        static Class<?> portableType(Object value, Class<?> type) {
            if (type == null || Modifier.isPublic(type.getModifiers())) {
                return type;
            }
            if (value instanceof SortedMap<?, ?>) return TreeMap.class;
            if (value instanceof Map<?, ?>) return LinkedHashMap.class;
            if (value instanceof SortedSet<?>) return TreeSet.class;
            if (value instanceof Set<?>) return LinkedHashSet.class;
            if (value instanceof Collection<?>) return ArrayList.class;
            return type;
        }
    }
}

package com.libragraph.entitystore.types;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Converts primary keys to and from their index token form.
 *
 * <p>{@link #format} must be the inverse of {@link #parse}: a formatted ID parses back to an
 * equal ID. Tokens must not contain line terminators.
 */
public interface IdCodec<ID> {

    IdCodec<Long> LONG = of(Long.class, String::valueOf, Long::parseLong);

    IdCodec<Integer> INTEGER = of(Integer.class, String::valueOf, Integer::parseInt);

    IdCodec<String> STRING = of(String.class, Function.identity(), Function.identity());

    IdCodec<UUID> UUID = of(java.util.UUID.class, java.util.UUID::toString, java.util.UUID::fromString);

    Class<ID> idType();

    String format(ID id);

    /**
     * @throws IllegalArgumentException if the token is not a valid ID
     *                                  ({@link NumberFormatException} for numeric codecs)
     */
    ID parse(String token);

    static <ID> IdCodec<ID> of(Class<ID> idType, Function<ID, String> formatter, Function<String, ID> parser) {
        Objects.requireNonNull(idType, "idType cannot be null");
        Objects.requireNonNull(formatter, "formatter cannot be null");
        Objects.requireNonNull(parser, "parser cannot be null");
        return new IdCodec<>() {
            @Override
            public Class<ID> idType() {
                return idType;
            }

            @Override
            public String format(ID id) {
                return formatter.apply(Objects.requireNonNull(id, "id cannot be null"));
            }

            @Override
            public ID parse(String token) {
                return parser.apply(Objects.requireNonNull(token, "token cannot be null"));
            }

            @Override
            public String toString() {
                return "IdCodec[" + idType.getSimpleName() + "]";
            }
        };
    }

    /**
     * Returns the built-in codec for the given ID type.
     *
     * @throws IllegalArgumentException if no built-in codec handles the type
     */
    @SuppressWarnings("unchecked")
    static <ID> IdCodec<ID> forType(Class<ID> idType) {
        if (idType == Long.class || idType == long.class) return (IdCodec<ID>) LONG;
        if (idType == Integer.class || idType == int.class) return (IdCodec<ID>) INTEGER;
        if (idType == String.class) return (IdCodec<ID>) STRING;
        if (idType == java.util.UUID.class) return (IdCodec<ID>) UUID;
        throw new IllegalArgumentException("No built-in IdCodec for " + idType.getName());
    }
}

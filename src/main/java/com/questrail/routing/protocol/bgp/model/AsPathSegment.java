package com.questrail.routing.protocol.bgp.model;

import java.util.List;
import java.util.Objects;

/**
 * One AS_PATH segment: an ordered AS_SEQUENCE or an unordered AS_SET.
 */
public record AsPathSegment(Type type, List<Long> asNumbers)
{
    public enum Type {
        AS_SET(1),
        AS_SEQUENCE(2);

        private final int code;

        Type(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        public static Type fromCode(int code) {
            return switch (code) {
                case 1 -> AS_SET;
                case 2 -> AS_SEQUENCE;
                default -> throw new IllegalArgumentException("Unknown AS_PATH segment type: " + code);
            };
        }
    }

    public AsPathSegment {
        Objects.requireNonNull(type, "type");
        asNumbers = List.copyOf(asNumbers);
        if (asNumbers.isEmpty()) {
            throw new IllegalArgumentException("AS_PATH segment must not be empty");
        }
        if (asNumbers.size() > 255) {
            throw new IllegalArgumentException("AS_PATH segment holds at most 255 AS numbers");
        }
    }

    public static AsPathSegment sequence(Long... asNumbers) {
        return new AsPathSegment(Type.AS_SEQUENCE, List.of(asNumbers));
    }

    public static AsPathSegment set(Long... asNumbers) {
        return new AsPathSegment(Type.AS_SET, List.of(asNumbers));
    }

    /**
     * Contribution of this segment to the path length used by route selection:
     * an AS_SET counts as one hop regardless of its size.
     */
    public int pathLength() {
        return type == Type.AS_SET ? 1 : asNumbers.size();
    }
}

package com.questrail.routing.protocol.bgp.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PathAttributes
 * -----------------------------------------------------------------------------
 * Immutable set of path attributes shared by every prefix announced in one
 * UPDATE.
 *
 * <p>Well-known attributes are modelled explicitly. Any of them may be absent
 * ({@code null}) as received; deciding whether a route is acceptable is the
 * RIB's job, not the decoder's. Optional attributes this speaker does not
 * interpret are carried as {@link RawAttribute}s.</p>
 *
 * <p>Instances are value objects: equal attribute sets are interchangeable and
 * are interned by the RIB's attribute arena.</p>
 */
public final class PathAttributes
{
    public static final long DEFAULT_LOCAL_PREF = 100L;

    private final Origin origin;
    private final AsPath asPath;
    private final Ipv4Address nextHop;
    private final Long multiExitDisc;
    private final Long localPref;
    private final List<RawAttribute> optional;

    private PathAttributes(Builder b) {
        this.origin = b.origin;
        this.asPath = b.asPath;
        this.nextHop = b.nextHop;
        this.multiExitDisc = b.multiExitDisc;
        this.localPref = b.localPref;
        this.optional = List.copyOf(b.optional);
    }

    public Optional<Origin> origin() {
        return Optional.ofNullable(origin);
    }

    public Optional<AsPath> asPath() {
        return Optional.ofNullable(asPath);
    }

    public Optional<Ipv4Address> nextHop() {
        return Optional.ofNullable(nextHop);
    }

    public Optional<Long> multiExitDisc() {
        return Optional.ofNullable(multiExitDisc);
    }

    public Optional<Long> localPref() {
        return Optional.ofNullable(localPref);
    }

    public List<RawAttribute> optionalAttributes() {
        return optional;
    }

    /**
     * Local preference used by route selection; a missing value means
     * {@value #DEFAULT_LOCAL_PREF}.
     */
    public long effectiveLocalPref() {
        return localPref != null ? localPref : DEFAULT_LOCAL_PREF;
    }

    /**
     * MED used by route selection; a missing value means 0.
     */
    public long effectiveMed() {
        return multiExitDisc != null ? multiExitDisc : 0L;
    }

    /**
     * Names of mandatory attributes (ORIGIN, AS_PATH, NEXT_HOP) that are absent.
     */
    public List<String> missingMandatory() {
        List<String> missing = new ArrayList<>(3);
        if (origin == null) {
            missing.add("ORIGIN");
        }
        if (asPath == null) {
            missing.add("AS_PATH");
        }
        if (nextHop == null) {
            missing.add("NEXT_HOP");
        }
        return missing;
    }

    /**
     * Octets these attributes occupy in an UPDATE's path attribute field when
     * AS numbers are written as 4 octets, the wider of the two encodings.
     */
    public int wireOctets() {
        int total = 0;
        if (origin != null) {
            total += attributeOctets(1);
        }
        if (asPath != null) {
            int pathOctets = 0;
            for (AsPathSegment segment : asPath.segments()) {
                pathOctets += 2 + 4 * segment.asNumbers().size();
            }
            total += attributeOctets(pathOctets);
        }
        if (nextHop != null) {
            total += attributeOctets(4);
        }
        if (multiExitDisc != null) {
            total += attributeOctets(4);
        }
        if (localPref != null) {
            total += attributeOctets(4);
        }
        for (RawAttribute raw : optional) {
            total += attributeOctets(raw.value().length);
        }
        return total;
    }

    private static int attributeOctets(int valueLength) {
        // flags, type code, then a 1- or 2-octet length
        return (valueLength > 255 ? 4 : 3) + valueLength;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.origin = origin;
        b.asPath = asPath;
        b.nextHop = nextHop;
        b.multiExitDisc = multiExitDisc;
        b.localPref = localPref;
        b.optional.addAll(optional);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Origin origin;
        private AsPath asPath;
        private Ipv4Address nextHop;
        private Long multiExitDisc;
        private Long localPref;
        private final List<RawAttribute> optional = new ArrayList<>();

        private Builder() {}

        public Builder origin(Origin origin) {
            this.origin = origin;
            return this;
        }

        public Builder asPath(AsPath asPath) {
            this.asPath = asPath;
            return this;
        }

        public Builder nextHop(Ipv4Address nextHop) {
            this.nextHop = nextHop;
            return this;
        }

        public Builder multiExitDisc(Long med) {
            this.multiExitDisc = med;
            return this;
        }

        public Builder localPref(Long localPref) {
            this.localPref = localPref;
            return this;
        }

        public Builder addOptional(RawAttribute attribute) {
            optional.add(Objects.requireNonNull(attribute, "attribute"));
            return this;
        }

        public Builder clearOptional() {
            optional.clear();
            return this;
        }

        public PathAttributes build() {
            return new PathAttributes(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathAttributes other)) {
            return false;
        }
        return origin == other.origin
                && Objects.equals(asPath, other.asPath)
                && Objects.equals(nextHop, other.nextHop)
                && Objects.equals(multiExitDisc, other.multiExitDisc)
                && Objects.equals(localPref, other.localPref)
                && optional.equals(other.optional);
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin, asPath, nextHop, multiExitDisc, localPref, optional);
    }

    @Override
    public String toString() {
        return "PathAttributes[origin=" + origin
                + ", asPath=" + asPath
                + ", nextHop=" + nextHop
                + ", med=" + multiExitDisc
                + ", localPref=" + localPref
                + (optional.isEmpty() ? "" : ", optional=" + optional)
                + ']';
    }
}

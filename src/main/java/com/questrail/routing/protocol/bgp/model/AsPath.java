package com.questrail.routing.protocol.bgp.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The AS_PATH attribute: an ordered list of segments.
 */
public record AsPath(List<AsPathSegment> segments)
{
    public static final AsPath EMPTY = new AsPath(List.of());

    public AsPath {
        segments = List.copyOf(segments);
    }

    public static AsPath ofSequence(long... asNumbers) {
        if (asNumbers.length == 0) {
            return EMPTY;
        }
        List<Long> list = new ArrayList<>(asNumbers.length);
        for (long asn : asNumbers) {
            list.add(asn);
        }
        return new AsPath(List.of(new AsPathSegment(AsPathSegment.Type.AS_SEQUENCE, list)));
    }

    public int pathLength() {
        int length = 0;
        for (AsPathSegment segment : segments) {
            length += segment.pathLength();
        }
        return length;
    }

    /**
     * The neighboring AS: the first AS of a leading AS_SEQUENCE, or 0 when the
     * path is empty or starts with an AS_SET.
     */
    public long neighborAs() {
        if (segments.isEmpty()) {
            return 0;
        }
        AsPathSegment first = segments.get(0);
        return first.type() == AsPathSegment.Type.AS_SEQUENCE ? first.asNumbers().get(0) : 0;
    }

    public boolean contains(long asNumber) {
        for (AsPathSegment segment : segments) {
            if (segment.asNumbers().contains(asNumber)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a new path with {@code asNumber} prepended to the leading
     * AS_SEQUENCE, opening a new sequence when required.
     */
    public AsPath prepend(long asNumber) {
        List<AsPathSegment> result = new ArrayList<>(segments.size() + 1);
        if (!segments.isEmpty()
                && segments.get(0).type() == AsPathSegment.Type.AS_SEQUENCE
                && segments.get(0).asNumbers().size() < 255) {
            List<Long> asns = new ArrayList<>(segments.get(0).asNumbers().size() + 1);
            asns.add(asNumber);
            asns.addAll(segments.get(0).asNumbers());
            result.add(new AsPathSegment(AsPathSegment.Type.AS_SEQUENCE, asns));
            result.addAll(segments.subList(1, segments.size()));
        } else {
            result.add(new AsPathSegment(AsPathSegment.Type.AS_SEQUENCE, List.of(asNumber)));
            result.addAll(segments);
        }
        return new AsPath(result);
    }

    @Override
    public String toString() {
        return segments.stream()
                .map(s -> {
                    String asns = s.asNumbers().stream().map(String::valueOf).collect(Collectors.joining(" "));
                    return s.type() == AsPathSegment.Type.AS_SET ? "{" + asns + "}" : asns;
                })
                .collect(Collectors.joining(" "));
    }
}

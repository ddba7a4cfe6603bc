package com.enrichreview.engine.core.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A position inside a JSON document: object keys as literal segments,
 * array elements as {@code "[index]"} segments.
 *
 * <p>The string form ({@link #key()}) joins segments with {@code '.'} and is the
 * join key between documents, diff trees and validation decisions, e.g.
 * {@code offers.price} or {@code image.[0]}. Keys that contain a dot are not escaped.
 */
public final class FieldPath {

    public static final FieldPath ROOT = new FieldPath(List.of());

    private static final Pattern INDEX = Pattern.compile("^\\[?(\\d+)]?$");

    private final List<String> segments;

    private FieldPath(List<String> segments) {
        this.segments = segments;
    }

    public static FieldPath of(String... segments) {
        if (segments == null || segments.length == 0) return ROOT;
        return new FieldPath(List.copyOf(Arrays.asList(segments)));
    }

    /** Splits a dot-joined key back into segments; null or empty is the root. */
    public static FieldPath parse(String key) {
        if (key == null || key.isEmpty()) return ROOT;
        return new FieldPath(List.of(key.split("\\.", -1)));
    }

    public static String indexSegment(int index) {
        return "[" + index + "]";
    }

    /**
     * Reads an array index from a segment. Accepts {@code [3]} and a bare {@code 3}.
     */
    public static OptionalInt parseIndex(String segment) {
        if (segment == null) return OptionalInt.empty();
        Matcher m = INDEX.matcher(segment.trim());
        if (!m.matches()) return OptionalInt.empty();
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return OptionalInt.empty();
        }
    }

    public FieldPath child(String key) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(key);
        return new FieldPath(Collections.unmodifiableList(next));
    }

    public FieldPath element(int index) {
        return child(indexSegment(index));
    }

    public String segment(int i) {
        return segments.get(i);
    }

    public List<String> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public String key() {
        return String.join(".", segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPath other)) return false;
        return segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return key();
    }
}

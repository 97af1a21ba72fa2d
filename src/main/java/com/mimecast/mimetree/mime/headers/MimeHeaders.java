package com.mimecast.mimetree.mime.headers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered multi-map of MIME headers.
 *
 * <p>Fields keep document order and original casing.
 * <br>Lookup is case-insensitive through a lower-case index of positions.
 * <br>Repeated fields are kept.
 */
public class MimeHeaders {

    /**
     * Headers in document order.
     */
    private final List<MimeHeader> headers = new ArrayList<>();

    /**
     * Lower-case name to positions in headers.
     */
    private final Map<String, List<Integer>> index = new HashMap<>();

    /**
     * Constructs a new empty MimeHeaders instance.
     */
    public MimeHeaders() {
        // Empty.
    }

    /**
     * Constructs a copy of the given MimeHeaders.
     *
     * @param source MimeHeaders instance.
     */
    public MimeHeaders(MimeHeaders source) {
        source.headers.forEach(this::put);
    }

    /**
     * Appends header.
     *
     * @param header MimeHeader instance.
     * @return Self.
     */
    public MimeHeaders put(MimeHeader header) {
        index.computeIfAbsent(key(header.getName()), k -> new ArrayList<>()).add(headers.size());
        headers.add(header);
        return this;
    }

    /**
     * Appends header by name and value.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public MimeHeaders add(String name, String value) {
        return put(new MimeHeader(name, value));
    }

    /**
     * Replaces every field of the given name with a single one.
     * <p>The new field takes the position of the first one replaced, or goes last.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public MimeHeaders set(String name, String value) {
        List<Integer> positions = index.get(key(name));
        if (positions == null) {
            return add(name, value);
        }

        int first = positions.get(0);
        List<MimeHeader> copy = new ArrayList<>(headers);
        copy.set(first, new MimeHeader(name, value));
        for (int i = positions.size() - 1; i > 0; i--) {
            copy.remove((int) positions.get(i));
        }

        headers.clear();
        index.clear();
        copy.forEach(this::put);
        return this;
    }

    /**
     * Gets first header of the given name.
     *
     * @param name Header name.
     * @return Optional of MimeHeader.
     */
    public Optional<MimeHeader> get(String name) {
        List<Integer> positions = index.get(key(name));
        if (positions == null) {
            return Optional.empty();
        }
        return Optional.of(headers.get(positions.get(0)));
    }

    /**
     * Gets first value of the given name.
     *
     * @param name Header name.
     * @return Value or empty string if absent.
     */
    public String getValue(String name) {
        return get(name).map(MimeHeader::getValue).orElse("");
    }

    /**
     * Gets all values of the given name in document order.
     *
     * @param name Header name.
     * @return List of String.
     */
    public List<String> getAll(String name) {
        List<Integer> positions = index.get(key(name));
        if (positions == null) {
            return Collections.emptyList();
        }

        List<String> values = new ArrayList<>(positions.size());
        positions.forEach(i -> values.add(headers.get(i).getValue()));
        return values;
    }

    /**
     * Checks if a header of the given name exists.
     *
     * @param name Header name.
     * @return Boolean.
     */
    public boolean contains(String name) {
        return index.containsKey(key(name));
    }

    /**
     * Gets all headers in document order.
     *
     * @return Unmodifiable list of MimeHeader.
     */
    public List<MimeHeader> get() {
        return Collections.unmodifiableList(headers);
    }

    /**
     * Gets header count.
     *
     * @return Integer.
     */
    public int size() {
        return headers.size();
    }

    /**
     * Is empty.
     *
     * @return Boolean.
     */
    public boolean isEmpty() {
        return headers.isEmpty();
    }

    /**
     * Gets headers as CRLF terminated lines.
     *
     * @return String.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        headers.forEach(sb::append);
        return sb.toString();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}

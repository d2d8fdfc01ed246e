package org.dbmanager.api.batches;

import java.sql.JDBCType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parameters of a batch command, unique by name (case-insensitive), kept in insertion order.
 * Adding a parameter whose name already exists replaces the existing one in place.
 */
public class BatchCommandParameters implements Iterable<BatchCommandParameter> {

    private final Map<String, BatchCommandParameter> parameters = new LinkedHashMap<>();

    public BatchCommandParameters add(BatchCommandParameter parameter) {
        parameters.put(key(parameter.name()), parameter);
        return this;
    }

    public BatchCommandParameters add(String name, Object value) {
        return add(new BatchCommandParameter(name, value));
    }

    public BatchCommandParameters add(String name, JDBCType type, Object value) {
        return add(new BatchCommandParameter(name, type, value));
    }

    public Optional<BatchCommandParameter> get(String name) {
        return Optional.ofNullable(parameters.get(key(name)));
    }

    public boolean contains(String name) {
        return parameters.containsKey(key(name));
    }

    public boolean remove(String name) {
        return parameters.remove(key(name)) != null;
    }

    public void clear() {
        parameters.clear();
    }

    public int size() {
        return parameters.size();
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    public List<BatchCommandParameter> asList() {
        return Collections.unmodifiableList(new ArrayList<>(parameters.values()));
    }

    /**
     * Parameters are immutable records, so copying the map yields an independent set.
     */
    public BatchCommandParameters copy() {
        BatchCommandParameters copy = new BatchCommandParameters();
        copy.parameters.putAll(parameters);
        return copy;
    }

    @Override
    public Iterator<BatchCommandParameter> iterator() {
        return asList().iterator();
    }

    private static String key(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }
}

package com.telcobright.repartition.engine.bridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A client write aimed at the logical table while the bridge is open.
 */
public final class WriteRequest {

    public enum Kind {
        INSERT,
        UPDATE,
        DELETE
    }

    private final Kind kind;
    private final Map<String, Object> values;

    private WriteRequest(Kind kind, Map<String, Object> values) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * An insert of one row; column order follows the map's iteration order.
     */
    public static WriteRequest insert(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("An insert needs at least one column value");
        }
        return new WriteRequest(Kind.INSERT, values);
    }

    public static WriteRequest update(Map<String, Object> values) {
        return new WriteRequest(Kind.UPDATE, values == null ? Collections.emptyMap() : values);
    }

    public static WriteRequest delete(Map<String, Object> key) {
        return new WriteRequest(Kind.DELETE, key == null ? Collections.emptyMap() : key);
    }

    public Kind getKind() { return kind; }
    public Map<String, Object> getValues() { return values; }

    public List<String> getColumns() {
        return new ArrayList<>(values.keySet());
    }

    @Override
    public String toString() {
        return kind + " " + values.keySet();
    }
}

package com.telcobright.repartition.engine.bridge;

import com.telcobright.repartition.core.config.RoutingMode;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableIdentity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read/write indirection over the new canonical table and the retired one.
 * Exists only while both tables exist.
 */
public final class Bridge {

    private final TableIdentity identity;
    private final QualifiedName readView;
    private final QualifiedName writeTarget;
    private final QualifiedName retired;
    private final RoutingMode routing;
    private final QualifiedName trigger;
    private final List<String> columns;
    private final Instant openedAt;

    public Bridge(TableIdentity identity, QualifiedName readView, QualifiedName writeTarget, QualifiedName retired,
                  RoutingMode routing, QualifiedName trigger, List<String> columns, Instant openedAt) {
        if (routing == RoutingMode.AUTO) {
            throw new IllegalArgumentException("A bridge needs a resolved routing mode");
        }
        this.identity = Objects.requireNonNull(identity, "identity");
        this.readView = Objects.requireNonNull(readView, "readView");
        this.writeTarget = Objects.requireNonNull(writeTarget, "writeTarget");
        this.retired = Objects.requireNonNull(retired, "retired");
        this.routing = Objects.requireNonNull(routing, "routing");
        this.trigger = trigger;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt");
    }

    public TableIdentity getIdentity() { return identity; }
    public QualifiedName getReadView() { return readView; }
    public QualifiedName getWriteTarget() { return writeTarget; }
    public QualifiedName getRetired() { return retired; }
    public RoutingMode getRouting() { return routing; }
    public List<String> getColumns() { return columns; }
    public Instant getOpenedAt() { return openedAt; }

    /**
     * The INSTEAD OF trigger, present only for native routing.
     */
    public QualifiedName getTrigger() { return trigger; }

    @Override
    public String toString() {
        return String.format("Bridge[%s via %s, writes -> %s, %s]", identity, readView, writeTarget, routing);
    }
}

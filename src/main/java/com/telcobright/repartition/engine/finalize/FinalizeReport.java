package com.telcobright.repartition.engine.finalize;

import com.telcobright.repartition.core.model.DependentObject;
import com.telcobright.repartition.core.model.TableGrant;
import com.telcobright.repartition.core.model.TableIdentity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of finalizing a run. Problems that do not stop finalization
 * (dependents still invalid, grants that could not be reapplied) are listed
 * here for the operator.
 */
public final class FinalizeReport {

    private final String runId;
    private final TableIdentity identity;
    private final boolean retiredDropped;
    private final long canonicalRowCount;
    private final long retiredRowCount;
    private final List<DependentObject> recompiled;
    private final List<DependentObject> stillInvalid;
    private final List<TableGrant> grantsApplied;
    private final Map<TableGrant, String> grantsFailed;
    private final Instant finishedAt;

    private FinalizeReport(Builder builder) {
        this.runId = builder.runId;
        this.identity = builder.identity;
        this.retiredDropped = builder.retiredDropped;
        this.canonicalRowCount = builder.canonicalRowCount;
        this.retiredRowCount = builder.retiredRowCount;
        this.recompiled = Collections.unmodifiableList(new ArrayList<>(builder.recompiled));
        this.stillInvalid = Collections.unmodifiableList(new ArrayList<>(builder.stillInvalid));
        this.grantsApplied = Collections.unmodifiableList(new ArrayList<>(builder.grantsApplied));
        this.grantsFailed = Collections.unmodifiableMap(new LinkedHashMap<>(builder.grantsFailed));
        this.finishedAt = builder.finishedAt;
    }

    static Builder builder(String runId, TableIdentity identity) {
        return new Builder(runId, identity);
    }

    public String getRunId() { return runId; }
    public TableIdentity getIdentity() { return identity; }
    public boolean isRetiredDropped() { return retiredDropped; }
    public long getCanonicalRowCount() { return canonicalRowCount; }

    /**
     * Rows in the retired table just before it was dropped, or -1 if it was already gone.
     */
    public long getRetiredRowCount() { return retiredRowCount; }
    public List<DependentObject> getRecompiled() { return recompiled; }
    public List<DependentObject> getStillInvalid() { return stillInvalid; }
    public List<TableGrant> getGrantsApplied() { return grantsApplied; }
    public Map<TableGrant, String> getGrantsFailed() { return grantsFailed; }
    public Instant getFinishedAt() { return finishedAt; }

    public boolean isClean() {
        return stillInvalid.isEmpty() && grantsFailed.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("FinalizeReport[%s retiredDropped=%s recompiled=%d stillInvalid=%d grants=%d/%d]",
            identity, retiredDropped, recompiled.size(), stillInvalid.size(),
            grantsApplied.size(), grantsApplied.size() + grantsFailed.size());
    }

    static final class Builder {
        private final String runId;
        private final TableIdentity identity;
        private boolean retiredDropped;
        private long canonicalRowCount = -1;
        private long retiredRowCount = -1;
        private final List<DependentObject> recompiled = new ArrayList<>();
        private final List<DependentObject> stillInvalid = new ArrayList<>();
        private final List<TableGrant> grantsApplied = new ArrayList<>();
        private final Map<TableGrant, String> grantsFailed = new LinkedHashMap<>();
        private Instant finishedAt;

        private Builder(String runId, TableIdentity identity) {
            this.runId = runId;
            this.identity = identity;
        }

        Builder retiredDropped(long canonicalRows, long retiredRows) {
            this.retiredDropped = true;
            this.canonicalRowCount = canonicalRows;
            this.retiredRowCount = retiredRows;
            return this;
        }

        Builder recompiled(DependentObject object) {
            recompiled.add(object);
            return this;
        }

        Builder stillInvalid(List<DependentObject> objects) {
            stillInvalid.addAll(objects);
            return this;
        }

        Builder grantApplied(TableGrant grant) {
            grantsApplied.add(grant);
            return this;
        }

        Builder grantFailed(TableGrant grant, String reason) {
            grantsFailed.put(grant, reason);
            return this;
        }

        FinalizeReport build(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return new FinalizeReport(this);
        }
    }
}

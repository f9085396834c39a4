package com.telcobright.repartition.engine.run;

import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active and archived runs. At most one active run per table.
 */
public class MigrationRegistry {

    private final Map<TableIdentity, MigrationRun> active = new ConcurrentHashMap<>();
    private final Map<String, MigrationRun> byId = new ConcurrentHashMap<>();
    private final List<MigrationRun> archived = Collections.synchronizedList(new ArrayList<>());

    /**
     * @throws PreconditionFailedException if the table already has an active run
     */
    public void register(MigrationRun run) {
        MigrationRun existing = active.putIfAbsent(run.getIdentity(), run);
        if (existing != null) {
            throw new PreconditionFailedException(
                "Table already has an active run " + existing.getId(), run.getIdentity(), existing.getPhase());
        }
        byId.put(run.getId(), run);
    }

    /**
     * Move a finished run out of the active set.
     */
    public void archive(MigrationRun run) {
        if (run.getPhase() != MigrationPhase.FINALIZED && run.getPhase() != MigrationPhase.ABORTED) {
            throw new IllegalStateException("Only finalized or aborted runs can be archived: " + run);
        }
        if (active.remove(run.getIdentity(), run)) {
            archived.add(run);
        }
    }

    public Optional<MigrationRun> find(String runId) {
        return Optional.ofNullable(byId.get(runId));
    }

    public Optional<MigrationRun> activeRun(TableIdentity identity) {
        return Optional.ofNullable(active.get(identity));
    }

    public List<MigrationRun> activeRuns() {
        return new ArrayList<>(active.values());
    }

    public List<MigrationRun> archivedRuns() {
        synchronized (archived) {
            return new ArrayList<>(archived);
        }
    }
}

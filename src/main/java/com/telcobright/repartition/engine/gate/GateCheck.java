package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.QualifiedName;

import java.sql.SQLException;

/**
 * An idempotent, read-only check. Evaluating it twice without intervening
 * writes yields the same verdict.
 */
public interface GateCheck {

    String kind();

    QualifiedName target();

    GateResult evaluate(GateProbe probe) throws SQLException;
}

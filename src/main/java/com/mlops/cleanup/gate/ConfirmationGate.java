package com.mlops.cleanup.gate;

import com.mlops.cleanup.model.CleanupPlan;

/**
 * Operator approval required before a live cleanup touches the cluster.
 */
public interface ConfirmationGate {

    /**
     * @return true only on explicit approval
     */
    boolean confirm(CleanupPlan plan);

    /**
     * Gate used by {@code --non-interactive}.
     */
    ConfirmationGate ALWAYS_APPROVE = plan -> true;
}

package com.openforge.cortex.recovery;

import com.openforge.cortex.llm.model.CompletionEnvelope;

import java.util.List;

/**
 * One stage of the recovery cascade. Returns every validated result it can find,
 * or an empty list to hand over to the next stage.
 */
@FunctionalInterface
public interface RecoveryAttempt {

    List<RecoveredArguments> attempt(CompletionEnvelope envelope, RecoveryTarget target);
}

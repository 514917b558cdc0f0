package io.mnemo.core.evolution;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

public interface ReinforcementEngine {
    Optional<ReinforcementOutcome> reinforce(String ownerId, String recordId) throws IOException;

    MaintenanceReport applyDecay(String ownerId, Instant asOf) throws IOException;
}

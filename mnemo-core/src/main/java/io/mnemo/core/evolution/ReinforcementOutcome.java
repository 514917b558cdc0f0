package io.mnemo.core.evolution;

import io.mnemo.core.record.MemoryRecord;

public record ReinforcementOutcome(MemoryRecord record, boolean leveledUp) {
}

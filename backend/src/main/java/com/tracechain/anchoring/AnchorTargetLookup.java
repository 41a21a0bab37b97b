package com.tracechain.anchoring;

import com.tracechain.domain.EntityKind;

import java.util.Optional;

/**
 * Read-only access to the records that get anchored. Implementations bound each lookup by a timeout.
 */
public interface AnchorTargetLookup {

    Optional<AnchorTarget> lookup(EntityKind entityKind, String entityId);
}

package com.tracechain.anchoring;

import com.tracechain.domain.EntityKind;

public class AnchorTargetNotFoundException extends RuntimeException {

    public AnchorTargetNotFoundException(EntityKind entityKind, String entityId) {
        super(entityKind.key() + " not found: " + entityId);
    }
}

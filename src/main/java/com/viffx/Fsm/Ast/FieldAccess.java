package com.viffx.Fsm.Ast;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@code belongsTo.name}, left unresolved.
 */
public record FieldAccess(String belongsTo, String name) {

    public FieldAccess {
        checkNotNull(belongsTo, "belongsTo");
        checkNotNull(name, "name");
    }

    @Override
    public String toString() {
        return belongsTo + "." + name;
    }
}

package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.Var;

import java.util.Map;
import java.util.Objects;

/**
 * Variable, set-point, threshold or S0 counter value.
 *
 * <p>
 * {@code originalVar} is the type as it appeared on the wire ({@link Var#UNKNOWN}
 * for typeless legacy responses); {@code var} is the attributed type, which
 * the device connection fills in for typeless responses.
 * </p>
 */
public record ModStatusVar(LcnAddress source, Var originalVar, Var var, int value) implements ModInput {

    public ModStatusVar {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(originalVar, "originalVar");
        Objects.requireNonNull(var, "var");
    }

    public ModStatusVar(LcnAddress source, Var var, int value) {
        this(source, var, var, value);
    }

    public ModStatusVar withVar(Var resolved) {
        return new ModStatusVar(source, originalVar, resolved, value);
    }

    @Override
    public ModStatusVar withSource(LcnAddress source) {
        return new ModStatusVar(source, originalVar, var, value);
    }

    @Override
    public Map<String, Object> correlationFields() {
        return Map.of("var", var);
    }
}

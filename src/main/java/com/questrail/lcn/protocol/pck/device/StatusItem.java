package com.questrail.lcn.protocol.pck.device;

import com.questrail.lcn.protocol.pck.model.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Something a module connection can keep fresh by periodic status requests.
 */
public sealed interface StatusItem {

    /** Output port 0..3. */
    record Output(int outputId) implements StatusItem {
        public Output {
            if (outputId < 0 || outputId > 3) {
                throw new IllegalArgumentException("outputId must be in range 0..3");
            }
        }
    }

    /** All 8 relays; also covers motors on relays. */
    record Relays() implements StatusItem {}

    /** All 8 binary sensors. */
    record BinarySensors() implements StatusItem {}

    /** A variable, set-point, threshold or S0 counter. */
    record Variable(Var var) implements StatusItem {
        public Variable {
            Objects.requireNonNull(var, "var");
            if (var == Var.UNKNOWN) {
                throw new IllegalArgumentException("Cannot poll an unknown variable");
            }
        }
    }

    /** All 12 LEDs and 4 logic operations. */
    record LedsAndLogicOps() implements StatusItem {}

    /** Key lock states of all tables. */
    record KeyLocks() implements StatusItem {}

    /**
     * Every pollable item of a module. S0 counters are only included when the
     * module has an S0 extension.
     */
    static List<StatusItem> all(boolean includeS0) {
        List<StatusItem> items = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            items.add(new Output(i));
        }
        items.add(new Relays());
        items.add(new BinarySensors());
        items.add(new LedsAndLogicOps());
        items.add(new KeyLocks());
        for (Var var : Var.values()) {
            if (var == Var.UNKNOWN) {
                continue;
            }
            if (!includeS0 && var.toS0Id() != -1) {
                continue;
            }
            items.add(new Variable(var));
        }
        return items;
    }
}

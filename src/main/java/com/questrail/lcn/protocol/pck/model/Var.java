package com.questrail.lcn.protocol.pck.model;

import java.util.List;

/**
 * Module variables addressable through PCK.
 *
 * <p>
 * The first three variables double as the temperature variable and the two
 * regulator variables on older firmware ({@link #TVAR}, {@link #R1VAR},
 * {@link #R2VAR} are aliases). {@link #UNKNOWN} marks a status report whose
 * variable type was not transmitted (legacy "typeless" responses).
 * </p>
 *
 * <h2>Firmware branches</h2>
 * Modules with a firmware age of at least {@link #UNIFIED_VAR_FIRMWARE} report
 * every variable with its type and send status changes on their own. Older
 * modules do neither for the first three variables and the set-points.
 */
public enum Var {
    UNKNOWN,
    VAR1, VAR2, VAR3, VAR4, VAR5, VAR6, VAR7, VAR8, VAR9, VAR10, VAR11, VAR12,
    R1VARSETPOINT, R2VARSETPOINT,
    THRS1, THRS2, THRS3, THRS4, THRS5,
    THRS2_1, THRS2_2, THRS2_3, THRS2_4,
    THRS3_1, THRS3_2, THRS3_3, THRS3_4,
    THRS4_1, THRS4_2, THRS4_3, THRS4_4,
    S0INPUT1, S0INPUT2, S0INPUT3, S0INPUT4;

    /** First firmware age with typed, id-based variable handling. */
    public static final int UNIFIED_VAR_FIRMWARE = 0x170206;

    public static final Var TVAR = VAR1;
    public static final Var R1VAR = VAR2;
    public static final Var R2VAR = VAR3;

    private static final List<Var> VARIABLES = List.of(
            VAR1, VAR2, VAR3, VAR4, VAR5, VAR6, VAR7, VAR8, VAR9, VAR10, VAR11, VAR12);

    private static final List<Var> SET_POINTS = List.of(R1VARSETPOINT, R2VARSETPOINT);

    private static final List<List<Var>> THRESHOLDS = List.of(
            List.of(THRS1, THRS2, THRS3, THRS4, THRS5),
            List.of(THRS2_1, THRS2_2, THRS2_3, THRS2_4),
            List.of(THRS3_1, THRS3_2, THRS3_3, THRS3_4),
            List.of(THRS4_1, THRS4_2, THRS4_3, THRS4_4));

    private static final List<Var> S0_INPUTS = List.of(S0INPUT1, S0INPUT2, S0INPUT3, S0INPUT4);

    public static Var varIdToVar(int varId) {
        if (varId < 0 || varId >= VARIABLES.size()) {
            throw new IllegalArgumentException("Bad variable id: " + varId);
        }
        return VARIABLES.get(varId);
    }

    public static Var setPointIdToVar(int setPointId) {
        if (setPointId < 0 || setPointId >= SET_POINTS.size()) {
            throw new IllegalArgumentException("Bad set-point id: " + setPointId);
        }
        return SET_POINTS.get(setPointId);
    }

    /**
     * @param registerId threshold register 0..3
     * @param thrsId     threshold 0..4 for register 0, 0..3 otherwise
     */
    public static Var thrsIdToVar(int registerId, int thrsId) {
        if (registerId < 0 || registerId >= THRESHOLDS.size()) {
            throw new IllegalArgumentException("Bad threshold register id: " + registerId);
        }
        List<Var> register = THRESHOLDS.get(registerId);
        if (thrsId < 0 || thrsId >= register.size()) {
            throw new IllegalArgumentException("Bad threshold id: " + thrsId);
        }
        return register.get(thrsId);
    }

    public static Var s0IdToVar(int s0Id) {
        if (s0Id < 0 || s0Id >= S0_INPUTS.size()) {
            throw new IllegalArgumentException("Bad S0 input id: " + s0Id);
        }
        return S0_INPUTS.get(s0Id);
    }

    /** Variable id 0..11, or -1 if this is not a plain variable. */
    public int toVarId() {
        return VARIABLES.indexOf(this);
    }

    /** Set-point id 0..1, or -1. */
    public int toSetPointId() {
        return SET_POINTS.indexOf(this);
    }

    /** Threshold register id 0..3, or -1. */
    public int toThrsRegisterId() {
        for (int i = 0; i < THRESHOLDS.size(); i++) {
            if (THRESHOLDS.get(i).contains(this)) {
                return i;
            }
        }
        return -1;
    }

    /** Threshold id within its register, or -1. */
    public int toThrsId() {
        for (List<Var> register : THRESHOLDS) {
            int idx = register.indexOf(this);
            if (idx >= 0) {
                return idx;
            }
        }
        return -1;
    }

    /** S0 input id 0..3, or -1. */
    public int toS0Id() {
        return S0_INPUTS.indexOf(this);
    }

    public boolean isLockableRegulatorSource() {
        return this == R1VARSETPOINT || this == R2VARSETPOINT;
    }

    /**
     * Whether a status request for this variable is answered with a typed
     * response on a module with the given firmware age.
     */
    public boolean hasTypeInResponse(int swAge) {
        if (swAge < UNIFIED_VAR_FIRMWARE) {
            return !(this == VAR1 || this == VAR2 || this == VAR3
                    || this == R1VARSETPOINT || this == R2VARSETPOINT);
        }
        return true;
    }

    /**
     * Whether the module reports changes of this variable without being polled.
     */
    public boolean isEventBased(int swAge) {
        if (toSetPointId() != -1 || toS0Id() != -1) {
            return true;
        }
        return swAge >= UNIFIED_VAR_FIRMWARE;
    }
}

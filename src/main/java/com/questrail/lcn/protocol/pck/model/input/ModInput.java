package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;

import java.util.Map;

/**
 * Report originating from a bus module.
 *
 * <p>
 * The parser produces inputs with the <em>physical</em> source address seen
 * on the wire. Once the connection is ready, the connection manager replaces
 * it with the logical address via {@link #withSource(LcnAddress)} before
 * routing.
 * </p>
 */
public sealed interface ModInput extends PckInput
        permits ModAck, ModSk, ModSn, ModNameComment, ModStatusGroups,
                ModStatusOutput, ModStatusOutputNative, ModStatusRelays,
                ModStatusBinSensors, ModStatusVar, ModStatusLedsAndLogicOps,
                ModStatusKeyLocks, ModStatusSceneOutputs, ModSendCommandHost,
                ModSendKeysHost, ModStatusAccessControl {

    LcnAddress source();

    ModInput withSource(LcnAddress source);

    /**
     * Named values a status request may be filtered on, for example the
     * output id of an output status report.
     */
    default Map<String, Object> correlationFields() {
        return Map.of();
    }
}

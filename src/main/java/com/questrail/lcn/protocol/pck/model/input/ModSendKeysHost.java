package com.questrail.lcn.protocol.pck.model.input;

import com.questrail.lcn.protocol.pck.model.LcnAddress;
import com.questrail.lcn.protocol.pck.model.SendKeyCommand;

import java.util.List;
import java.util.Objects;

/**
 * "Send keys to host" ({@code STH}): per-table actions for tables A..C and the
 * eight affected keys.
 */
public record ModSendKeysHost(LcnAddress source, List<SendKeyCommand> actions, List<Boolean> keys)
        implements ModInput {

    public ModSendKeysHost {
        Objects.requireNonNull(source, "source");
        actions = List.copyOf(actions);
        keys = List.copyOf(keys);
    }

    @Override
    public ModSendKeysHost withSource(LcnAddress source) {
        return new ModSendKeysHost(source, actions, keys);
    }
}

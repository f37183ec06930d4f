package com.questrail.lcn.protocol.pck.model.input;

import java.util.Objects;

/**
 * A well-formed line no matcher recognized.
 */
public record Unknown(String data) implements PckInput {
    public Unknown {
        Objects.requireNonNull(data, "data");
    }
}

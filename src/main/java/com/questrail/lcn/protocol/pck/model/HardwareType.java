package com.questrail.lcn.protocol.pck.model;

/**
 * Module hardware types as reported in serial number responses.
 */
public enum HardwareType {
    UNKNOWN(-1, "UnknownModuleType"),
    SW1_0(1, "LCN-SW1.0"),
    SW1_1(2, "LCN-SW1.1"),
    UP1_0(3, "LCN-UP1.0"),
    UP2(4, "LCN-UP2"),
    SW2(5, "LCN-SW2"),
    UP_PROFI1_PLUS(6, "LCN-UP-Profi1-Plus"),
    DI12(7, "LCN-DI12"),
    HU(8, "LCN-HU"),
    SH(9, "LCN-SH"),
    UPP(11, "LCN-UPP"),
    SK(12, "LCN-SK"),
    LD(14, "LCN-LD"),
    SH_PLUS(15, "LCN-SH-Plus"),
    UPS(17, "LCN-UPS"),
    UPS24V(18, "LCN_UPS24V"),
    GTM(19, "LCN-GTM"),
    SHS(20, "LCN-SHS"),
    ESD(21, "LCN-ESD"),
    EB2(22, "LCN-EB2"),
    MRS(23, "LCN-MRS"),
    EB11(24, "LCN-EB11"),
    UMR(25, "LCN-UMR"),
    UPU(26, "LCN-UPU"),
    UMR24V(27, "LCN-UMR24V"),
    SHD(28, "LCN-SHD"),
    SHU(29, "LCN-SHU"),
    SR6(30, "LCN-SR6");

    private final int identifier;
    private final String description;

    HardwareType(int identifier, String description) {
        this.identifier = identifier;
        this.description = description;
    }

    public int identifier() {
        return identifier;
    }

    public String description() {
        return description;
    }

    /**
     * Maps a reported hardware id to its type. Id 10 is a second id of the
     * UP2; ids without a known type map to {@link #UNKNOWN}.
     */
    public static HardwareType fromId(int id) {
        int effective = id == 10 ? 4 : id;
        for (HardwareType t : values()) {
            if (t.identifier == effective) {
                return t;
            }
        }
        return UNKNOWN;
    }
}

package com.questrail.lcn.protocol.pck.codec.impl;

import java.util.regex.Pattern;

/**
 * Literal host strings and message patterns of the PCK protocol.
 *
 * <p>All patterns are applied with {@link java.util.regex.Matcher#lookingAt()}:
 * anchored at the start of the line, trailing characters ignored.</p>
 */
public final class PckPatterns
{
    private PckPatterns() {}

    public static final String AUTH_USERNAME = "Username:";
    public static final String AUTH_PASSWORD = "Password:";
    public static final String AUTH_OK = "OK";
    public static final String AUTH_FAILED = "Authentification failed.";
    public static final String LCNCONNSTATE_CONNECTED = "$io:#LCN:connected";
    public static final String LCNCONNSTATE_DISCONNECTED = "$io:#LCN:disconnected";
    public static final String LICENSE_ERROR = "$err:(license?)";
    public static final String DEC_MODE_SET = "(dec-mode)";

    private static final String MOD = "(\\d{3})(\\d{3})";

    static final Pattern PING = Pattern.compile("\\^ping(\\d*)");
    static final Pattern COMMAND_ERROR = Pattern.compile("\\((?<message>.+)\\?\\)");

    static final Pattern ACK_POS = Pattern.compile("-M" + MOD + "!");
    static final Pattern ACK_NEG = Pattern.compile("-M" + MOD + "(\\d+)");

    static final Pattern SK_RESPONSE = Pattern.compile("=M" + MOD + "\\.SK(\\d+)");
    static final Pattern SN = Pattern.compile(
            "=M" + MOD + "\\.SN([0-9A-F]{10})(\\w{2})FW([0-9A-F]{6})HW(\\d+)");
    static final Pattern NAME_COMMENT = Pattern.compile("=M" + MOD + "\\.([NKO])(\\d)(.{0,12})");
    static final Pattern STATUS_GROUPS = Pattern.compile(
            "=M" + MOD + "\\.G([DP])(\\d{3})((?:\\d{3}){0,12})");

    static final Pattern STATUS_OUTPUT_PERCENT = Pattern.compile(":M" + MOD + "A(\\d)(\\d+)");
    static final Pattern STATUS_OUTPUT_NATIVE = Pattern.compile(":M" + MOD + "O(\\d)(\\d+)");
    static final Pattern STATUS_RELAYS = Pattern.compile(":M" + MOD + "Rx(\\d+)");
    static final Pattern STATUS_BINSENSORS = Pattern.compile(":M" + MOD + "Bx(\\d+)");

    static final Pattern STATUS_VAR = Pattern.compile("%M" + MOD + "\\.A(\\d{3})(\\d+)");
    static final Pattern STATUS_SETVAR = Pattern.compile("%M" + MOD + "\\.S(\\d)(\\d+)");
    static final Pattern STATUS_THRS = Pattern.compile("%M" + MOD + "\\.T(\\d)(\\d)(\\d+)");
    static final Pattern STATUS_S0INPUT = Pattern.compile("%M" + MOD + "\\.C(\\d)(\\d+)");
    static final Pattern VAR_GENERIC = Pattern.compile("%M" + MOD + "\\.(\\d+)");
    static final Pattern THRS5 = Pattern.compile(
            "=M" + MOD + "\\.S1(\\d{5})(\\d{5})(\\d{5})(\\d{5})(\\d{5})(\\d{5})");

    static final Pattern STATUS_LEDSANDLOGICOPS = Pattern.compile(
            "=M" + MOD + "\\.TL([AEBF]{12})([NTV]{4})");
    static final Pattern STATUS_KEYLOCKS = Pattern.compile(
            "=M" + MOD + "\\.TX(\\d{3})(\\d{3})(\\d{3})(\\d{3})?");
    static final Pattern STATUS_SCENE_OUTPUTS = Pattern.compile(
            "=M" + MOD + "\\.SZ(\\d{3})((?:\\d{3}){8})");

    static final Pattern SEND_COMMAND_HOST = Pattern.compile(
            "(?:\\+M004|\\$M)" + MOD + "\\.SKH((?:\\d{3}){2})((?:\\d{3}){4})?((?:\\d{3}){8})?");
    static final Pattern SEND_KEYS_HOST = Pattern.compile(
            "(?:\\+M004|\\$M)" + MOD + "\\.STH(\\d{3})(\\d{3})");

    static final Pattern STATUS_TRANSMITTER = Pattern.compile(
            "=M" + MOD + "\\.ZI(\\d{3})(\\d{3})(\\d{3})(\\d{2})(\\d)(\\d{3})");
    static final Pattern STATUS_TRANSPONDER = Pattern.compile(
            "=M" + MOD + "\\.ZT(\\d{3})(\\d{3})(\\d{3})");
    static final Pattern STATUS_FINGERPRINT = Pattern.compile(
            "=M" + MOD + "\\.ZF(\\d{3})(\\d{3})(\\d{3})");
    static final Pattern STATUS_CODELOCK = Pattern.compile(
            "=M" + MOD + "\\.ZC(\\d{3})(\\d{3})(\\d{3})");
}

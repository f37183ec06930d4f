package com.questrail.lcn.protocol.pck.codec;

/**
 * Conversions between milliseconds and the module-internal time encodings.
 *
 * <ul>
 *   <li><b>Ramp values</b> (0..250): used by dimming and scene commands. The
 *       first ten steps follow a fixed table; above that each step is two
 *       seconds.</li>
 *   <li><b>Native values</b> (0..255): logarithmic encoding used by the relay
 *       timer.</li>
 * </ul>
 */
public final class PckTimeConversions
{
    private static final int[] RAMP_TABLE_MILLIS = {0, 250, 500, 660, 1000, 1400, 2000, 3000, 4000, 5000};

    private static final int MAX_RAMP_VALUE = 250;
    private static final int MAX_NATIVE_TIME_MILLIS = 240960;

    private PckTimeConversions() {}

    /**
     * Converts a duration into a ramp value, clamped to 250.
     */
    public static int timeToRampValue(long timeMillis)
    {
        for (int step = 1; step < RAMP_TABLE_MILLIS.length; step++) {
            if (timeMillis < RAMP_TABLE_MILLIS[step]) {
                return step - 1;
            }
        }
        if (timeMillis < 6000) {
            return 9;
        }
        double ramp = (timeMillis / 1000.0 - 6) / 2 + 10;
        return (int) Math.min(ramp, MAX_RAMP_VALUE);
    }

    public static int rampValueToTime(int rampValue)
    {
        if (rampValue < 0 || rampValue > MAX_RAMP_VALUE) {
            throw new IllegalArgumentException("Ramp value must be in range 0..250: " + rampValue);
        }
        if (rampValue < RAMP_TABLE_MILLIS.length) {
            return RAMP_TABLE_MILLIS[rampValue];
        }
        return ((rampValue - 10) * 2 + 6) * 1000;
    }

    /**
     * Converts a duration (0..240960 ms) into the native relay timer value.
     */
    public static int timeToNativeValue(long timeMillis)
    {
        if (timeMillis < 0 || timeMillis > MAX_NATIVE_TIME_MILLIS) {
            throw new IllegalArgumentException("Time must be in range 0..240960ms: " + timeMillis);
        }
        double scaled = timeMillis / (1000 * 0.03 * 32.0) + 1.0;
        int preDecimal = 31 - Integer.numberOfLeadingZeros((int) scaled);
        double decimal = scaled / (1 << preDecimal) - 1;
        return (int) (32 * (preDecimal + decimal));
    }

    public static int nativeValueToTime(int value)
    {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Value must be in range 0..255: " + value);
        }
        int preDecimal = value / 32;
        double decimal = value / 32.0 - preDecimal;
        double scaled = (1 << preDecimal) * (decimal + 1);
        return (int) ((scaled - 1) * 1000 * 0.03 * 32);
    }
}

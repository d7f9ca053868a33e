package dev.devanks.agronomy.eto.calculation;

/**
 * Vendor unit normalization. Everything downstream works in °C, %, m/s, mm and MJ/m²/day.
 */
public final class UnitConversions {

    private static final double SECONDS_PER_DAY = 86_400;
    private static final double LUX_PER_WATT = 110; // approximate, for broadband sunlight

    private UnitConversions() {
    }

    public static double kmhToMs(double kmh) {
        return kmh / 3.6;
    }

    /**
     * Daily mean irradiance (W/m²) to daily energy (MJ/m²/day), i.e. ×0.0864.
     */
    public static double wattsToMegajoulesPerDay(double wattsPerSquareMeter) {
        return wattsPerSquareMeter * SECONDS_PER_DAY / 1_000_000;
    }

    public static double wattsToLux(double wattsPerSquareMeter) {
        return wattsPerSquareMeter * LUX_PER_WATT;
    }

    public static double secondsToHours(double seconds) {
        return seconds / 3600;
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/calculation/PenmanMonteithCalculator.java
package dev.devanks.agronomy.eto.calculation;

/**
 * Simplified FAO-56 Penman-Monteith reference evapotranspiration.
 * <p>
 * Uses daily mean temperature from the max/min pair, mean relative humidity and the
 * sea-level psychrometric constant. Soil heat flux is taken as zero for daily steps.
 */
public final class PenmanMonteithCalculator {

    static final double PSYCHROMETRIC_CONSTANT = 0.067; // kPa/°C at 101.3 kPa

    private PenmanMonteithCalculator() {
    }

    /**
     * @param tempMax           daily maximum air temperature (°C)
     * @param tempMin           daily minimum air temperature (°C)
     * @param humidityMean      mean relative humidity (%)
     * @param windSpeed         wind speed (m/s)
     * @param solarRadiationMJ  incoming shortwave radiation (MJ/m²/day)
     * @return ETo in mm/day, never negative
     */
    public static double eto(double tempMax, double tempMin, double humidityMean,
                             double windSpeed, double solarRadiationMJ) {
        double tempMean = (tempMax + tempMin) / 2;

        double es = (saturationVaporPressure(tempMax) + saturationVaporPressure(tempMin)) / 2;
        double ea = es * (humidityMean / 100);
        double delta = slopeOfSaturationCurve(tempMean);
        double gamma = PSYCHROMETRIC_CONSTANT;

        double numerator = 0.408 * delta * solarRadiationMJ
                + (gamma * 900 * windSpeed * (es - ea)) / (tempMean + 273);
        double denominator = delta + gamma * (1 + 0.34 * windSpeed);

        return Math.max(0, numerator / denominator);
    }

    /**
     * Saturation vapor pressure (kPa) at the given air temperature (°C).
     */
    public static double saturationVaporPressure(double temperature) {
        return 0.6108 * Math.exp((17.27 * temperature) / (temperature + 237.3));
    }

    static double slopeOfSaturationCurve(double temperature) {
        return (4098 * saturationVaporPressure(temperature)) / Math.pow(temperature + 237.3, 2);
    }
}

// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/SensorFusionRefiner.java
package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.calculation.PenmanMonteithCalculator;
import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.model.AccuracyMethod;
import dev.devanks.agronomy.eto.model.EnhancedEToResult;
import dev.devanks.agronomy.eto.model.LocalSensorReading;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.round;

/**
 * Replaces provider inputs with on-farm sensor values where available and recomputes ETo.
 * Solar radiation always comes from the provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SensorFusionRefiner {

    private final EtoProperties etoProperties;

    public EnhancedEToResult refine(WeatherObservation apiData, LocalSensorReading sensor) {
        sensor.validate();
        List<EnhancedEToResult.Correction> corrections = new ArrayList<>();

        double tempMax = apiData.getTemperatureMax();
        double tempMin = apiData.getTemperatureMin();
        if (sensor.hasTemperaturePair()) {
            double apiMean = (tempMax + tempMin) / 2;
            tempMax = sensor.getTemperatureMax();
            tempMin = sensor.getTemperatureMin();
            double sensorMean = (tempMax + tempMin) / 2;
            corrections.add(correction("temperature", sensorMean - apiMean,
                    String.format("Local %s temperature sensor replaced provider temperature", sourceTag(sensor))));
        }

        double humidity = apiData.getRelativeHumidityMean();
        if (sensor.getHumidity() != null) {
            corrections.add(correction("humidity", sensor.getHumidity() - humidity,
                    String.format("Local %s humidity reading replaced provider humidity", sourceTag(sensor))));
            humidity = sensor.getHumidity();
        }

        double wind = apiData.getWindSpeed();
        if (sensor.getWindSpeed() != null) {
            wind = sensor.getWindSpeed();
            corrections.add(correction("wind", 0, "Local wind speed measurement used"));
        }

        double refined = round(PenmanMonteithCalculator.eto(tempMax, tempMin, humidity, wind,
                apiData.getShortwaveRadiationSum()), 2);
        log.info("Sensor fusion refined {} ETo {} -> {} with {} substitutions.",
                apiData.getProvider().getTag(), apiData.getEt0FaoEvapotranspiration(), refined, corrections.size());

        EtoProperties.SensorFusionProperties policy = etoProperties.getSensorFusion();
        List<EnhancedEToResult.Contributor> contributors = new ArrayList<>();
        contributors.add(EnhancedEToResult.Contributor.builder()
                .provider(apiData.getProvider())
                .eto(apiData.getEt0FaoEvapotranspiration())
                .weight(1.0)
                .build());

        return EnhancedEToResult.builder()
                .eto(refined)
                .confidence(policy.getConfidence())
                .method(AccuracyMethod.SENSOR_FUSION)
                .contributors(contributors)
                .corrections(corrections)
                .metadata(EnhancedEToResult.ResultMetadata.builder()
                        .providersUsed(1)
                        .hasLocalSensors(true)
                        .hasRegionalCalibration(false)
                        .estimatedError(policy.getEstimatedErrorPercent())
                        .build())
                .build();
    }

    private static String sourceTag(LocalSensorReading sensor) {
        return sensor.getSource() != null ? sensor.getSource().tag() : "manual";
    }

    private static EnhancedEToResult.Correction correction(String type, double adjustment, String reason) {
        return EnhancedEToResult.Correction.builder().type(type).adjustment(adjustment).reason(reason).build();
    }
}

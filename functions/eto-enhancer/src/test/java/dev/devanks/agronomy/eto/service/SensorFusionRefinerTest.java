package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.calculation.PenmanMonteithCalculator;
import dev.devanks.agronomy.eto.calculation.UnitConversions;
import dev.devanks.agronomy.eto.config.EtoProperties;
import dev.devanks.agronomy.eto.exception.InvalidSensorReadingException;
import dev.devanks.agronomy.eto.model.AccuracyMethod;
import dev.devanks.agronomy.eto.model.EnhancedEToResult;
import dev.devanks.agronomy.eto.model.LocalSensorReading;
import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.SensorSource;
import dev.devanks.agronomy.eto.model.WeatherObservation;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class SensorFusionRefinerTest {

    private final SensorFusionRefiner refiner = new SensorFusionRefiner(new EtoProperties());

    private static final WeatherObservation API_DAY = WeatherObservation.builder()
            .date(LocalDate.of(2024, 4, 20))
            .provider(ProviderId.OPEN_METEO)
            .temperatureMax(32.0)
            .temperatureMin(24.0)
            .relativeHumidityMean(70.0)
            .windSpeed(2.0)
            .shortwaveRadiationSum(20.0)
            .et0FaoEvapotranspiration(5.0)
            .build();

    @Test
    void refine_TemperatureAndHumidity_RecomputesWithSensorValues() {
        LocalSensorReading sensor = LocalSensorReading.builder()
                .temperatureMax(30.0).temperatureMin(22.0).humidity(80.0).source(SensorSource.IOT).build();

        EnhancedEToResult result = refiner.refine(API_DAY, sensor);

        double expected = UnitConversions.round(PenmanMonteithCalculator.eto(30.0, 22.0, 80.0, 2.0, 20.0), 2);
        assertThat(result.getEto()).isEqualTo(expected);
        assertThat(result.getMethod()).isEqualTo(AccuracyMethod.SENSOR_FUSION);
        assertThat(result.getConfidence()).isEqualTo(0.9);
        assertThat(result.getMetadata().getEstimatedError()).isEqualTo(5.0);
        assertThat(result.getMetadata().isHasLocalSensors()).isTrue();
        assertThat(result.getCorrections())
                .extracting(EnhancedEToResult.Correction::getType, EnhancedEToResult.Correction::getAdjustment)
                .containsExactly(tuple("temperature", -2.0), tuple("humidity", 10.0));
        assertThat(result.getCorrections().get(0).getReason()).contains("iot");
        assertThat(result.getContributors()).singleElement()
                .satisfies(c -> assertThat(c.getEto()).isEqualTo(5.0));
    }

    @Test
    void refine_OnlyMinTemperature_KeepsProviderTemperature() {
        LocalSensorReading sensor = LocalSensorReading.builder().temperatureMin(20.0).windSpeed(3.5).build();

        EnhancedEToResult result = refiner.refine(API_DAY, sensor);

        assertThat(result.getEto()).isCloseTo(PenmanMonteithCalculator.eto(32.0, 24.0, 70.0, 3.5, 20.0), within(0.005));
        assertThat(result.getCorrections()).extracting(EnhancedEToResult.Correction::getType).containsExactly("wind");
        assertThat(result.getCorrections().get(0).getAdjustment()).isEqualTo(0.0);
    }

    @Test
    void refine_ConfiguredConfidenceIsUsed() {
        EtoProperties properties = new EtoProperties();
        properties.getSensorFusion().setConfidence(0.8);
        properties.getSensorFusion().setEstimatedErrorPercent(7.5);

        EnhancedEToResult result = new SensorFusionRefiner(properties).refine(API_DAY, LocalSensorReading.builder().humidity(60.0).build());

        assertThat(result.getConfidence()).isEqualTo(0.8);
        assertThat(result.getMetadata().getEstimatedError()).isEqualTo(7.5);
    }

    @Test
    void refine_ImpossibleReading_Rejected() {
        LocalSensorReading sensor = LocalSensorReading.builder().temperatureMax(20.0).temperatureMin(25.0).build();

        assertThatThrownBy(() -> refiner.refine(API_DAY, sensor))
                .isInstanceOf(InvalidSensorReadingException.class);
    }
}

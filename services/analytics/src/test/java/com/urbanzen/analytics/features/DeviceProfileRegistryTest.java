package com.urbanzen.analytics.features;

import com.urbanzen.analytics.config.AnalyticsProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceProfileRegistryTest {

    @Test
    void shouldExposeBuiltInTypesInOrder() {
        DeviceProfileRegistry registry = DeviceProfileRegistry.builtIn();

        assertThat(registry.knownDeviceTypes())
                .containsExactly("water_sensor", "electricity_meter", "traffic_camera", "air_quality_sensor");
        assertThat(registry.profile("WATER_SENSOR")).isPresent();
        assertThat(registry.profile("gas_meter")).isEmpty();
        assertThat(registry.profile(null)).isEmpty();
    }

    @Test
    void shouldRegisterConfiguredTypesWithoutCodeChanges() {
        AnalyticsProperties.Features features = new AnalyticsProperties.Features();
        AnalyticsProperties.Profile gas = new AnalyticsProperties.Profile();
        gas.setChannels(List.of("methane", "flow_rate"));
        features.getProfiles().put("gas_meter", gas);
        AnalyticsProperties.Range battery = new AnalyticsProperties.Range();
        battery.setMin(0.0);
        battery.setMax(5.0);
        features.getQualityBounds().put("battery_level", battery);

        DeviceProfileRegistry registry = DeviceProfileRegistry.from(features);

        assertThat(registry.knownDeviceTypes()).endsWith("gas_meter");
        assertThat(registry.profile("gas_meter").orElseThrow().tracks("methane")).isTrue();
        assertThat(registry.qualityBounds().defaults().get("battery_level").normalize(2.5)).isEqualTo(0.5);
        assertThat(registry.qualityBounds().defaults()).containsKey("signal_strength");
    }

    @Test
    void shouldLayerProfileQualityBoundsOverDefaults() {
        // Given a type that reports signal strength on its own scale
        AnalyticsProperties.Features features = new AnalyticsProperties.Features();
        AnalyticsProperties.Profile lora = new AnalyticsProperties.Profile();
        lora.setChannels(List.of("soil_moisture"));
        AnalyticsProperties.Range signal = new AnalyticsProperties.Range();
        signal.setMin(-140.0);
        signal.setMax(-40.0);
        lora.getQualityBounds().put("signal_strength", signal);
        features.getProfiles().put("lora_gateway", lora);

        // When
        DeviceProfileRegistry registry = DeviceProfileRegistry.from(features);
        QualityBoundsTable table = registry.qualityBounds();

        // Then
        assertThat(registry.profile("lora_gateway").orElseThrow().qualityBounds())
                .containsEntry("signal_strength", new QualityBounds(-140.0, -40.0));
        assertThat(table.boundsFor("LORA_GATEWAY").get("signal_strength").normalize(-90.0)).isEqualTo(0.5);
        assertThat(table.boundsFor("lora_gateway").get("battery_level")).isEqualTo(new QualityBounds(0.0, 100.0));
        assertThat(table.boundsFor("water_sensor").get("signal_strength")).isEqualTo(new QualityBounds(-120.0, 0.0));
        assertThat(table.boundsFor(null)).isEqualTo(table.defaults());
    }
}

package com.urbanzen.analytics.features;

import com.urbanzen.analytics.state.DeviceHistory;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Turns a telemetry event plus its device history into a feature vector.
 *
 * Pure and thread-safe: no I/O, no shared mutable state. Extraction never
 * fails; missing or undefined inputs degrade to 0.0.
 */
public class FeatureExtractor {

    private static final double TWO_PI = 2 * Math.PI;

    private final int windowSize;
    private final double epsilon;
    private final ZoneId zone;
    private final DeviceProfileRegistry profiles;

    public FeatureExtractor(int windowSize, double epsilon, ZoneId zone, DeviceProfileRegistry profiles) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.windowSize = windowSize;
        this.epsilon = epsilon;
        this.zone = zone;
        this.profiles = profiles;
    }

    /**
     * Extracts features using the registry's quality bounds.
     */
    public FeatureVector extract(TelemetryEvent event, DeviceHistory history, Collection<String> knownDeviceTypes) {
        return extract(event, history, knownDeviceTypes, profiles.qualityBounds());
    }

    /**
     * Extracts features for {@code event}.
     *
     * @param history          the device's stored samples; only samples older than the
     *                         event are used, so the history may already contain it
     * @param knownDeviceTypes one-hot columns, in order
     * @param qualityBounds    fixed min-max bounds per quality field, resolved by device type
     */
    public FeatureVector extract(TelemetryEvent event, DeviceHistory history,
                                 Collection<String> knownDeviceTypes,
                                 QualityBoundsTable qualityBounds) {
        List<TelemetryEvent> window = new ArrayList<>(history.before(event.timestamp(), windowSize - 1));
        window.add(event);

        FeatureVector.Builder features = FeatureVector.builder();
        addTimeFeatures(features, event);
        for (String channel : channelsFor(event, window)) {
            addChannelFeatures(features, channel, window);
        }
        addDeviceIndicators(features, event.deviceType(), knownDeviceTypes);
        addQualityFeatures(features, event, qualityBounds.boundsFor(event.deviceType()));
        return features.build();
    }

    public int windowSize() {
        return windowSize;
    }

    private void addTimeFeatures(FeatureVector.Builder features, TelemetryEvent event) {
        ZonedDateTime local = event.timestamp().atZone(zone);
        int hour = local.getHour();
        int dayOfWeek = local.getDayOfWeek().getValue() - 1; // Monday = 0

        features.put(FeatureNames.HOUR_SIN, Math.sin(TWO_PI * hour / 24.0))
                .put(FeatureNames.HOUR_COS, Math.cos(TWO_PI * hour / 24.0))
                .put(FeatureNames.DOW_SIN, Math.sin(TWO_PI * dayOfWeek / 7.0))
                .put(FeatureNames.DOW_COS, Math.cos(TWO_PI * dayOfWeek / 7.0))
                .put(FeatureNames.IS_WEEKEND, isWeekend(local.getDayOfWeek()) ? 1.0 : 0.0);
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private TreeSet<String> channelsFor(TelemetryEvent event, List<TelemetryEvent> window) {
        Optional<DeviceProfile> profile = profiles.profile(event.deviceType());
        if (profile.isPresent()) {
            return new TreeSet<>(profile.get().channels());
        }
        TreeSet<String> channels = new TreeSet<>();
        for (TelemetryEvent sample : window) {
            sample.metrics().forEach((name, value) -> {
                if (Double.isFinite(value)) {
                    channels.add(name);
                }
            });
        }
        return channels;
    }

    private void addChannelFeatures(FeatureVector.Builder features, String channel, List<TelemetryEvent> window) {
        double sum = 0.0;
        int count = 0;
        for (TelemetryEvent sample : window) {
            Double value = valueOf(sample, channel);
            if (value != null) {
                sum += value;
                count++;
            }
        }
        double mean = count > 0 ? sum / count : 0.0;

        double squares = 0.0;
        for (TelemetryEvent sample : window) {
            Double value = valueOf(sample, channel);
            if (value != null) {
                squares += (value - mean) * (value - mean);
            }
        }
        double std = count > 1 ? Math.sqrt(squares / (count - 1)) : 0.0;

        Double current = valueOf(window.get(window.size() - 1), channel);
        double raw = current != null ? current : 0.0;

        double rateOfChange = 0.0;
        if (current != null && window.size() > 1) {
            Double previous = valueOf(window.get(window.size() - 2), channel);
            if (previous != null) {
                rateOfChange = (current - previous) / Math.max(Math.abs(previous), epsilon);
            }
        }

        features.put(channel, raw)
                .put(FeatureNames.rollingMean(channel), mean)
                .put(FeatureNames.rollingStd(channel), std)
                .put(FeatureNames.diffFromMean(channel), current != null ? current - mean : 0.0)
                .put(FeatureNames.rateOfChange(channel), rateOfChange);
    }

    private static Double valueOf(TelemetryEvent sample, String channel) {
        Double value = sample.metrics().get(channel);
        return value != null && Double.isFinite(value) ? value : null;
    }

    private static void addDeviceIndicators(FeatureVector.Builder features, String deviceType,
                                            Collection<String> knownDeviceTypes) {
        String type = deviceType != null ? deviceType.toLowerCase(Locale.ROOT) : null;
        for (String known : knownDeviceTypes) {
            features.put(FeatureNames.deviceIndicator(known), known.equals(type) ? 1.0 : 0.0);
        }
    }

    private static void addQualityFeatures(FeatureVector.Builder features, TelemetryEvent event,
                                           Map<String, QualityBounds> qualityBounds) {
        event.qualityFields().forEach((field, value) -> {
            QualityBounds bounds = qualityBounds.get(field);
            if (bounds != null && Double.isFinite(value)) {
                features.put(FeatureNames.normalized(field), bounds.normalize(value));
            }
        });
    }
}

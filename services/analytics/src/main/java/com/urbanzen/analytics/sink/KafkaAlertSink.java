package com.urbanzen.analytics.sink;

import com.urbanzen.analytics.exception.AnalyticsException;
import com.urbanzen.analytics.exception.TransientEmissionException;
import com.urbanzen.common.dto.alert.AlertEvent;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes alerts to the alerts topic, keyed by device id.
 *
 * Sends wait for the broker acknowledgement. A send that times out has an
 * unknown outcome and is not retried, keeping delivery at most once.
 */
public class KafkaAlertSink implements AlertSink {

    static final String SINK = "alert";

    private static final Logger log = LoggerFactory.getLogger(KafkaAlertSink.class);

    private final KafkaTemplate<String, AlertEvent> kafkaTemplate;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaAlertSink(KafkaTemplate<String, AlertEvent> kafkaTemplate, String topic, Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void publish(AlertEvent alert) {
        try {
            SendResult<String, AlertEvent> result = kafkaTemplate.send(topic, alert.deviceId(), alert)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Published {} alert for device={}, partition={}, offset={}",
                    alert.severity().getValue(), alert.deviceId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransientEmissionException(SINK, cause.getMessage(), cause);
        } catch (KafkaException e) {
            throw new TransientEmissionException(SINK, e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new AnalyticsException("Alert delivery for device " + alert.deviceId()
                    + " unconfirmed after " + sendTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientEmissionException(SINK, "interrupted while publishing", e);
        }
    }

    @Override
    public void flush() {
        kafkaTemplate.flush();
    }
}

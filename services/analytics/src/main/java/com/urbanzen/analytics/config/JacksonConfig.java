package com.urbanzen.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urbanzen.analytics.artifact.ModelArtifactManager;
import com.urbanzen.analytics.ingest.TelemetryEventDecoder;
import com.urbanzen.common.util.JsonUtil;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Everything that reads or writes JSON shares one mapper: telemetry records
 * from Kafka, alert payloads, stored model artifacts and the status endpoints.
 */
@Configuration
public class JacksonConfig implements WebFluxConfigurer {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonUtil.getObjectMapper();
    }

    @Bean
    public TelemetryEventDecoder telemetryEventDecoder(ObjectMapper objectMapper) {
        return new TelemetryEventDecoder(objectMapper);
    }

    @Bean
    public ModelArtifactManager modelArtifactManager(ObjectMapper objectMapper) {
        return new ModelArtifactManager(objectMapper);
    }

    // status and error bodies carry Instants and records from the common module
    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        ObjectMapper mapper = objectMapper();
        configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
    }
}

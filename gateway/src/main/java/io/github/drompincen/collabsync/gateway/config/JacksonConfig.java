package io.github.drompincen.collabsync.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.collabsync.protocol.ws.WireCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    ObjectMapper objectMapper() {
        return WireCodec.defaultMapper();
    }
}

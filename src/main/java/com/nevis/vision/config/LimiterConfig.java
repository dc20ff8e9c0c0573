package com.nevis.vision.config;

import com.nevis.vision.infra.InMemoryOutboundRateLimiter;
import com.nevis.vision.infra.OutboundRateLimiter;
import com.nevis.vision.model.Capability;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class LimiterConfig {

    private static final int DEFAULT_REQUESTS_PER_MINUTE = 60;

    @Bean
    public OutboundRateLimiter outboundRateLimiter(VisionProperties properties) {
        return new InMemoryOutboundRateLimiter(Map.of(
            Capability.EMBED_IMAGE.getBackendId(), properties.embedding().requestsPerMinute(),
            Capability.COMPARE_FACES.getBackendId(), properties.face().requestsPerMinute(),
            Capability.DETECT_DEEPFAKE.getBackendId(), properties.deepfake().requestsPerMinute(),
            Capability.SEARCH_REVERSE_IMAGE.getBackendId(), properties.reverseSearch().requestsPerMinute()
        ), DEFAULT_REQUESTS_PER_MINUTE);
    }
}

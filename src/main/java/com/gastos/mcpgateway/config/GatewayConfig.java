package com.gastos.mcpgateway.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GatewayConfig {

    /**
     * Time source for cache TTLs, rate-limit windows and latency measurement.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

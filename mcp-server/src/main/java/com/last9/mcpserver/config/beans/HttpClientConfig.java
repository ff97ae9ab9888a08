package com.last9.mcpserver.config.beans;

import com.last9.mcpserver.config.properties.Last9Properties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Shared HTTP client and clock.
 *
 * Every backend call goes through the one RestTemplate built here, so the connect and
 * read timeouts below are the only bound on a tool invocation.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(Last9Properties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getHttp().getConnectTimeout());
        factory.setReadTimeout(properties.getHttp().getReadTimeout());
        log.info("Configured backend HTTP client - connectTimeout: {}ms, readTimeout: {}ms",
                properties.getHttp().getConnectTimeout(), properties.getHttp().getReadTimeout());
        return new RestTemplate(factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

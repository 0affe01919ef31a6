package com.goormthonuniv.factmerge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class WebConfig {

    /**
     * 외부 호출(OpenPageRank, Semantic Scholar, OpenAI) 공용 클라이언트.
     * 모든 호출은 짧은 타임아웃을 가지며, 타임아웃은 각 어댑터에서 miss 로 처리된다.
     */
    @Bean
    public RestClient restClient(RestClient.Builder builder,
                                 @Value("${factmerge.http.connect-timeout-ms:2000}") long connectTimeoutMs,
                                 @Value("${factmerge.http.read-timeout-ms:8000}") long readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
        factory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return builder.requestFactory(factory).build();
    }
}

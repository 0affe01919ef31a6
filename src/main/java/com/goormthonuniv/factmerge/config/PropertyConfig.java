package com.goormthonuniv.factmerge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

// API 키 등 비공개 값은 env.properties 로 분리 (없으면 무시)
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}

package com.opencalsync.sync.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableFeignClients(basePackages = "com.opencalsync.sync.client")
public class FeignConfig {
}

package com.slotbooking.payout.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Kept off the application class so sliced tests do not try to build Feign clients.
 */
@Configuration
@EnableFeignClients(basePackages = "com.slotbooking.payout.client")
public class FeignConfig {
}

package com.pricelens.backend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pricing.monitor.enabled", havingValue = "true")
public class PriceMonitorScheduler {

    private final PriceMonitorService priceMonitorService;

    @Scheduled(fixedDelayString = "${pricing.monitor.interval-millis:2000}")
    public void runCycle() {
        priceMonitorService.runCycle();
    }
}

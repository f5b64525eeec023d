package com.vestpod.priceupdate;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PriceUpdateProperties.class)
public class PriceUpdateConfig {
}

package com.sonet.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "sonet.search")
public class SearchProperties {
    private double defaultRadiusKm = 10.0;
    private int defaultLimit = 20;
    private int maxLimit = 100;
}

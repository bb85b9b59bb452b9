package com.sonet.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "sonet.id")
public class IdProperties {
    private long datacenterId = 1;
    private long workerId = 1;
}

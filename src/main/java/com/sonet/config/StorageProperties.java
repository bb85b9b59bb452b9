package com.sonet.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "sonet.storage")
public class StorageProperties {
    /** Which backend answers queries; fixed for the lifetime of the process. */
    private Adapter adapter = Adapter.SQLITE;
    /** Per-statement timeout, also applied to MyBatis as default-statement-timeout. */
    private int queryTimeoutSeconds = 5;

    public enum Adapter {
        SQLITE,
        POSTGRES
    }
}

package com.sonet.config;

import com.sonet.post.mapper.PostMapper;
import com.sonet.post.store.PostStore;
import com.sonet.post.store.postgis.PostgisPostStore;
import com.sonet.post.store.sqlite.SqlitePostStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.ibatis.mapping.DatabaseIdProvider;
import org.apache.ibatis.mapping.VendorDatabaseIdProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Properties;

/**
 * Binds the storage backend once at startup. Everything downstream depends on
 * {@link PostStore} only.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    public PostStore postStore(StorageProperties props, PostMapper mapper) {
        PostStore store = switch (props.getAdapter()) {
            case SQLITE -> new SqlitePostStore(mapper);
            case POSTGRES -> new PostgisPostStore(mapper);
        };
        log.info("storage.adapter selected={} queryTimeoutSeconds={}", store.adapterName(), props.getQueryTimeoutSeconds());
        return store;
    }

    /**
     * Lets PostMapper.xml pick dialect-specific statements by databaseId.
     */
    @Bean
    public DatabaseIdProvider databaseIdProvider() {
        Properties vendors = new Properties();
        vendors.setProperty("SQLite", "sqlite");
        vendors.setProperty("PostgreSQL", "postgresql");
        VendorDatabaseIdProvider provider = new VendorDatabaseIdProvider();
        provider.setProperties(vendors);
        return provider;
    }
}

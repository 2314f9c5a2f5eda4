package com.example.platformsync.config;

import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@Slf4j
public class MinioConfig {

    /**
     * S3-compatible client. Credentials come from the environment only; when none are set the
     * client is anonymous.
     */
    @Bean
    public MinioClient minioClient(SyncProperties properties) {
        SyncProperties.ObjectStore store = properties.getObjectStore();
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(store.getEndpoint());
        if (StringUtils.hasText(store.getRegion())) {
            builder.region(store.getRegion());
        }
        if (StringUtils.hasText(store.getAccessKey())) {
            builder.credentials(store.getAccessKey(), store.getSecretKey());
        } else {
            log.warn("No object store credentials configured, using anonymous access to {}", store.getEndpoint());
        }
        return builder.build();
    }
}

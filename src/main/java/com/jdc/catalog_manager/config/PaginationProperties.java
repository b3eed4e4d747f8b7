package com.jdc.catalog_manager.config;

import lombok.Getter; import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.pagination")
@Getter @Setter
public class PaginationProperties {
    private int defaultLimit = 20;
    private int maxLimit = 100;
}

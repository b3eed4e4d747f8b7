package com.jdc.catalog_manager.config;

import lombok.Getter; import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.catalog")
@Getter @Setter
public class CatalogProperties {

    private final Search search = new Search();

    @Getter @Setter
    public static class Search {
        /** Case sensitivity of the substring match used by catalog search. */
        private boolean caseSensitive = false;
    }
}

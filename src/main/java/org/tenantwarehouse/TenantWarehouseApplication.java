package org.tenantwarehouse;

import org.tenantwarehouse.configuration.AnalyticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AnalyticsProperties.class)
public class TenantWarehouseApplication {
    public static void main(String[] args) {
        SpringApplication.run(TenantWarehouseApplication.class, args);
    }
}

package org.caureq.fabricops;

import org.caureq.fabricops.config.FabricProps;
import org.caureq.fabricops.config.NxapiProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({FabricProps.class, NxapiProps.class})
public class FabricOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FabricOpsApplication.class, args);
    }

}

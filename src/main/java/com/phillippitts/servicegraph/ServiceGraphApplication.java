package com.phillippitts.servicegraph;

import com.phillippitts.servicegraph.config.properties.ServiceGraphProperties;
import com.phillippitts.servicegraph.config.properties.ValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ServiceGraphProperties.class,
        ValidationProperties.class
})
public class ServiceGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServiceGraphApplication.class, args);
    }

}

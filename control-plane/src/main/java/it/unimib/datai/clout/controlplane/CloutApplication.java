package it.unimib.datai.clout.controlplane;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CloutApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloutApplication.class, args);
    }
}

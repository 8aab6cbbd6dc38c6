package com.phillippitts.coordsim;

import com.phillippitts.coordsim.config.properties.OrchestrationProperties;
import com.phillippitts.coordsim.config.properties.SessionProperties;
import com.phillippitts.coordsim.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        OrchestrationProperties.class,
        SessionProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class CoordSimApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordSimApplication.class, args);
    }

}

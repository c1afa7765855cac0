package com.phillippitts.hybridinference;

import com.phillippitts.hybridinference.config.properties.FailoverProperties;
import com.phillippitts.hybridinference.config.properties.RoutingProperties;
import com.phillippitts.hybridinference.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RoutingProperties.class,
        FailoverProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class HybridInferenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(HybridInferenceApplication.class, args);
    }

}

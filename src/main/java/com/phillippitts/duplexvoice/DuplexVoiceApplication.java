package com.phillippitts.duplexvoice;

import com.phillippitts.duplexvoice.config.properties.DuplexProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DuplexProperties.class)
public class DuplexVoiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DuplexVoiceApplication.class, args);
    }

}

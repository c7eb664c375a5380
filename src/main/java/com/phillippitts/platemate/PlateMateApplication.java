package com.phillippitts.platemate;

import com.phillippitts.platemate.config.properties.GeminiProperties;
import com.phillippitts.platemate.config.properties.LocationProperties;
import com.phillippitts.platemate.config.properties.PersistenceProperties;
import com.phillippitts.platemate.config.properties.SpeechProperties;
import com.phillippitts.platemate.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        GeminiProperties.class,
        LocationProperties.class,
        SpeechProperties.class,
        PersistenceProperties.class,
        ThreadPoolProperties.class
})
public class PlateMateApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlateMateApplication.class, args);
    }

}

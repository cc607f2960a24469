package by.greenmobile.psychrocalc;

import by.greenmobile.psychrocalc.config.PsychroProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(value = {PsychroProperties.class})
@SpringBootApplication
public class PsychroCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(PsychroCalcApplication.class, args);
    }

}

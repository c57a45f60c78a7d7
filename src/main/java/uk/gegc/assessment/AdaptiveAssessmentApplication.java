package uk.gegc.assessment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdaptiveAssessmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveAssessmentApplication.class, args);
    }

}

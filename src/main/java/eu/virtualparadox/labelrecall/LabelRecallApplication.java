package eu.virtualparadox.labelrecall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LabelRecallApplication {

    public static void main(final String[] args) {
        SpringApplication.run(LabelRecallApplication.class, args);
    }
}

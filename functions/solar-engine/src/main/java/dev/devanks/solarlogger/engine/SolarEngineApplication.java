package dev.devanks.solarlogger.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SolarEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolarEngineApplication.class, args);
    }
}

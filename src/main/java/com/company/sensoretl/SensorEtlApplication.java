package com.company.sensoretl;

import com.company.sensoretl.cli.PartitionCommand;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@OpenAPIDefinition(
        info = @Info(
                title = "Sensor ETL Service API",
                version = "1.0.0",
                description = "Partitioned aggregation and load of minute-resolution sensor data"
        )
)
public class SensorEtlApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(SensorEtlApplication.class);

        if (PartitionCommand.isOneShot(args)) {
            // no web server, no schedules; exit with the command's code
            application.setAdditionalProfiles("command");
            System.exit(SpringApplication.exit(application.run(args)));
        }

        application.run(args);
    }
}

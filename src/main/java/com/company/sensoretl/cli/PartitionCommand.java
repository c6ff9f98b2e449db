package com.company.sensoretl.cli;

import com.company.sensoretl.domain.enums.PartitionTrigger;
import com.company.sensoretl.domain.result.PartitionResult;
import com.company.sensoretl.exception.PartitionValidationException;
import com.company.sensoretl.service.PartitionRunService;
import com.company.sensoretl.service.SignalProvisioningService;
import com.company.sensoretl.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * One-shot invocation: {@code --provision} seeds the signal registry, {@code --date=YYYY-MM-DD}
 * (or a bare {@code YYYY-MM-DD} argument) runs a single partition and prints the result.
 * Exit code 0 for success and no_data, 1 otherwise.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PartitionCommand implements ApplicationRunner, ExitCodeGenerator {

    static final String DATE_OPTION = "date";
    static final String PROVISION_OPTION = "provision";

    private final PartitionRunService runService;
    private final SignalProvisioningService provisioningService;

    private int exitCode = 0;

    public static boolean isOneShot(String... args) {
        return Arrays.stream(args).anyMatch(arg -> !arg.startsWith("--")
                || arg.startsWith("--" + DATE_OPTION) || arg.equals("--" + PROVISION_OPTION));
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(PROVISION_OPTION)) {
            provision();
        }
        if (exitCode == 0 && (args.containsOption(DATE_OPTION) || !args.getNonOptionArgs().isEmpty())) {
            runPartition(dateArgument(args));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void provision() {
        try {
            List<String> inserted = provisioningService.provisionMissing();
            System.out.println("Provisioned " + inserted.size() + " signals" + (inserted.isEmpty() ? "" : ": " + inserted));
        } catch (Exception e) {
            log.error("Signal provisioning failed", e);
            System.out.println("Error: signal provisioning failed: " + e.getMessage());
            exitCode = 1;
        }
    }

    /**
     * {@code --date=YYYY-MM-DD} wins; otherwise the first non-option argument, which also covers
     * {@code --date YYYY-MM-DD} and a bare date.
     */
    private static String dateArgument(ApplicationArguments args) {
        List<String> values = args.containsOption(DATE_OPTION) ? args.getOptionValues(DATE_OPTION) : List.of();
        if (!values.isEmpty() && !values.get(0).isBlank()) {
            return values.get(0);
        }
        List<String> positional = args.getNonOptionArgs();
        return positional.isEmpty() ? null : positional.get(0);
    }

    private void runPartition(String value) {
        LocalDate partitionDate;
        try {
            partitionDate = TimeUtils.parsePartitionDate(value);
        } catch (PartitionValidationException e) {
            System.out.println("Error: " + e.getMessage());
            exitCode = 1;
            return;
        }

        PartitionResult result = runService.run(partitionDate, PartitionTrigger.COMMAND_LINE);
        System.out.println(PartitionResultFormatter.format(result));
        exitCode = result.getStatus().getExitCode();
    }
}

package com.company.sensoretl.cli;

import com.company.sensoretl.domain.enums.PartitionStage;
import com.company.sensoretl.domain.enums.PartitionTrigger;
import com.company.sensoretl.domain.result.PartitionResult;
import com.company.sensoretl.service.PartitionRunService;
import com.company.sensoretl.service.SignalProvisioningService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PartitionCommandTest {

    private static final LocalDate PARTITION = LocalDate.of(2025, 8, 10);
    private static final Instant NOW = Instant.parse("2025-08-11T01:00:00Z");

    @Mock
    private PartitionRunService runService;

    @Mock
    private SignalProvisioningService provisioningService;

    @InjectMocks
    private PartitionCommand command;

    @Test
    void isOneShot_shouldDetectCommandOptions() {
        assertTrue(PartitionCommand.isOneShot("--date=2025-08-10"));
        assertTrue(PartitionCommand.isOneShot("--provision"));
        assertTrue(PartitionCommand.isOneShot("2025-08-10"));
        assertFalse(PartitionCommand.isOneShot("--server.port=8081"));
        assertFalse(PartitionCommand.isOneShot());
    }

    @Test
    void run_shouldExitZeroOnSuccess() {
        when(runService.run(PARTITION, PartitionTrigger.COMMAND_LINE)).thenReturn(PartitionResult.success(
                PARTITION, 2880, 1152, 144, Map.of(), NOW, NOW));

        command.run(new DefaultApplicationArguments("--date=2025-08-10"));

        assertEquals(0, command.getExitCode());
    }

    @Test
    void run_shouldExitZeroWhenSourceHasNoData() {
        when(runService.run(PARTITION, PartitionTrigger.COMMAND_LINE))
                .thenReturn(PartitionResult.noData(PARTITION, NOW, NOW));

        command.run(new DefaultApplicationArguments("--date=2025-08-10"));

        assertEquals(0, command.getExitCode());
    }

    @Test
    void run_shouldExitOneWhenNothingResolves() {
        when(runService.run(PARTITION, PartitionTrigger.COMMAND_LINE)).thenReturn(PartitionResult.noValidData(
                PARTITION, 10, 1, List.of("power_mean"), NOW, NOW));

        command.run(new DefaultApplicationArguments("--date=2025-08-10"));

        assertEquals(1, command.getExitCode());
    }

    @Test
    void run_shouldExitOneOnError() {
        when(runService.run(PARTITION, PartitionTrigger.COMMAND_LINE)).thenReturn(PartitionResult.failed(
                PARTITION, 0, 0, 0, PartitionStage.EXTRACTING, "Source API returned 500", NOW, NOW));

        command.run(new DefaultApplicationArguments("--date=2025-08-10"));

        assertEquals(1, command.getExitCode());
    }

    @Test
    void run_shouldAcceptBareDateArgument() {
        when(runService.run(PARTITION, PartitionTrigger.COMMAND_LINE))
                .thenReturn(PartitionResult.noData(PARTITION, NOW, NOW));

        command.run(new DefaultApplicationArguments("2025-08-10"));

        verify(runService).run(PARTITION, PartitionTrigger.COMMAND_LINE);
        assertEquals(0, command.getExitCode());
    }

    @Test
    void run_shouldAcceptDateOptionSeparatedBySpace() {
        when(runService.run(PARTITION, PartitionTrigger.COMMAND_LINE))
                .thenReturn(PartitionResult.noData(PARTITION, NOW, NOW));

        command.run(new DefaultApplicationArguments("--date", "2025-08-10"));

        verify(runService).run(PARTITION, PartitionTrigger.COMMAND_LINE);
        assertEquals(0, command.getExitCode());
    }

    @Test
    void run_shouldExitOneWhenDateValueIsMissing() {
        command.run(new DefaultApplicationArguments("--date"));

        assertEquals(1, command.getExitCode());
        verifyNoInteractions(runService);
    }

    @Test
    void run_shouldExitOneOnMalformedDateWithoutRunning() {
        command.run(new DefaultApplicationArguments("--date=2025-13-45"));

        assertEquals(1, command.getExitCode());
        verifyNoInteractions(runService);
    }

    @Test
    void run_shouldProvisionBeforeRunningPartition() {
        when(provisioningService.provisionMissing()).thenReturn(List.of("wind_speed_mean"));
        when(runService.run(PARTITION, PartitionTrigger.COMMAND_LINE))
                .thenReturn(PartitionResult.noData(PARTITION, NOW, NOW));

        command.run(new DefaultApplicationArguments("--provision", "--date=2025-08-10"));

        verify(provisioningService).provisionMissing();
        assertEquals(0, command.getExitCode());
    }

    @Test
    void run_shouldSkipPartitionWhenProvisioningFails() {
        when(provisioningService.provisionMissing()).thenThrow(new IllegalStateException("database down"));

        command.run(new DefaultApplicationArguments("--provision", "--date=2025-08-10"));

        assertEquals(1, command.getExitCode());
        verify(runService, never()).run(any(), any());
    }
}

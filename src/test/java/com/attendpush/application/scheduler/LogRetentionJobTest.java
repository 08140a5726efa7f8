package com.attendpush.application.scheduler;

import com.attendpush.domain.exception.PunchLogException;
import com.attendpush.domain.port.GatewayStateStore;
import com.attendpush.domain.port.PunchLogWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LogRetentionJob")
class LogRetentionJobTest {

    @Mock
    private PunchLogWriter logWriter;

    @Mock
    private GatewayStateStore stateStore;

    private LogRetentionJob job;

    @BeforeEach
    void setUp() {
        job = new LogRetentionJob(logWriter, stateStore);
        ReflectionTestUtils.setField(job, "retentionDays", 30);
    }

    @Test
    @DisplayName("compacta solo hasta el cursor absorbido y con la ventana configurada")
    void compactsUpToCursor() {
        when(stateStore.get(GatewayStateStore.PROCESSING_CURSOR, 0)).thenReturn(42L);
        when(logWriter.compact(any(), eq(42L))).thenReturn(7);

        assertThat(job.sweep()).isEqualTo(7);

        LocalDateTime expected = LocalDateTime.now().minusDays(30);
        verify(logWriter).compact(argThat(cutoff ->
                cutoff.isAfter(expected.minusMinutes(1)) && cutoff.isBefore(expected.plusMinutes(1))), eq(42L));
    }

    @Test
    @DisplayName("un error de E/S se registra y no se propaga")
    void ioErrorIsContained() {
        when(stateStore.get(GatewayStateStore.PROCESSING_CURSOR, 0)).thenReturn(5L);
        when(logWriter.compact(any(), anyLong())).thenThrow(PunchLogException.cannotWrite("punches.csv", null));

        assertThat(job.sweep()).isZero();
    }

    @Test
    @DisplayName("retención 0 desactiva la limpieza")
    void disabledWithZeroDays() {
        ReflectionTestUtils.setField(job, "retentionDays", 0);

        assertThat(job.sweep()).isZero();
        verifyNoInteractions(logWriter, stateStore);
    }
}

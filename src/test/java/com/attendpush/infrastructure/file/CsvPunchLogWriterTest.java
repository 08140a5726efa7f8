package com.attendpush.infrastructure.file;

import com.attendpush.domain.exception.PunchLogException;
import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.LogEntry;
import com.attendpush.domain.port.GatewayStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CsvPunchLogWriter")
class CsvPunchLogWriterTest {

    @TempDir
    Path tempDir;

    private BinaryStateStore stateStore;
    private CsvPunchLogWriter writer;

    @BeforeEach
    void setUp() {
        stateStore = new BinaryStateStore();
        ReflectionTestUtils.setField(stateStore, "stateFilePath", tempDir.resolve("state.dat").toString());
        writer = newWriter();
    }

    @Nested
    @DisplayName("appendUnseen")
    class AppendUnseen {

        @Test
        @DisplayName("asigna secuencias crecientes desde 1")
        void assignsIncreasingSequences() {
            List<AttendancePunch> appended = writer.appendUnseen(List.of(
                    punch("1001", "2024-03-05T08:00:00"),
                    punch("1002", "2024-03-05T08:01:00")));

            assertThat(appended).extracting(AttendancePunch::getSequence).containsExactly(1L, 2L);
            assertThat(writer.lastSequence()).isEqualTo(2);
            assertThat(readEntries()).extracting(LogEntry::getSequence).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("descarta duplicados dentro del lote y contra lo ya visto")
        void dropsDuplicates() {
            writer.appendUnseen(List.of(punch("1001", "2024-03-05T08:00:00")));

            List<AttendancePunch> appended = writer.appendUnseen(List.of(
                    punch("1001", "2024-03-05T08:00:00"),
                    punch("1002", "2024-03-05T08:01:00"),
                    punch("1002", "2024-03-05T08:01:00")));

            assertThat(appended).hasSize(1);
            assertThat(readEntries()).hasSize(2);
        }

        @Test
        @DisplayName("conserva todos los campos de la marcación")
        void roundTripsFields() {
            AttendancePunch original = punch("1001", "2024-03-05T08:00:00");
            original.setDeviceRecordId("REC-9");
            original.setAuxiliaryFields(new ArrayList<>(List.of("255", "0")));
            writer.appendUnseen(List.of(original));

            AttendancePunch read = readEntries().get(0).getPunch();

            assertThat(read.getExternalId()).isEqualTo("1001");
            assertThat(read.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 5, 8, 0));
            assertThat(read.getDeviceSerial()).isEqualTo("SN1");
            assertThat(read.getDeviceLabel()).isEqualTo("Front, door \"A\"");
            assertThat(read.getDeviceRecordId()).isEqualTo("REC-9");
            assertThat(read.getAuxiliaryFields()).containsExactly("255", "0");
            assertThat(read.key()).isEqualTo(original.key());
        }

        @Test
        @DisplayName("escrituras concurrentes no se intercalan ni se pierden")
        void concurrentAppends() throws Exception {
            int threads = 8;
            int perThread = 25;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        writer.appendUnseen(List.of(punch("T" + thread + "-" + i, "2024-03-05T08:00:00")));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
            pool.shutdown();

            List<LogEntry> entries = readEntries();
            assertThat(entries).hasSize(threads * perThread).allMatch(LogEntry::isValid);
            assertThat(entries.stream().map(LogEntry::getSequence).collect(Collectors.toSet()))
                    .hasSize(threads * perThread);
            assertThat(writer.lastSequence()).isEqualTo(threads * perThread);
        }

        @Test
        @DisplayName("sin inicializar lanza PunchLogException")
        void notReady() {
            CsvPunchLogWriter uninitialized = new CsvPunchLogWriter(stateStore);

            assertThat(uninitialized.isReady()).isFalse();
            assertThatThrownBy(() -> uninitialized.appendUnseen(List.of(punch("1", "2024-03-05T08:00:00"))))
                    .isInstanceOf(PunchLogException.class);
        }
    }

    @Nested
    @DisplayName("arranque")
    class Startup {

        @Test
        @DisplayName("trunca una línea final incompleta y continúa la secuencia")
        void truncatesTornTail() throws Exception {
            writer.appendUnseen(List.of(punch("1001", "2024-03-05T08:00:00")));
            Files.write(logPath(), "\"2\",\"1002\",\"2024-03".getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.APPEND);

            CsvPunchLogWriter restarted = newWriter();
            List<AttendancePunch> appended = restarted.appendUnseen(List.of(punch("1003", "2024-03-05T08:02:00")));

            byte[] bytes = Files.readAllBytes(logPath());
            assertThat(bytes[bytes.length - 1]).isEqualTo((byte) '\n');
            assertThat(appended.get(0).getSequence()).isEqualTo(2L);
            assertThat(readEntries()).extracting(e -> e.getPunch().getExternalId()).containsExactly("1001", "1003");
        }

        @Test
        @DisplayName("la secuencia nunca queda por debajo del cursor persistido")
        void sequenceFloorFromCursor() {
            stateStore.put(GatewayStateStore.PROCESSING_CURSOR, 50);

            CsvPunchLogWriter restarted = newWriter();
            List<AttendancePunch> appended = restarted.appendUnseen(List.of(punch("1001", "2024-03-05T08:00:00")));

            assertThat(appended.get(0).getSequence()).isEqualTo(51L);
        }

        @Test
        @DisplayName("crea el archivo con cabecera")
        void createsFileWithHeader() throws Exception {
            assertThat(writer.isReady()).isTrue();
            assertThat(Files.readAllLines(logPath()).get(0)).startsWith("seq,external_id");
        }
    }

    @Nested
    @DisplayName("compact")
    class Compact {

        @Test
        @DisplayName("elimina solo entradas antiguas ya absorbidas")
        void removesOldAbsorbedEntries() throws Exception {
            LocalDateTime old = LocalDateTime.now().minusDays(40);
            writer.appendUnseen(List.of(
                    punch("1", "2024-01-01T08:00:00", old),
                    punch("2", "2024-01-01T08:01:00", old),
                    punch("3", "2024-01-01T08:02:00", old),
                    punch("4", "2024-03-05T08:00:00", LocalDateTime.now()),
                    punch("5", "2024-03-05T08:01:00", LocalDateTime.now())));

            int removed = writer.compact(LocalDateTime.now().minusDays(30), 2);

            assertThat(removed).isEqualTo(2);
            assertThat(readEntries()).extracting(LogEntry::getSequence).containsExactly(3L, 4L, 5L);
            assertThat(Files.exists(tempDir.resolve("punches.csv.tmp"))).isFalse();
        }

        @Test
        @DisplayName("después de compactar la secuencia continúa")
        void sequenceContinuesAfterCompaction() {
            LocalDateTime old = LocalDateTime.now().minusDays(40);
            writer.appendUnseen(List.of(punch("1", "2024-01-01T08:00:00", old), punch("2", "2024-01-01T08:01:00", old)));
            writer.compact(LocalDateTime.now().minusDays(30), 2);

            List<AttendancePunch> appended = writer.appendUnseen(List.of(punch("3", "2024-03-05T08:00:00")));

            assertThat(appended.get(0).getSequence()).isEqualTo(3L);
        }

        @Test
        @DisplayName("sin entradas vencidas no reescribe el archivo")
        void nothingToRemove() {
            writer.appendUnseen(List.of(punch("1", "2024-03-05T08:00:00")));

            assertThat(writer.compact(LocalDateTime.now().minusDays(30), 1)).isZero();
            assertThat(readEntries()).hasSize(1);
        }
    }

    private CsvPunchLogWriter newWriter() {
        CsvPunchLogWriter w = new CsvPunchLogWriter(stateStore);
        ReflectionTestUtils.setField(w, "logPath", logPath().toString());
        w.init();
        return w;
    }

    private Path logPath() {
        return tempDir.resolve("punches.csv");
    }

    private List<LogEntry> readEntries() {
        try {
            return PunchLogFormat.readEntries(logPath());
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static AttendancePunch punch(String id, String timestamp) {
        return punch(id, timestamp, LocalDateTime.now());
    }

    private static AttendancePunch punch(String id, String timestamp, LocalDateTime receivedAt) {
        return AttendancePunch.builder()
                .externalId(id)
                .timestamp(LocalDateTime.parse(timestamp))
                .direction(0)
                .eventType(1)
                .deviceSerial("SN1")
                .deviceLabel("Front, door \"A\"")
                .receivedAt(receivedAt)
                .build();
    }
}

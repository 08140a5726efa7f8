package com.attendpush.infrastructure.file;

import com.attendpush.domain.port.GatewayStateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BinaryStateStore")
class BinaryStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("sin archivo devuelve el valor por defecto")
    void defaultsWhenMissing() {
        BinaryStateStore store = newStore();

        assertThat(store.get(GatewayStateStore.PROCESSING_CURSOR, 7)).isEqualTo(7);
    }

    @Test
    @DisplayName("los valores sobreviven un reinicio")
    void persistsAcrossRestart() {
        BinaryStateStore store = newStore();
        store.put(GatewayStateStore.PROCESSING_CURSOR, 42);
        store.put(GatewayStateStore.NEXT_COMMAND_ID, 1005);

        BinaryStateStore restarted = newStore();

        assertThat(restarted.get(GatewayStateStore.PROCESSING_CURSOR, 0)).isEqualTo(42);
        assertThat(restarted.get(GatewayStateStore.NEXT_COMMAND_ID, 1000)).isEqualTo(1005);
        assertThat(Files.exists(tempDir.resolve("state.dat.tmp"))).isFalse();
    }

    @Test
    @DisplayName("un archivo corrupto se aparta como .corrupt y se puede volver a escribir")
    void corruptFileIsKeptAside() throws Exception {
        byte[] garbage = { 1, 2, 3 };
        Files.write(tempDir.resolve("state.dat"), garbage);

        BinaryStateStore store = newStore();
        assertThat(store.get(GatewayStateStore.PROCESSING_CURSOR, 0)).isZero();
        assertThat(tempDir.resolve("state.dat.corrupt")).exists().hasBinaryContent(garbage);

        store.put(GatewayStateStore.PROCESSING_CURSOR, 3);
        assertThat(newStore().get(GatewayStateStore.PROCESSING_CURSOR, 0)).isEqualTo(3);
    }

    @Test
    @DisplayName("un archivo truncado conserva las entradas legibles")
    void truncatedFileKeepsReadableEntries() throws Exception {
        BinaryStateStore store = newStore();
        store.put(GatewayStateStore.NEXT_COMMAND_ID, 1042);
        store.put(GatewayStateStore.PROCESSING_CURSOR, 9);
        Path file = tempDir.resolve("state.dat");
        byte[] full = Files.readAllBytes(file);
        // Se corta dentro del valor de la segunda entrada
        Files.write(file, Arrays.copyOf(full, full.length - 3));

        BinaryStateStore restarted = newStore();

        assertThat(restarted.get(GatewayStateStore.NEXT_COMMAND_ID, 1000)).isEqualTo(1042);
        assertThat(restarted.get(GatewayStateStore.PROCESSING_CURSOR, 0)).isZero();
        assertThat(tempDir.resolve("state.dat.corrupt")).exists();
    }

    @Test
    @DisplayName("snapshot es una copia inmutable")
    void snapshotIsImmutable() {
        BinaryStateStore store = newStore();
        store.put(GatewayStateStore.PROCESSING_CURSOR, 1);

        assertThatThrownBy(() -> store.snapshot().put("x", 1L)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(store.snapshot()).containsEntry(GatewayStateStore.PROCESSING_CURSOR, 1L);
    }

    private BinaryStateStore newStore() {
        BinaryStateStore store = new BinaryStateStore();
        ReflectionTestUtils.setField(store, "stateFilePath", tempDir.resolve("state.dat").toString());
        store.load();
        return store;
    }
}

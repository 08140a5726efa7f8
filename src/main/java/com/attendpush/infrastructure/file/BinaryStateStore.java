package com.attendpush.infrastructure.file;

import com.attendpush.domain.exception.StateStoreException;
import com.attendpush.domain.port.GatewayStateStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Guarda el estado del gateway (cursor de procesamiento, contador de
 * comandos) en un archivo binario.
 * Cada escritura genera un archivo temporal completo y lo reemplaza con un
 * rename atómico, de modo que una caída nunca deja el documento a medias.
 */
@Component
@Slf4j
public class BinaryStateStore implements GatewayStateStore {

    private static final int MAGIC = 0x41505354; // "APST" en hex
    private static final short FORMAT_VERSION = 1;

    @Value("${state.file-path:./data_logs/.gateway_state.dat}")
    private String stateFilePath;

    private final Map<String, Long> values = new LinkedHashMap<>();
    private boolean loaded = false;

    @PostConstruct
    public synchronized void load() {
        values.clear();
        loaded = true;
        Path path = Paths.get(stateFilePath);

        if (!Files.exists(path)) {
            log.info("Archivo de estado no existe, se parte de valores por defecto: {}", path);
            return;
        }

        try (DataInputStream dis = new DataInputStream(
                new BufferedInputStream(new FileInputStream(path.toFile())))) {
            int magic = dis.readInt();
            if (magic != MAGIC) {
                log.error("✗ Archivo de estado con formato inválido (magic: {})", Integer.toHexString(magic));
                quarantine(path);
                return;
            }
            short version = dis.readShort();
            long savedAt = dis.readLong();
            int count = dis.readInt();
            for (int i = 0; i < count; i++) {
                values.put(dis.readUTF(), dis.readLong());
            }
            log.info("Estado cargado: {} (versión: {}, guardado: {})", values, version, savedAt);

        } catch (IOException e) {
            // Las entradas leídas antes del error son válidas y se conservan
            log.error("✗ Archivo de estado {} corrupto ({}); valores recuperados: {}. "
                    + "Las claves faltantes vuelven a su valor por defecto", path, e.getMessage(), values);
            quarantine(path);
        }
    }

    @Override
    public synchronized long get(String key, long defaultValue) {
        ensureLoaded();
        return values.getOrDefault(key, defaultValue);
    }

    @Override
    public synchronized void put(String key, long value) {
        ensureLoaded();
        Long previous = values.put(key, value);
        try {
            flush();
        } catch (IOException e) {
            if (previous == null) {
                values.remove(key);
            } else {
                values.put(key, previous);
            }
            throw StateStoreException.cannotWrite(stateFilePath, e);
        }
    }

    @Override
    public synchronized Map<String, Long> snapshot() {
        ensureLoaded();
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    private void ensureLoaded() {
        if (!loaded) {
            load();
        }
    }

    /**
     * Aparta el archivo ilegible como {@code <nombre>.corrupt} antes de que la
     * próxima escritura lo reemplace.
     */
    private void quarantine(Path path) {
        Path target = path.resolveSibling(path.getFileName() + ".corrupt");
        try {
            Files.move(path, target, StandardCopyOption.REPLACE_EXISTING);
            log.error("✗ Archivo de estado corrupto conservado en {}", target);
        } catch (IOException e) {
            log.error("✗ No se pudo apartar el archivo de estado corrupto {}: {}", path, e.getMessage());
        }
    }

    private void flush() throws IOException {
        Path path = Paths.get(stateFilePath);
        if (path.getParent() != null && !Files.exists(path.getParent())) {
            Files.createDirectories(path.getParent());
        }

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (FileOutputStream fos = new FileOutputStream(tmp.toFile());
                DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(fos))) {
            dos.writeInt(MAGIC);
            dos.writeShort(FORMAT_VERSION);
            dos.writeLong(System.currentTimeMillis());
            dos.writeInt(values.size());
            for (Map.Entry<String, Long> e : values.entrySet()) {
                dos.writeUTF(e.getKey());
                dos.writeLong(e.getValue());
            }
            dos.flush();
            fos.getFD().sync();
        }

        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Estado persistido: {}", values);
    }
}

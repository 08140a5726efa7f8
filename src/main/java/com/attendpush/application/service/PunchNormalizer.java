package com.attendpush.application.service;

import com.attendpush.domain.exception.PunchLogException;
import com.attendpush.domain.model.AttendancePunch;
import com.attendpush.domain.model.NormalizationResult;
import com.attendpush.domain.model.ParseResult;
import com.attendpush.domain.port.PunchLogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Convierte payloads ATTLOG en marcaciones y las agrega, sin duplicados, al
 * log intermedio.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PunchNormalizer {

    private final AttlogTokenizer tokenizer;
    private final PunchLogWriter logWriter;

    /**
     * Procesa un payload recibido de un terminal. Nunca lanza excepción: el
     * terminal ya recibió su acuse.
     *
     * @param payload        Cuerpo ATTLOG (una marcación por línea)
     * @param declaredSerial Serial declarado en la petición (SN=), puede ser null
     * @param deviceLabel    Nombre configurado del terminal, puede ser null
     */
    public NormalizationResult ingest(String payload, String declaredSerial, String deviceLabel) {
        if (payload == null || payload.isBlank()) {
            return NormalizationResult.empty();
        }

        List<AttendancePunch> parsed = new ArrayList<>();
        int rejected = 0;
        for (ParseResult result : tokenizer.tokenize(payload, declaredSerial, deviceLabel, LocalDateTime.now())) {
            if (result.isOk()) {
                parsed.add(result.getPunch());
            } else {
                rejected++;
                log.warn("Línea ATTLOG descartada ({}): {}", result.getReason(), result.getLine());
            }
        }

        if (parsed.isEmpty()) {
            return new NormalizationResult(0, 0, rejected);
        }

        try {
            List<AttendancePunch> appended = logWriter.appendUnseen(parsed);
            NormalizationResult summary = new NormalizationResult(
                    appended.size(), parsed.size() - appended.size(), rejected);
            log.info("ATTLOG de {}: {} nuevas, {} duplicadas, {} descartadas",
                    declaredSerial, summary.getAppended(), summary.getDuplicates(), summary.getRejected());
            return summary;

        } catch (PunchLogException e) {
            log.error("✗ No se pudieron registrar {} marcaciones de {}: {}",
                    parsed.size(), declaredSerial, e.getMessage(), e);
            return new NormalizationResult(0, 0, rejected);
        }
    }
}

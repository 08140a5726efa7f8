package com.attendpush;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * AttendPush Gateway - Aplicación Principal
 *
 * Gateway de marcaciones para terminales biométricos:
 * - Recepción del protocolo push de los terminales (iclock) por TCP
 * - Log intermedio CSV de solo agregado
 * - Carga idempotente al store relacional
 * - Reenvío de cada marcación a la API remota
 */
@SpringBootApplication
@EnableScheduling
public class AttendPushApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttendPushApplication.class, args);
        System.out.println("\n" +
            "╔═══════════════════════════════════════════════════════════╗\n" +
            "║        AttendPush Gateway - Started Successfully         ║\n" +
            "║                                                           ║\n" +
            "║  📡 Device ports: see gateway.devices                     ║\n" +
            "║  🌐 Status: http://localhost:8080/api/system/status       ║\n" +
            "╚═══════════════════════════════════════════════════════════╝\n"
        );
    }
}

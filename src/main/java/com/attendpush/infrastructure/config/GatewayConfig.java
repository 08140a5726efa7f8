package com.attendpush.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuración del gateway de terminales.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
@Slf4j
public class GatewayConfig {

    /**
     * Pool acotado para atender conexiones. Con el pool y la cola llenos la
     * conexión la atiende el hilo que acepta, lo que frena nuevas aceptaciones.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolExecutor connectionWorkers(
            @Value("${gateway.workers.max:16}") int maxWorkers,
            @Value("${gateway.workers.queue:64}") int queueSize) {

        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "device-conn-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };

        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                maxWorkers, maxWorkers, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueSize), factory, new ThreadPoolExecutor.CallerRunsPolicy());
        executor.allowCoreThreadTimeOut(true);

        log.info("Pool de conexiones: {} hilos, cola de {}", maxWorkers, queueSize);
        return executor;
    }
}

package com.attendpush.infrastructure.device;

import com.attendpush.domain.exception.GatewayBindException;
import com.attendpush.domain.model.DeviceEndpoint;
import com.attendpush.domain.model.DeviceReply;
import com.attendpush.domain.model.DeviceRequest;
import com.attendpush.domain.model.ListenerState;
import com.attendpush.domain.model.RequestKind;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Listener TCP de un puerto de terminales.
 * Un hilo propio acepta conexiones y las entrega al pool de conexiones; el
 * bind se reintenta con backoff exponencial y, agotados los intentos, solo
 * este puerto queda en FAILED.
 */
@Slf4j
public class DeviceListener {

    private static final long MAX_BACKOFF_MS = 60_000;

    private final int port;
    private final List<DeviceEndpoint> endpoints;
    private final DeviceRequestDispatcher dispatcher;
    private final Executor workers;
    private final ListenerSettings settings;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong connections = new AtomicLong();
    private volatile ListenerState state = ListenerState.STOPPED;
    private volatile ServerSocket serverSocket;
    private volatile String lastError;
    private Thread acceptThread;

    public DeviceListener(int port, List<DeviceEndpoint> endpoints, DeviceRequestDispatcher dispatcher,
            Executor workers, ListenerSettings settings) {
        this.port = port;
        this.endpoints = List.copyOf(endpoints);
        this.dispatcher = dispatcher;
        this.workers = workers;
        this.settings = settings;
    }

    /**
     * Inicia el hilo de aceptación. El bind ocurre dentro del hilo, así un
     * puerto ocupado no demora el arranque del resto.
     */
    public synchronized void start() {
        if (running.getAndSet(true)) {
            log.warn("El listener del puerto {} ya está ejecutándose", port);
            return;
        }
        state = ListenerState.STARTING;
        acceptThread = new Thread(this::acceptLoop, "device-listener-" + port);
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    public synchronized void stop() {
        running.set(false);
        closeServerSocket();
        if (acceptThread != null) {
            acceptThread.interrupt();
            acceptThread = null;
        }
        if (state != ListenerState.FAILED) {
            state = ListenerState.STOPPED;
        }
        log.info("Listener del puerto {} detenido", port);
    }

    public int getPort() {
        return port;
    }

    /**
     * Puerto efectivo (distinto del configurado cuando se pide el puerto 0).
     */
    public Integer getBoundPort() {
        ServerSocket socket = serverSocket;
        return socket != null && socket.isBound() ? socket.getLocalPort() : null;
    }

    public ListenerState getState() {
        return state;
    }

    public String getLastError() {
        return lastError;
    }

    public long getConnections() {
        return connections.get();
    }

    public List<String> getDeviceNames() {
        return endpoints.stream().map(DeviceEndpoint::getName).collect(Collectors.toList());
    }

    private void acceptLoop() {
        try {
            serverSocket = bindWithRetry();
        } catch (GatewayBindException e) {
            state = ListenerState.FAILED;
            lastError = e.getMessage();
            running.set(false);
            log.error("✗ {}", e.getMessage(), e.getCause());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        state = ListenerState.LISTENING;
        log.info("✓ Escuchando terminales en {}:{} ({})", settings.getHost(), getBoundPort(), getDeviceNames());

        while (running.get()) {
            Socket socket = null;
            try {
                socket = serverSocket.accept();
                connections.incrementAndGet();
                Socket accepted = socket;
                workers.execute(() -> handle(accepted));
            } catch (SocketException e) {
                if (running.get()) {
                    log.warn("Error de socket en el puerto {}: {}", port, e.getMessage());
                }
            } catch (RejectedExecutionException e) {
                log.warn("Conexión rechazada en el puerto {}: pool detenido", port);
                closeQuietly(socket);
            } catch (IOException e) {
                log.warn("Error aceptando conexión en el puerto {}: {}", port, e.getMessage());
            }
        }
    }

    private ServerSocket bindWithRetry() throws InterruptedException {
        IOException lastFailure = null;
        long delay = settings.getBindBackoffMs();
        int attempts = Math.max(1, settings.getBindMaxAttempts());

        for (int attempt = 1; attempt <= attempts && running.get(); attempt++) {
            ServerSocket socket = null;
            try {
                socket = new ServerSocket();
                socket.setReuseAddress(true);
                socket.bind(new InetSocketAddress(settings.getHost(), port));
                return socket;
            } catch (IOException e) {
                lastFailure = e;
                closeQuietly(socket);
                log.warn("Intento {}/{} de abrir el puerto {} falló: {}", attempt, attempts, port, e.getMessage());
                if (attempt < attempts) {
                    state = ListenerState.RETRYING;
                    Thread.sleep(delay);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            }
        }
        throw GatewayBindException.exhausted(settings.getHost(), port, attempts, lastFailure);
    }

    /**
     * Atiende una conexión: lee la petición, responde y recién después
     * procesa el contenido.
     */
    void handle(Socket socket) {
        DeviceRequest request = null;
        RequestKind kind = null;

        try (Socket s = socket) {
            s.setSoTimeout(settings.getReadTimeoutMs());
            byte[] raw = readRequest(s.getInputStream());
            if (raw.length == 0) {
                log.debug("Conexión sin datos desde {}", s.getRemoteSocketAddress());
                return;
            }

            DeviceReply reply;
            try {
                request = DeviceRequestParser.parse(raw, raw.length);
                kind = dispatcher.classify(request);
                reply = dispatcher.reply(request, kind, port);
            } catch (RuntimeException e) {
                log.warn("Petición ilegible desde {}: {}", s.getRemoteSocketAddress(), e.getMessage());
                request = null;
                reply = DeviceReply.ack();
            }

            DeviceResponseWriter.write(s.getOutputStream(), reply);
            if (request != null) {
                log.debug("{} {} ({}) de {} -> {}", request.getMethod(), request.getPath(), kind,
                        request.getSerial(), reply.getBody().length() > 40 ? kind : reply.getBody());
            }

        } catch (IOException e) {
            log.warn("Error de E/S en conexión del puerto {}: {}", port, e.getMessage());
        }

        if (request == null) {
            return;
        }
        try {
            dispatcher.afterReply(request, kind, port, resolveLabel(request.getSerial()));
        } catch (RuntimeException e) {
            log.error("Error procesando {} del puerto {}: {}", kind, port, e.getMessage(), e);
        }
    }

    private byte[] readRequest(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        int maxBytes = settings.getMaxRequestBytes();
        int expected = -1;

        while (buffer.size() < maxBytes) {
            int n;
            try {
                n = in.read(chunk, 0, Math.min(chunk.length, maxBytes - buffer.size()));
            } catch (SocketTimeoutException e) {
                log.debug("Timeout de lectura en el puerto {} con {} bytes", port, buffer.size());
                break;
            }
            if (n < 0) {
                break;
            }
            buffer.write(chunk, 0, n);

            if (expected < 0) {
                byte[] data = buffer.toByteArray();
                expected = DeviceRequestParser.expectedLength(data, data.length);
            }
            if (expected >= 0 && buffer.size() >= expected) {
                break;
            }
        }

        if (buffer.size() >= maxBytes) {
            log.warn("⚠ Petición en el puerto {} alcanzó el límite de {} bytes", port, maxBytes);
        }
        return buffer.toByteArray();
    }

    /**
     * Nombre configurado del terminal: por serial, o el único terminal del
     * puerto.
     */
    String resolveLabel(String serial) {
        if (serial != null) {
            for (DeviceEndpoint endpoint : endpoints) {
                if (serial.equalsIgnoreCase(endpoint.getSerial())) {
                    return endpoint.getName();
                }
            }
        }
        return endpoints.size() == 1 ? endpoints.get(0).getName() : null;
    }

    private void closeServerSocket() {
        ServerSocket socket = serverSocket;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Error cerrando el puerto {}: {}", port, e.getMessage());
            }
        }
    }

    private void closeQuietly(java.io.Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Error cerrando socket: {}", e.getMessage());
        }
    }
}

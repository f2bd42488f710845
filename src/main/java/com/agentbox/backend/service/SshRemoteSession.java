package com.agentbox.backend.service;

import com.agentbox.backend.exception.RemoteSessionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One OpenSSH control-master connection; every command is multiplexed over it.
 */
@Slf4j
class SshRemoteSession implements RemoteSession {
    private static final String GATEWAY_SERVICE_USER = "openclaw";

    private final String target;
    private final List<String> baseOptions;
    private final Path controlSocket;
    private final Process master;
    private final ObjectMapper objectMapper;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SshRemoteSession(String target, List<String> baseOptions, Path controlSocket, Process master,
                             ObjectMapper objectMapper) {
        this.target = target;
        this.baseOptions = baseOptions;
        this.controlSocket = controlSocket;
        this.master = master;
        this.objectMapper = objectMapper;
    }

    static SshRemoteSession connect(String user, String host, String privateKeyPath, int connectTimeoutSeconds,
                                    ObjectMapper objectMapper) {
        Path socket = Path.of(System.getProperty("java.io.tmpdir"), "agentbox-ssh-" + UUID.randomUUID() + ".sock");
        List<String> options = List.of(
                "-i", privateKeyPath,
                "-o", "BatchMode=yes",
                "-o", "StrictHostKeyChecking=no",
                "-o", "UserKnownHostsFile=/dev/null",
                "-o", "LogLevel=ERROR",
                "-o", "ConnectTimeout=" + connectTimeoutSeconds,
                "-S", socket.toString());
        String target = user + "@" + host;

        List<String> cmd = new ArrayList<>();
        cmd.add("ssh");
        cmd.addAll(options);
        cmd.add("-M");
        cmd.add("-N");
        cmd.add(target);

        Process master;
        try {
            master = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new RemoteSessionException("Cannot start ssh for " + host, e);
        }

        SshRemoteSession session = new SshRemoteSession(target, options, socket, master, objectMapper);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(connectTimeoutSeconds);
        while (!Files.exists(socket)) {
            if (!master.isAlive() || System.nanoTime() > deadline) {
                session.close();
                throw new RemoteSessionException("SSH connection to " + host + " failed");
            }
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                session.close();
                throw new RemoteSessionException("Interrupted while connecting to " + host, e);
            }
        }
        log.debug("SSH session to {} established", host);
        return session;
    }

    @Override
    public ExecResult exec(String command) {
        return run(command, null);
    }

    @Override
    public JsonNode readJson(String remotePath) {
        ExecResult r = exec("cat " + remotePath);
        if (!r.succeeded()) {
            throw new RemoteSessionException("Failed to read " + remotePath + ": " + r.getStderr());
        }
        try {
            return objectMapper.readTree(r.getStdout());
        } catch (JsonProcessingException e) {
            throw new RemoteSessionException(remotePath + " is not valid JSON", e);
        }
    }

    @Override
    public void writeJson(String remotePath, Object data, String owner) {
        byte[] json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new RemoteSessionException("Cannot serialize config for " + remotePath, e);
        }
        String tmp = "/tmp/agentbox-cfg-" + System.currentTimeMillis() + ".json";
        requireSuccess(run("cat > " + tmp, json), "write " + tmp);
        requireSuccess(exec("mv " + tmp + " " + remotePath), "move " + tmp);
        if (owner != null) {
            requireSuccess(exec("chown " + owner + ":" + owner + " " + remotePath), "chown " + remotePath);
        }
    }

    @Override
    public void restartService(String service) {
        String cmd;
        if (service.startsWith(GATEWAY_SERVICE_USER)) {
            // user-level unit
            String rtdir = "/run/user/$(id -u " + GATEWAY_SERVICE_USER + ")";
            cmd = "sudo -u " + GATEWAY_SERVICE_USER + " XDG_RUNTIME_DIR=" + rtdir
                    + " DBUS_SESSION_BUS_ADDRESS=unix:path=" + rtdir + "/bus systemctl --user restart " + service;
        } else {
            cmd = "systemctl restart " + service;
        }
        requireSuccess(exec(cmd), "restart " + service);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        running.forEach(Process::destroyForcibly);
        running.clear();
        master.destroy();
        try {
            if (!master.waitFor(2, TimeUnit.SECONDS)) {
                master.destroyForcibly();
            }
        } catch (InterruptedException e) {
            master.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        try {
            Files.deleteIfExists(controlSocket);
        } catch (IOException e) {
            log.debug("Could not remove control socket {}: {}", controlSocket, e.getMessage());
        }
    }

    private ExecResult run(String command, byte[] stdin) {
        if (closed.get()) {
            throw new RemoteSessionException("Session to " + target + " is closed");
        }
        List<String> cmd = new ArrayList<>();
        cmd.add("ssh");
        cmd.addAll(baseOptions);
        cmd.add(target);
        cmd.add(command);

        Process p = null;
        try {
            p = new ProcessBuilder(cmd).start();
            running.add(p);
            Process proc = p;
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(proc.getInputStream()));
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(proc.getErrorStream()));
            try (OutputStream in = p.getOutputStream()) {
                if (stdin != null) in.write(stdin);
            }
            int exit = p.waitFor();
            return new ExecResult(exit, stdout.join(), stderr.join());
        } catch (IOException e) {
            throw new RemoteSessionException("SSH exec failed on " + target, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteSessionException("SSH exec interrupted on " + target, e);
        } finally {
            if (p != null) {
                running.remove(p);
                if (p.isAlive()) p.destroyForcibly();
            }
        }
    }

    private static String drain(InputStream stream) {
        try {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            // stream closed by close() while the command was running
            log.debug("SSH output stream closed: {}", e.getMessage());
            return "";
        }
    }

    private static void requireSuccess(ExecResult r, String what) {
        if (!r.succeeded()) {
            throw new RemoteSessionException("Failed to " + what + " (exit " + r.getCode() + "): " + r.getStderr());
        }
    }
}

package com.agentbox.backend.service;

import com.agentbox.backend.entity.enumeration.Asset;
import com.agentbox.backend.exception.AppException;
import com.agentbox.backend.exception.ErrorCode;
import com.agentbox.backend.exception.RemoteSessionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Time-boxed remote work on a running instance. The operation races a hard deadline and
 * the session is closed on every exit path; a timed-out push is reported, never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class SessionBridgeService {
    static final String GATEWAY_USER = "openclaw";
    static final String USDC_MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
    static final Pattern AMOUNT = Pattern.compile("^\\d{1,12}(\\.\\d{1,9})?$");
    static final Pattern ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    RemoteSessionFactory remoteSessionFactory;
    ObjectMapper objectMapper;

    @Qualifier("taskExecutor")
    Executor taskExecutor;

    @NonFinal
    @Value("${ssh.config-timeout-ms:30000}")
    long configTimeoutMs;

    @NonFinal
    @Value("${ssh.transfer-timeout-ms:60000}")
    long transferTimeoutMs;

    @NonFinal
    @Value("${ssh.gateway-config-path:/home/openclaw/.openclaw/openclaw.json}")
    String gatewayConfigPath;

    @NonFinal
    @Value("${ssh.gateway-service:openclaw-gateway}")
    String gatewayService;

    public <T> T withSession(String host, Duration timeout, Function<RemoteSession, T> operation) {
        if (!remoteSessionFactory.isConfigured()) {
            throw new AppException(ErrorCode.UPSTREAM_NOT_CONFIGURED, "remote sessions");
        }

        AtomicReference<RemoteSession> session = new AtomicReference<>();
        AtomicBoolean finished = new AtomicBoolean(false);

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            RemoteSession opened = remoteSessionFactory.open(host);
            session.set(opened);
            if (finished.get()) {
                // caller already gave up
                opened.close();
                throw new CancellationException("session to " + host + " abandoned");
            }
            return operation.apply(opened);
        }, taskExecutor);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Remote session to {} timed out after {}ms", host, timeout.toMillis());
            throw new AppException(ErrorCode.SESSION_TIMEOUT, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AppException appException) throw appException;
            log.warn("Remote session to {} failed: {}", host, cause == null ? e.getMessage() : cause.getMessage());
            throw new AppException(ErrorCode.SESSION_FAILED, cause == null ? e : cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AppException(ErrorCode.SESSION_FAILED, e);
        } finally {
            finished.set(true);
            RemoteSession opened = session.getAndSet(null);
            if (opened != null) {
                opened.close();
            }
        }
    }

    /** Binds the messaging channel in the gateway config and restarts the gateway. */
    public void pushChannelConfig(String host, String botToken) {
        withSession(host, Duration.ofMillis(configTimeoutMs), s -> {
            GatewayConfig config = readGatewayConfig(s);
            GatewayConfig.TelegramChannel telegram = config.channelsOrCreate().telegramOrCreate();
            telegram.setEnabled(true);
            telegram.setBotToken(botToken);
            s.writeJson(gatewayConfigPath, config, GATEWAY_USER);
            s.restartService(gatewayService);
            return null;
        });
        log.info("Channel config pushed to {}", host);
    }

    /** Sends funds out of the VM wallet; returns the command output. */
    public String withdraw(String host, Asset asset, String amount, String to) {
        if (asset == null || amount == null || to == null
                || !AMOUNT.matcher(amount).matches() || !ADDRESS.matcher(to).matches()) {
            throw new AppException(ErrorCode.INVALID_WITHDRAWAL);
        }
        String inner = switch (asset) {
            case SOL -> "solana transfer --allow-unfunded-recipient " + to + " " + amount;
            case USDC -> "spl-token transfer --fund-recipient --allow-unfunded-recipient " + USDC_MINT + " " + amount + " " + to;
        };
        String command = "su - " + GATEWAY_USER + " -c '" + inner + "'";

        RemoteSession.ExecResult result = withSession(host, Duration.ofMillis(transferTimeoutMs), s -> s.exec(command));
        if (!result.succeeded()) {
            log.warn("Withdrawal on {} exited {}: {}", host, result.getCode(), result.getStderr());
            throw new AppException(ErrorCode.SESSION_FAILED, result.getStderr());
        }
        return result.getStdout().trim();
    }

    GatewayConfig readGatewayConfig(RemoteSession s) {
        try {
            return objectMapper.treeToValue(s.readJson(gatewayConfigPath), GatewayConfig.class);
        } catch (JsonProcessingException e) {
            throw new RemoteSessionException("Gateway config has unexpected shape", e);
        }
    }
}

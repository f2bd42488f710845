package com.agentbox.backend.service;

/** Messaging channel provider used by the on-box agent. */
public interface ChannelGateway {

    /**
     * Resolves the bot behind a token.
     *
     * @throws com.agentbox.backend.exception.AppException INVALID_CHANNEL_TOKEN when the provider rejects it
     */
    String resolveBotUsername(String botToken);

    /** Drops any webhook subscription left from a previous deployment. Best-effort. */
    void clearSubscription(String botToken);
}

package com.agentbox.backend.service;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The parts of the on-box gateway config this service owns. Every other key, at any
 * level, is kept in {@code other} and written back unchanged.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayConfig {
    private Channels channels;

    private final Map<String, Object> other = new LinkedHashMap<>();

    @JsonAnySetter
    public void setOther(String key, Object value) {
        other.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getOther() {
        return other;
    }

    public Channels channelsOrCreate() {
        if (channels == null) channels = new Channels();
        return channels;
    }

    @Getter
    @Setter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Channels {
        private TelegramChannel telegram;

        private final Map<String, Object> other = new LinkedHashMap<>();

        @JsonAnySetter
        public void setOther(String key, Object value) {
            other.put(key, value);
        }

        @JsonAnyGetter
        public Map<String, Object> getOther() {
            return other;
        }

        public TelegramChannel telegramOrCreate() {
            if (telegram == null) telegram = new TelegramChannel();
            return telegram;
        }
    }

    @Getter
    @Setter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TelegramChannel {
        private Boolean enabled;
        private String botToken;

        private final Map<String, Object> other = new LinkedHashMap<>();

        @JsonAnySetter
        public void setOther(String key, Object value) {
            other.put(key, value);
        }

        @JsonAnyGetter
        public Map<String, Object> getOther() {
            return other;
        }
    }
}

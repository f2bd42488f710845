package com.agentbox.backend.common;

public class Constants {
    public interface HETZNER {
        interface ENDPOINT {
            String SERVERS       = "/servers";
            String SERVER        = "/servers/{id}";
            String REBOOT        = "/servers/{id}/actions/reboot";
        }
        String NAME_SERVICE = "HETZNER";
    }

    public interface CLOUDFLARE {
        interface ENDPOINT {
            String DNS_RECORDS   = "/zones/{zoneId}/dns_records";
            String DNS_RECORD    = "/zones/{zoneId}/dns_records/{recordId}";
        }
        String NAME_SERVICE = "CLOUDFLARE";
        int RECORD_TTL = 60;
    }

    public interface LEDGER {
        interface ENDPOINT {
            String TRANSFER          = "/v1/transfers";
            String METADATA          = "/v1/metadata";
            String IDENTITIES        = "/v1/identities";
            String IDENTITY          = "/v1/identities/{mint}";
            String IDENTITY_TRANSFER = "/v1/identities/{mint}/transfer";
        }
        String NAME_SERVICE = "LEDGER_SIGNER";
        String RPC_SERVICE = "SOLANA_RPC";
        String TOKEN_2022_PROGRAM = "TokenzQdBNbLqP5VEhdkAS6EPFLC1PHnBqCXEpPxuEb";
        String SERVER_ID_METADATA_KEY = "agentbox:serverId";
    }

    public interface TELEGRAM {
        interface ENDPOINT {
            String GET_ME         = "/bot{token}/getMe";
            String DELETE_WEBHOOK = "/bot{token}/deleteWebhook";
        }
        String NAME_SERVICE = "TELEGRAM";
    }

    public interface ACTOR {
        String SYSTEM = "system";
        String VM = "vm";
        String REAPER = "reaper";
        String WORKER = "mint-worker";
    }

    public interface ENTITY {
        String INSTANCE = "instance";
    }
}

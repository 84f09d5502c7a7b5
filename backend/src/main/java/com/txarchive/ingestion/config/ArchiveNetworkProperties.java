package com.txarchive.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Upstream data sources and the global connection cap.
 */
@ConfigurationProperties(prefix = "txarchive.network")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ArchiveNetworkProperties {

    /** JSON-RPC (http/https) endpoints used to fetch transaction details, in preference order. */
    @NotEmpty
    private List<String> rpcEndpoints = new ArrayList<>();

    /** PubSub (ws/wss) endpoints streaming transaction notifications. */
    @NotEmpty
    private List<String> websocketEndpoints = new ArrayList<>();

    /** Peer-discovery seeds. Carried for external collaborators; ingestion never contacts them. */
    private List<String> gossipEntrypoints = new ArrayList<>();

    /** Optional selection weight per endpoint URL. Missing entries weigh 1. */
    private Map<String, Integer> endpointWeights = new HashMap<>();

    /** Upper bound on concurrently leased connections across both endpoint kinds. */
    @Min(1)
    private int maxConnections = 100;

    public void setRpcEndpoints(List<String> rpcEndpoints) {
        this.rpcEndpoints = rpcEndpoints != null ? rpcEndpoints : new ArrayList<>();
    }

    public void setWebsocketEndpoints(List<String> websocketEndpoints) {
        this.websocketEndpoints = websocketEndpoints != null ? websocketEndpoints : new ArrayList<>();
    }

    public void setGossipEntrypoints(List<String> gossipEntrypoints) {
        this.gossipEntrypoints = gossipEntrypoints != null ? gossipEntrypoints : new ArrayList<>();
    }

    public void setEndpointWeights(Map<String, Integer> endpointWeights) {
        this.endpointWeights = endpointWeights != null ? endpointWeights : new HashMap<>();
    }
}

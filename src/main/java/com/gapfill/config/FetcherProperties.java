package com.gapfill.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "gapfill")
public class FetcherProperties {

    private boolean addBarTickCount = false;

    @NotBlank
    private String apiKey;

    @NotBlank
    private String baseUrl = "https://api.polygon.io";

    @NotBlank
    private String wsServers = "wss://socket.polygon.io";

    @NotEmpty
    private List<String> dataTypes = new ArrayList<>();

    private List<String> symbols = new ArrayList<>();

    private String queryStart;

    @NotNull
    private Path dataDir = Path.of("data");

    @NotNull
    private ZoneId partitionZone = ZoneId.of("UTC");

    @Valid
    private BackfillProperties backfill = new BackfillProperties();

    public boolean isAddBarTickCount() {
        return addBarTickCount;
    }

    public void setAddBarTickCount(boolean addBarTickCount) {
        this.addBarTickCount = addBarTickCount;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getWsServers() {
        return wsServers;
    }

    public void setWsServers(String wsServers) {
        this.wsServers = wsServers;
    }

    public List<String> getDataTypes() {
        return dataTypes;
    }

    public void setDataTypes(List<String> dataTypes) {
        this.dataTypes = dataTypes;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public void setSymbols(List<String> symbols) {
        this.symbols = symbols;
    }

    public String getQueryStart() {
        return queryStart;
    }

    public void setQueryStart(String queryStart) {
        this.queryStart = queryStart;
    }

    public boolean hasQueryStart() {
        return queryStart != null && !queryStart.isBlank();
    }

    public Path getDataDir() {
        return dataDir;
    }

    public void setDataDir(Path dataDir) {
        this.dataDir = dataDir;
    }

    public ZoneId getPartitionZone() {
        return partitionZone;
    }

    public void setPartitionZone(ZoneId partitionZone) {
        this.partitionZone = partitionZone;
    }

    public BackfillProperties getBackfill() {
        return backfill;
    }

    public void setBackfill(BackfillProperties backfill) {
        this.backfill = backfill;
    }

    public static class BackfillProperties {

        @Min(1000)
        private long intervalMs = 30_000L;

        @Min(1)
        private int concurrencyPerCpu = 10;

        /** Overrides the per-CPU ceiling when positive. */
        private int maxConcurrency = 0;

        @Min(1)
        private int chunkDays = 5;

        /** 0 keeps fail-open behaviour: a failed backfill waits for a new stream signal. */
        @Min(0)
        private int maxRequeueAttempts = 0;

        @Min(0)
        private int shutdownAwaitSeconds = 60;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getConcurrencyPerCpu() {
            return concurrencyPerCpu;
        }

        public void setConcurrencyPerCpu(int concurrencyPerCpu) {
            this.concurrencyPerCpu = concurrencyPerCpu;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getChunkDays() {
            return chunkDays;
        }

        public void setChunkDays(int chunkDays) {
            this.chunkDays = chunkDays;
        }

        public int getMaxRequeueAttempts() {
            return maxRequeueAttempts;
        }

        public void setMaxRequeueAttempts(int maxRequeueAttempts) {
            this.maxRequeueAttempts = maxRequeueAttempts;
        }

        public int getShutdownAwaitSeconds() {
            return shutdownAwaitSeconds;
        }

        public void setShutdownAwaitSeconds(int shutdownAwaitSeconds) {
            this.shutdownAwaitSeconds = shutdownAwaitSeconds;
        }

        public int resolveConcurrencyCeiling(int availableProcessors) {
            if (maxConcurrency > 0) {
                return maxConcurrency;
            }
            return Math.max(1, availableProcessors) * concurrencyPerCpu;
        }
    }
}

package com.hidego.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "hidego")
public class HidegoProperties {

    private WebhookProperties webhook = new WebhookProperties();
    private RuntimeProperties runtime = new RuntimeProperties();
    private ReplyProperties reply = new ReplyProperties();
    private StoreProperties store = new StoreProperties();
    private SecurityProperties security = new SecurityProperties();
    private TransportProperties transport = new TransportProperties();
    private DispatcherProperties dispatcher = new DispatcherProperties();
    private LoggingProperties logging = new LoggingProperties();

    public WebhookProperties getWebhook() { return webhook; }
    public void setWebhook(WebhookProperties webhook) { this.webhook = webhook; }

    public RuntimeProperties getRuntime() { return runtime; }
    public void setRuntime(RuntimeProperties runtime) { this.runtime = runtime; }

    public ReplyProperties getReply() { return reply; }
    public void setReply(ReplyProperties reply) { this.reply = reply; }

    public StoreProperties getStore() { return store; }
    public void setStore(StoreProperties store) { this.store = store; }

    public SecurityProperties getSecurity() { return security; }
    public void setSecurity(SecurityProperties security) { this.security = security; }

    public TransportProperties getTransport() { return transport; }
    public void setTransport(TransportProperties transport) { this.transport = transport; }

    public DispatcherProperties getDispatcher() { return dispatcher; }
    public void setDispatcher(DispatcherProperties dispatcher) { this.dispatcher = dispatcher; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    public static class WebhookProperties {
        private String baseUrl;
        private boolean enforceIpAllowlist = true;
        // https://core.telegram.org/resources/cidr.txt
        private List<String> allowedIpRanges = new ArrayList<>(List.of(
                "91.108.56.0/22", "91.108.4.0/22", "91.108.8.0/22", "91.108.16.0/22",
                "91.108.12.0/22", "149.154.160.0/20", "91.105.192.0/23", "91.108.20.0/22",
                "185.76.151.0/24", "2001:b28:f23d::/48", "2001:b28:f23f::/48",
                "2001:67c:4e8::/48", "2001:b28:f23c::/48", "2a0a:f280::/32"));

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public boolean isEnforceIpAllowlist() { return enforceIpAllowlist; }
        public void setEnforceIpAllowlist(boolean enforceIpAllowlist) { this.enforceIpAllowlist = enforceIpAllowlist; }
        public List<String> getAllowedIpRanges() { return allowedIpRanges; }
        public void setAllowedIpRanges(List<String> allowedIpRanges) { this.allowedIpRanges = allowedIpRanges; }
    }

    public static class RuntimeProperties {
        private int maxLiveRuntimes = 100;
        private int queueCapacity = 256;
        private int updateConcurrency = 10;
        private Duration creationTimeout = Duration.ofSeconds(30);

        public int getMaxLiveRuntimes() { return maxLiveRuntimes; }
        public void setMaxLiveRuntimes(int maxLiveRuntimes) { this.maxLiveRuntimes = maxLiveRuntimes; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public int getUpdateConcurrency() { return updateConcurrency; }
        public void setUpdateConcurrency(int updateConcurrency) { this.updateConcurrency = updateConcurrency; }
        public Duration getCreationTimeout() { return creationTimeout; }
        public void setCreationTimeout(Duration creationTimeout) { this.creationTimeout = creationTimeout; }
    }

    public static class ReplyProperties {
        private Duration timeout = Duration.ofMinutes(20);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class StoreProperties {
        private String path = "DATA.db";
        private int adminCacheSize = 1000;
        private int messageRetentionMonths = 0;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public int getAdminCacheSize() { return adminCacheSize; }
        public void setAdminCacheSize(int adminCacheSize) { this.adminCacheSize = adminCacheSize; }
        public int getMessageRetentionMonths() { return messageRetentionMonths; }
        public void setMessageRetentionMonths(int m) { this.messageRetentionMonths = m; }
    }

    public static class SecurityProperties {
        private String passphraseFile = "config.secure";

        public String getPassphraseFile() { return passphraseFile; }
        public void setPassphraseFile(String passphraseFile) { this.passphraseFile = passphraseFile; }
    }

    public static class TransportProperties {
        private String apiBaseUrl = "https://api.telegram.org";
        private Duration requestTimeout = Duration.ofSeconds(15);

        public String getApiBaseUrl() { return apiBaseUrl; }
        public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    public static class DispatcherProperties {
        private boolean configureProfile = false;

        public boolean isConfigureProfile() { return configureProfile; }
        public void setConfigureProfile(boolean configureProfile) { this.configureProfile = configureProfile; }
    }

    public static class LoggingProperties {
        private List<String> redactPatterns = new ArrayList<>();

        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}

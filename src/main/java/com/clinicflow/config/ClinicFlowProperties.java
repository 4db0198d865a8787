package com.clinicflow.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "clinicflow")
public class ClinicFlowProperties {

    private ProviderConfig provider = new ProviderConfig();
    private RelevanceConfig relevance = new RelevanceConfig();
    private DispensingConfig dispensing = new DispensingConfig();
    private InventoryConfig inventory = new InventoryConfig();

    public enum ProviderMode {
        WEBHOOK, CHAT_MODEL
    }

    public static class ProviderConfig {
        private ProviderMode mode = ProviderMode.WEBHOOK;
        private String webhookUrl;
        private Duration timeout = Duration.ofSeconds(90);
        private int minimumAdditionalTherapyCount = 5;

        public ProviderMode getMode() { return mode; }
        public void setMode(ProviderMode mode) { this.mode = mode != null ? mode : ProviderMode.WEBHOOK; }
        public String getWebhookUrl() { return webhookUrl; }
        public void setWebhookUrl(String webhookUrl) { this.webhookUrl = webhookUrl; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMinimumAdditionalTherapyCount() { return minimumAdditionalTherapyCount; }
        public void setMinimumAdditionalTherapyCount(int minimumAdditionalTherapyCount) {
            this.minimumAdditionalTherapyCount = minimumAdditionalTherapyCount;
        }
    }

    /**
     * Vocabulary and limits for ranking inventory against complaint text.
     * Rules are data: each maps a condition regex (any language) to drug-class keywords.
     */
    public static class RelevanceConfig {
        private int maxItems = 200;
        private List<RelevanceRuleConfig> rules = new ArrayList<>();
        private List<String> commonDrugs = new ArrayList<>(
                List.of("paracetamol", "ibuprofen", "analgin", "vitamin", "betadin"));
        private List<String> preferredDosageForms = new ArrayList<>(List.of("tablet", "capsule"));

        public int getMaxItems() { return maxItems; }
        public void setMaxItems(int maxItems) { this.maxItems = maxItems; }
        public List<RelevanceRuleConfig> getRules() { return rules; }
        public void setRules(List<RelevanceRuleConfig> rules) {
            this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
        }
        public List<String> getCommonDrugs() { return commonDrugs; }
        public void setCommonDrugs(List<String> commonDrugs) {
            if (commonDrugs == null) {
                return;
            }
            this.commonDrugs = new ArrayList<>(commonDrugs);
        }
        public List<String> getPreferredDosageForms() { return preferredDosageForms; }
        public void setPreferredDosageForms(List<String> preferredDosageForms) {
            if (preferredDosageForms == null) {
                return;
            }
            this.preferredDosageForms = new ArrayList<>(preferredDosageForms);
        }
    }

    public static class RelevanceRuleConfig {
        private String name;
        private String conditions;
        private List<String> drugKeywords = new ArrayList<>();

        public RelevanceRuleConfig() {}

        public RelevanceRuleConfig(String name, String conditions, List<String> drugKeywords) {
            this.name = name;
            this.conditions = conditions;
            setDrugKeywords(drugKeywords);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getConditions() { return conditions; }
        public void setConditions(String conditions) { this.conditions = conditions; }
        public List<String> getDrugKeywords() { return drugKeywords; }
        public void setDrugKeywords(List<String> drugKeywords) {
            this.drugKeywords = drugKeywords != null ? new ArrayList<>(drugKeywords) : new ArrayList<>();
        }
    }

    public static class DispensingConfig {
        private int concurrency = 4;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    }

    public static class InventoryConfig {
        private int lowStockThreshold = 10;

        public int getLowStockThreshold() { return lowStockThreshold; }
        public void setLowStockThreshold(int lowStockThreshold) { this.lowStockThreshold = lowStockThreshold; }
    }

    public ProviderConfig getProvider() {
        return provider;
    }

    public void setProvider(ProviderConfig provider) {
        this.provider = provider != null ? provider : new ProviderConfig();
    }

    public RelevanceConfig getRelevance() {
        return relevance;
    }

    public void setRelevance(RelevanceConfig relevance) {
        this.relevance = relevance != null ? relevance : new RelevanceConfig();
    }

    public DispensingConfig getDispensing() {
        return dispensing;
    }

    public void setDispensing(DispensingConfig dispensing) {
        this.dispensing = dispensing != null ? dispensing : new DispensingConfig();
    }

    public InventoryConfig getInventory() {
        return inventory;
    }

    public void setInventory(InventoryConfig inventory) {
        this.inventory = inventory != null ? inventory : new InventoryConfig();
    }
}

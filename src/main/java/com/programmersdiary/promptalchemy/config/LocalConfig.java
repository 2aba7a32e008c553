package com.programmersdiary.promptalchemy.config;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocalConfig {

    public static final String AUTH_API_KEY = "api-key";
    public static final String AUTH_GCLOUD = "gcloud";

    @JsonProperty("providers")
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    @JsonProperty("default_provider")
    private String defaultProvider;

    @JsonProperty("default_model")
    private String defaultModel;

    @JsonProperty("auth_mode")
    private String authMode;

    @JsonProperty("gcloud_project_id")
    private String gcloudProjectId;

    @JsonProperty("gcloud_auth_validated")
    private Boolean gcloudAuthValidated;

    @JsonProperty("enhancement_defaults")
    private Map<String, Object> enhancementDefaults;

    private final Map<String, Object> other = new LinkedHashMap<>();

    public static LocalConfig defaults() {
        var config = new LocalConfig();
        config.defaultProvider = "openai";
        config.defaultModel = "gpt-4o-mini";
        var enhancement = new LinkedHashMap<String, Object>();
        enhancement.put("role", "an expert assistant");
        enhancement.put("reasoning", "Standard");
        enhancement.put("verbosity", "medium");
        enhancement.put("tools", List.of("web", "code"));
        enhancement.put("self_reflect", true);
        enhancement.put("meta_fix", true);
        config.enhancementDefaults = enhancement;
        return config;
    }

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers != null ? new LinkedHashMap<>(providers) : new LinkedHashMap<>();
    }

    public Optional<ProviderSettings> provider(String providerId) {
        return Optional.ofNullable(providers.get(normalizeProvider(providerId)));
    }

    public ProviderSettings providerForUpdate(String providerId) {
        return providers.computeIfAbsent(normalizeProvider(providerId), k -> new ProviderSettings());
    }

    public String getDefaultProvider() {
        return defaultProvider;
    }

    public void setDefaultProvider(String defaultProvider) {
        this.defaultProvider = defaultProvider;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String getAuthMode() {
        return authMode;
    }

    public void setAuthMode(String authMode) {
        this.authMode = authMode;
    }

    public String getGcloudProjectId() {
        return gcloudProjectId;
    }

    public void setGcloudProjectId(String gcloudProjectId) {
        this.gcloudProjectId = gcloudProjectId;
    }

    public Boolean getGcloudAuthValidated() {
        return gcloudAuthValidated;
    }

    public void setGcloudAuthValidated(Boolean gcloudAuthValidated) {
        this.gcloudAuthValidated = gcloudAuthValidated;
    }

    public Map<String, Object> getEnhancementDefaults() {
        return enhancementDefaults;
    }

    public void setEnhancementDefaults(Map<String, Object> enhancementDefaults) {
        this.enhancementDefaults = enhancementDefaults;
    }

    public String authModeFor(String providerId) {
        if (isGoogle(providerId)) {
            return authMode != null ? authMode : AUTH_API_KEY;
        }
        return AUTH_API_KEY;
    }

    public boolean authValidatedFor(String providerId) {
        return isGoogle(providerId) && Boolean.TRUE.equals(gcloudAuthValidated);
    }

    @JsonIgnore
    public boolean hasImportableData() {
        return !providers.isEmpty() || authMode != null || gcloudProjectId != null;
    }

    public static String normalizeProvider(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("Provider is required");
        }
        return providerId.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isGoogle(String providerId) {
        var id = normalizeProvider(providerId);
        return id.equals("gemini") || id.equals("google");
    }

    @JsonAnyGetter
    public Map<String, Object> other() {
        return other;
    }

    @JsonAnySetter
    public void other(String key, Object value) {
        other.put(key, value);
    }
}

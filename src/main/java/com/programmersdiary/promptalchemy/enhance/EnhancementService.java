package com.programmersdiary.promptalchemy.enhance;

import com.programmersdiary.promptalchemy.config.ConfigRepository;
import com.programmersdiary.promptalchemy.config.LocalConfig;
import com.programmersdiary.promptalchemy.config.ProviderSettings;
import com.programmersdiary.promptalchemy.credential.CredentialVault;
import com.programmersdiary.promptalchemy.history.EnhancementRecord;
import com.programmersdiary.promptalchemy.history.HistoryStore;
import com.programmersdiary.promptalchemy.journal.AppendLog;
import com.programmersdiary.promptalchemy.journal.Timestamps;
import com.programmersdiary.promptalchemy.project.ProjectStore;
import com.programmersdiary.promptalchemy.provider.ModelSettings;
import com.programmersdiary.promptalchemy.provider.ProviderType;
import com.programmersdiary.promptalchemy.ratelimit.RateGovernor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class EnhancementService {

    private static final Logger log = LoggerFactory.getLogger(EnhancementService.class);

    private final CredentialVault credentialVault;
    private final RateGovernor rateGovernor;
    private final PromptEnhancer promptEnhancer;
    private final HistoryStore historyStore;
    private final ProjectStore projectStore;
    private final ConfigRepository configRepository;
    private final Clock clock;

    public EnhancementService(CredentialVault credentialVault,
                              RateGovernor rateGovernor,
                              PromptEnhancer promptEnhancer,
                              HistoryStore historyStore,
                              ProjectStore projectStore,
                              ConfigRepository configRepository,
                              Clock clock) {
        this.credentialVault = credentialVault;
        this.rateGovernor = rateGovernor;
        this.promptEnhancer = promptEnhancer;
        this.historyStore = historyStore;
        this.projectStore = projectStore;
        this.configRepository = configRepository;
        this.clock = clock;
    }

    public EnhancementResult enhance(EnhancementRequest request) {
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }
        var config = configRepository.current();
        var providerId = request.provider() != null && !request.provider().isBlank()
                ? LocalConfig.normalizeProvider(request.provider())
                : LocalConfig.normalizeProvider(config.getDefaultProvider() != null ? config.getDefaultProvider() : "openai");
        var type = ProviderType.fromId(providerId);
        var model = resolveModel(request.model(), providerId, type, config);

        var apiKey = credentialVault.get(providerId).orElse(null);
        if (apiKey == null && type.requiresApiKey()) {
            throw new MissingCredentialException(providerId);
        }
        if (!rateGovernor.admit(providerId, true)) {
            throw new AdmissionDeniedException(providerId);
        }

        var baseUrl = config.provider(providerId).map(ProviderSettings::getBaseUrl).orElse(null);
        var settings = new ModelSettings(type, model, apiKey, baseUrl, null, null);
        EnhancedPrompt enhanced;
        try {
            enhanced = promptEnhancer.enhance(settings, request.prompt());
        } catch (RuntimeException e) {
            log.error("API Call Failed - Provider: {}, Model: {}, Error: {}", providerId, model, e.getMessage());
            throw e;
        }
        log.info("API Call Success - Provider: {}, Model: {}, Tokens: {}", providerId, model, enhanced.tokensUsed());

        var record = new EnhancementRecord(request.prompt(), enhanced.text(), providerId, model, enhanced.tokensUsed());
        var entry = record.toMap();
        var timestamp = Timestamps.now(clock);
        entry.put(AppendLog.TIMESTAMP, timestamp);
        if (!historyStore.add(entry)) {
            log.warn("Enhancement was not saved to history");
        }

        String projectName = null;
        if (request.project() != null && !request.project().isBlank()) {
            var project = projectStore.getOrCreate(request.project());
            project.addPrompt(entry);
            projectName = project.name();
            log.info("Saved to project: {}", projectName);
        }
        return new EnhancementResult(request.prompt(), enhanced.text(), providerId, model,
                enhanced.tokensUsed(), timestamp, projectName);
    }

    private static String resolveModel(String requested, String providerId, ProviderType type, LocalConfig config) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        var configured = config.provider(providerId).map(ProviderSettings::getModel).orElse(null);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        if (config.getDefaultModel() != null && config.getDefaultProvider() != null
                && providerId.equals(LocalConfig.normalizeProvider(config.getDefaultProvider()))) {
            return config.getDefaultModel();
        }
        return type.defaultModel();
    }
}

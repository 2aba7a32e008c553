package com.programmersdiary.promptalchemy.credential;

import com.programmersdiary.promptalchemy.config.AppPaths;
import com.programmersdiary.promptalchemy.config.ConfigRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class CredentialConfig {

    @Bean
    public CredentialVault credentialVault(SecretVault secretVault,
                                           ConfigRepository configRepository,
                                           @Value("${promptalchemy.vault.import-namespace:ImageAI}") String importNamespace) {
        var migrationSources = importNamespace == null || importNamespace.isBlank()
                ? List.<CredentialResolver>of()
                : List.<CredentialResolver>of(VaultCredentialResolver.foreign(secretVault, importNamespace));
        return new CredentialVault(
                VaultCredentialResolver.owned(secretVault, AppPaths.APP_NAME),
                new FileCredentialResolver(configRepository),
                migrationSources);
    }
}

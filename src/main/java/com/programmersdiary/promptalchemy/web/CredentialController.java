package com.programmersdiary.promptalchemy.web;

import com.programmersdiary.promptalchemy.config.LocalConfig;
import com.programmersdiary.promptalchemy.credential.CredentialVault;
import com.programmersdiary.promptalchemy.credential.StorageLocation;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api/credentials")
public class CredentialController {

    private final CredentialVault credentialVault;

    public CredentialController(CredentialVault credentialVault) {
        this.credentialVault = credentialVault;
    }

    public record CredentialResponse(String provider, StorageLocation location) {
    }

    @GetMapping("/{provider}")
    public CredentialResponse get(@PathVariable String provider) {
        return new CredentialResponse(LocalConfig.normalizeProvider(provider), credentialVault.storageLocation(provider));
    }

    @PutMapping("/{provider}")
    public CredentialResponse set(@PathVariable String provider, @RequestBody Map<String, String> request) {
        var inVault = credentialVault.set(provider, request.get("apiKey"));
        return new CredentialResponse(LocalConfig.normalizeProvider(provider),
                inVault ? StorageLocation.VAULT : StorageLocation.FILE);
    }

    @DeleteMapping("/{provider}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String provider) {
        if (!credentialVault.delete(provider)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND);
        }
    }
}

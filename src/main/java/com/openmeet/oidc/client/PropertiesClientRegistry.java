package com.openmeet.oidc.client;

import com.openmeet.oidc.config.properties.OidcProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory ClientRegistry backed by properties.
 * Loads the clients of every tenant from OidcProperties at startup and keeps them in memory.
 * NO database persistence; clients defined in application.yml / environment variables.
 * Each pod loads the same clients from config.
 *
 * NOTE: NO @Repository annotation - instantiated via @Bean method in OidcAuthorizationServerConfig.
 */
public class PropertiesClientRegistry implements ClientRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PropertiesClientRegistry.class);

    // tenantId -> clientId -> client
    private final Map<String, Map<String, OAuthClient>> clientsByTenant = new HashMap<>();

    public PropertiesClientRegistry(OidcProperties properties) {
        loadClientsFromProperties(properties);
    }

    private void loadClientsFromProperties(OidcProperties properties) {
        int count = 0;
        for (OidcProperties.TenantProperties tenant : properties.getTenants()) {
            Map<String, OAuthClient> clients = clientsByTenant.computeIfAbsent(tenant.getTenantId(), k -> new HashMap<>());
            for (OidcProperties.ClientProperties prop : tenant.getClients()) {
                OAuthClient client = buildClient(tenant.getTenantId(), prop);
                if (clients.putIfAbsent(client.getClientId(), client) != null) {
                    throw new IllegalStateException("Duplicate client " + client.getClientId()
                        + " in tenant " + tenant.getTenantId());
                }
                count++;
                logger.info("[STARTUP] Loaded client: {} (tenant={}, confidential={})",
                    client.getClientId(), client.getTenantId(), client.isConfidential());
            }
        }
        logger.info("[STARTUP] Loaded {} clients for {} tenants from properties", count, clientsByTenant.size());
    }

    private OAuthClient buildClient(String tenantId, OidcProperties.ClientProperties prop) {
        String secret = prop.getClientSecret();
        if (secret != null && secret.isBlank()) {
            secret = null;
        }
        return new OAuthClient(
            prop.getClientId(),
            tenantId,
            prop.getClientName(),
            prop.getRedirectUris(),
            prop.isConfidential(),
            secret,
            prop.getScopes());
    }

    @Override
    public Optional<OAuthClient> lookup(String tenantId, String clientId) {
        if (tenantId == null || tenantId.isBlank() || clientId == null || clientId.isBlank()) {
            return Optional.empty();
        }
        Map<String, OAuthClient> clients = clientsByTenant.get(tenantId);
        if (clients == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(clientId));
    }
}

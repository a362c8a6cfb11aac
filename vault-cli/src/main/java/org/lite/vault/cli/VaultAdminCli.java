package org.lite.vault.cli;

import org.apache.commons.codec.binary.Hex;
import org.lite.vault.config.VaultProperties;
import org.lite.vault.dto.SecretSummary;
import org.lite.vault.dto.ServiceToken;
import org.lite.vault.dto.TokenRotationStatus;
import org.lite.vault.enums.KnownService;
import org.lite.vault.exception.VaultException;
import org.lite.vault.service.RotationPolicy;
import org.lite.vault.service.TokenProvider;
import org.lite.vault.service.VaultEncryptionService;
import org.lite.vault.service.impl.InMemoryTokenCacheImpl;
import org.lite.vault.service.impl.LocalFileSecretStore;
import org.lite.vault.service.impl.RotationPolicyImpl;
import org.lite.vault.service.impl.TokenProviderImpl;
import org.lite.vault.service.impl.VaultEncryptionServiceImpl;
import org.springframework.core.env.PropertyResolver;
import org.springframework.core.env.StandardEnvironment;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Administration CLI for the local vault file.
 * Usage: java -cp vault-cli.jar org.lite.vault.cli.VaultAdminCli --operation list-due
 * [--file <vault-file>] [--passphrase <key>] [--salt <salt>]
 *
 * Token values are never printed.
 */
public class VaultAdminCli {

    private static final int GENERATED_TOKEN_BYTES = 48;

    private final PropertyResolver environment;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public VaultAdminCli(PropertyResolver environment, Clock clock) {
        this.environment = environment;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int exitCode = new VaultAdminCli(new StandardEnvironment(), Clock.systemUTC())
                .run(args, System.out, System.err);
        System.exit(exitCode);
    }

    /**
     * @return process exit code, 0 on success
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> options = parseArgs(args);
        String operation = options.get("operation");

        if (operation == null) {
            printUsage(err);
            return 1;
        }

        try {
            switch (operation) {
                case "list-due" -> listDue(openProvider(options), out);
                case "list" -> listTokens(openProvider(options), out);
                case "rotate" -> rotate(options, out);
                case "add" -> add(options, out);
                case "delete" -> delete(options, out);
                default -> {
                    err.println("Error: unknown operation '" + operation + "'");
                    printUsage(err);
                    return 1;
                }
            }
            return 0;
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return 1;
        } catch (VaultException | IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void listDue(TokenProvider tokenProvider, PrintStream out) {
        List<TokenRotationStatus> due = tokenProvider.getTokensNeedingRotation();
        if (due.isEmpty()) {
            out.println("No tokens need rotation");
            return;
        }
        out.println("Tokens needing rotation:");
        for (TokenRotationStatus status : due) {
            out.printf("  %-16s %-28s due: %s  last used: %s%n",
                    status.getServiceName(), displayName(status.getServiceName()),
                    status.getRotationDue(), status.getLastUsed());
        }
    }

    private void listTokens(TokenProvider tokenProvider, PrintStream out) {
        List<ServiceToken> tokens = tokenProvider.listTokens();
        if (tokens.isEmpty()) {
            out.println("No tokens stored");
            return;
        }
        for (ServiceToken token : tokens) {
            SecretSummary secret = token.getSecret();
            out.printf("  %-16s %-14s created: %s  due: %s  uses: %d%s%n",
                    token.getServiceName(),
                    secret.getType() == null ? "unknown" : secret.getType().getValue(),
                    secret.getCreatedAt(), secret.getRotationDue(), secret.getUsageCount(),
                    secret.isNeedsRotation() ? "  NEEDS ROTATION" : "");
        }
    }

    private void rotate(Map<String, String> options, PrintStream out) {
        String serviceName = requireService(options);
        String token = resolveTokenValue(serviceName, options, out);
        openProvider(options).rotateToken(serviceName, token);
        out.println("Successfully rotated token for " + displayName(serviceName));
    }

    private void add(Map<String, String> options, PrintStream out) {
        String serviceName = requireService(options);
        String token = resolveTokenValue(serviceName, options, out);
        openProvider(options).storeToken(serviceName, token);
        out.println("Successfully added token for " + displayName(serviceName));
    }

    private void delete(Map<String, String> options, PrintStream out) {
        String serviceName = requireService(options);
        openProvider(options).deleteToken(serviceName);
        out.println("Deleted token for " + displayName(serviceName));
    }

    TokenProvider openProvider(Map<String, String> options) {
        String vaultFile = option(options, "file", "VAULT_PATH");
        if (vaultFile == null) {
            vaultFile = new VaultProperties().getPath();
        }
        String passphrase = option(options, "passphrase", "VAULT_ENCRYPTION_KEY");
        String salt = option(options, "salt", "VAULT_SALT");

        VaultEncryptionService encryptionService = new VaultEncryptionServiceImpl();
        RotationPolicy rotationPolicy = new RotationPolicyImpl(clock);
        LocalFileSecretStore secretStore = new LocalFileSecretStore(encryptionService, rotationPolicy, clock,
                passphrase, salt, Paths.get(vaultFile));
        TokenProvider tokenProvider = new TokenProviderImpl(secretStore,
                new InMemoryTokenCacheImpl(clock, Duration.ofMinutes(5)), environment, false);
        tokenProvider.initialize();
        return tokenProvider;
    }

    private String resolveTokenValue(String serviceName, Map<String, String> options, PrintStream out) {
        String value = options.get("value");
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        boolean generated = KnownService.fromServiceName(serviceName)
                .map(KnownService::isGenerated)
                .orElse(false);
        if (!generated) {
            throw new UsageException("--value is required for service " + serviceName);
        }
        byte[] bytes = new byte[GENERATED_TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        out.println("Generated a secure random token");
        return Hex.encodeHexString(bytes);
    }

    private String requireService(Map<String, String> options) {
        String serviceName = options.get("service");
        if (serviceName == null || serviceName.isBlank()) {
            throw new UsageException("--service is required for this operation");
        }
        return serviceName.trim();
    }

    private String option(Map<String, String> options, String name, String envVariable) {
        String value = options.get(name);
        return value != null ? value : environment.getProperty(envVariable);
    }

    private static String displayName(String serviceName) {
        return KnownService.fromServiceName(serviceName)
                .map(KnownService::getDisplayName)
                .orElse(serviceName);
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i += 2) {
            if (i + 1 < args.length && args[i].startsWith("--")) {
                options.put(args[i].substring(2), args[i + 1]);
            }
        }
        return options;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  VaultAdminCli --operation <list-due|list|rotate|add|delete> [options]");
        err.println("Options:");
        err.println("  --service <name>        openai, google_maps, auth_jwt, data_encryption, sendgrid, ...");
        err.println("  --value <token>         new token value; generated for auth_jwt and data_encryption");
        err.println("  --file <vault-file>     defaults to VAULT_PATH");
        err.println("  --passphrase <key>      defaults to VAULT_ENCRYPTION_KEY");
        err.println("  --salt <salt>           defaults to VAULT_SALT");
    }

    private static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}

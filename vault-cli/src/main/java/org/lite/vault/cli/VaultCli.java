package org.lite.vault.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.lite.vault.credential.AesGcmCredentialVault;
import org.lite.vault.credential.CredentialVault;
import org.lite.vault.credential.CredentialVaultException;
import org.lite.vault.credential.MasterKeys;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Standalone operator CLI for the tool gateway credential vault.
 * Usage:
 *   java -jar vault-cli.jar --operation keygen [--format raw|env|json]
 *   java -jar vault-cli.jar --operation encrypt --master-key &lt;base64-key&gt; [--value &lt;plaintext&gt;]
 *   java -jar vault-cli.jar --operation decrypt --master-key &lt;base64-key&gt; [--value &lt;ciphertext&gt;]
 * The master key falls back to TOOL_GATEWAY_VAULT_MASTER_KEY; the value falls
 * back to standard input so secrets need not appear in the process list.
 */
public class VaultCli {

    static final String MASTER_KEY_VARIABLE = "TOOL_GATEWAY_VAULT_MASTER_KEY";
    static final String DEFAULT_KEY_CONTEXT = "integration-credentials";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private final Map<String, String> environment;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    VaultCli(Map<String, String> environment, InputStream in, PrintStream out, PrintStream err) {
        this.environment = environment;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new VaultCli(System.getenv(), System.in, System.out, System.err).run(args);
        System.exit(exitCode);
    }

    int run(String[] args) {
        Map<String, String> options = parseArgs(args);
        String operation = options.get("operation");

        if (operation == null) {
            printUsage();
            return EXIT_USAGE;
        }

        try {
            switch (operation) {
                case "keygen":
                    return keygen(options.getOrDefault("format", "raw"));
                case "encrypt":
                    return transform(options, true);
                case "decrypt":
                    return transform(options, false);
                default:
                    err.println("Error: unknown operation '" + operation + "'");
                    printUsage();
                    return EXIT_USAGE;
            }
        } catch (CredentialVaultException e) {
            // Vault messages never contain key material or plaintext
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error: could not read input: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int keygen(String format) throws IOException {
        String masterKey = MasterKeys.generate();
        switch (format) {
            case "raw":
                out.println(masterKey);
                return EXIT_OK;
            case "env":
                out.println(MASTER_KEY_VARIABLE + "=" + masterKey);
                return EXIT_OK;
            case "json":
                Map<String, Object> json = new LinkedHashMap<>();
                json.put("variable", MASTER_KEY_VARIABLE);
                json.put("masterKey", masterKey);
                json.put("keyLengthBytes", MasterKeys.KEY_LENGTH);
                ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                out.println(mapper.writeValueAsString(json));
                return EXIT_OK;
            default:
                err.println("Error: --format must be raw, env or json");
                return EXIT_USAGE;
        }
    }

    private int transform(Map<String, String> options, boolean encrypt) throws IOException {
        String masterKey = options.getOrDefault("master-key", environment.get(MASTER_KEY_VARIABLE));
        if (masterKey == null || masterKey.isBlank()) {
            err.println("Error: --master-key or " + MASTER_KEY_VARIABLE + " is required");
            return EXIT_USAGE;
        }
        String keyContext = options.getOrDefault("key-context", DEFAULT_KEY_CONTEXT);

        String value = options.containsKey("value") ? options.get("value") : readStdin();
        if (value == null) {
            err.println("Error: no value given on --value or standard input");
            return EXIT_USAGE;
        }

        CredentialVault vault = new AesGcmCredentialVault(masterKey, keyContext);
        out.println(encrypt ? vault.encrypt(value) : vault.decrypt(value.trim()));
        return EXIT_OK;
    }

    private String readStdin() throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String content = reader.lines().collect(Collectors.joining("\n"));
        return content.isEmpty() ? null : content;
    }

    private void printUsage() {
        err.println("Usage:");
        err.println("  Generate a master key:");
        err.println("    VaultCli --operation keygen [--format raw|env|json]");
        err.println("  Encrypt a credential value:");
        err.println("    VaultCli --operation encrypt [--master-key <base64-key>] [--key-context <ctx>] [--value <plaintext>]");
        err.println("  Decrypt a stored ciphertext:");
        err.println("    VaultCli --operation decrypt [--master-key <base64-key>] [--key-context <ctx>] [--value <ciphertext>]");
        err.println("  The master key defaults to $" + MASTER_KEY_VARIABLE + "; the value defaults to standard input.");
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
}

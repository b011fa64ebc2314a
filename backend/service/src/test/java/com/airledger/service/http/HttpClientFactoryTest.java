package com.airledger.service.http;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @TempDir
    Path tempDir;

    @Test
    void createsDefaultClientWithoutCustomTruststore() {
        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of());

        assertNotNull(client);
        assertEquals(Duration.ofMillis(200), client.connectTimeout().orElseThrow());
    }

    @Test
    void missingTruststoreFileFailsAtStartup() {
        Map<String, String> env = Map.of(
                HttpClientFactory.TRUSTSTORE_PATH, tempDir.resolve("missing.jks").toString(),
                HttpClientFactory.TRUSTSTORE_PASSWORD, "changeit"
        );

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), env));
        assertTrue(ex.getMessage().contains("Truststore file does not exist"));
    }

    @Test
    void truststorePathWithoutPasswordFails() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                        HttpClientFactory.TRUSTSTORE_PATH, tempDir.resolve("truststore.jks").toString())));
        assertTrue(ex.getMessage().contains("TRUSTSTORE_PASSWORD must be set"));
    }

    @Test
    void acceptsJksAndPkcs12Truststores() throws Exception {
        Path jks = tempDir.resolve("truststore.jks");
        Path p12 = tempDir.resolve("truststore.p12");
        writeEmptyTruststore(jks, "JKS", "changeit".toCharArray());
        writeEmptyTruststore(p12, "PKCS12", "changeit".toCharArray());

        assertNotNull(HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                HttpClientFactory.TRUSTSTORE_PATH, jks.toString(),
                HttpClientFactory.TRUSTSTORE_PASSWORD, "changeit")));
        assertNotNull(HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                HttpClientFactory.TRUSTSTORE_PATH, p12.toString(),
                HttpClientFactory.TRUSTSTORE_PASSWORD, "changeit")));
    }

    @Test
    void wrongTruststorePasswordFails() throws Exception {
        Path jks = tempDir.resolve("truststore.jks");
        writeEmptyTruststore(jks, "JKS", "correct-password".toCharArray());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                        HttpClientFactory.TRUSTSTORE_PATH, jks.toString(),
                        HttpClientFactory.TRUSTSTORE_PASSWORD, "wrong-password")));
        assertTrue(ex.getMessage().contains("Failed to build SSL context from truststore"));
    }

    private static void writeEmptyTruststore(Path file, String type, char[] password) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        keyStore.load(null, password);
        try (OutputStream out = Files.newOutputStream(file)) {
            keyStore.store(out, password);
        }
    }
}

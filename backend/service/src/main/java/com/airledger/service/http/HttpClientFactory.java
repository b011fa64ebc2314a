package com.airledger.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Shared HTTP client for the external connectors. A custom truststore is used when
 * {@code TRUSTSTORE_PATH} is set.
 */
public final class HttpClientFactory {
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    public static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        TrustStoreSettings.fromEnvironment(environment).ifPresent(settings -> {
            builder.sslContext(settings.sslContext());
            LOGGER.info("Using custom truststore " + settings.path());
        });
        return builder.build();
    }

    record TrustStoreSettings(Path path, String password) {
        static Optional<TrustStoreSettings> fromEnvironment(Map<String, String> environment) {
            String path = environment.get(TRUSTSTORE_PATH);
            if (path == null || path.isBlank()) {
                return Optional.empty();
            }
            String password = environment.get(TRUSTSTORE_PASSWORD);
            if (password == null) {
                throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
            }
            Path file = Path.of(path);
            if (!Files.exists(file)) {
                throw new IllegalStateException("Truststore file does not exist: " + file);
            }
            return Optional.of(new TrustStoreSettings(file, password));
        }

        String type() {
            String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
            if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
                return "PKCS12";
            }
            return "JKS";
        }

        SSLContext sslContext() {
            try (InputStream in = Files.newInputStream(path)) {
                KeyStore trustStore = KeyStore.getInstance(type());
                trustStore.load(in, password.toCharArray());

                TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
                tmf.init(trustStore);

                SSLContext sslContext = SSLContext.getInstance("TLS");
                sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
                return sslContext;
            } catch (Exception e) {
                throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
            }
        }
    }
}

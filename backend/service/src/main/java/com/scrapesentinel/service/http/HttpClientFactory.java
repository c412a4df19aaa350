package com.scrapesentinel.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the shared {@link HttpClient} used for scraping. Redirects are followed, and a custom
 * truststore can be supplied through {@code SCRAPER_TRUSTSTORE_PATH} for targets behind private
 * certificate authorities. Its password comes from {@code SCRAPER_TRUSTSTORE_PASSWORD} or, for
 * mounted secrets, from the file named by {@code SCRAPER_TRUSTSTORE_PASSWORD_FILE}.
 */
public final class HttpClientFactory {
    static final String TRUSTSTORE_PATH = "SCRAPER_TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD = "SCRAPER_TRUSTSTORE_PASSWORD";
    static final String TRUSTSTORE_PASSWORD_FILE = "SCRAPER_TRUSTSTORE_PASSWORD_FILE";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        String truststore = environment.get(TRUSTSTORE_PATH);
        if (truststore != null && !truststore.isBlank()) {
            builder.sslContext(loadTruststore(Path.of(truststore), truststorePassword(environment)));
        }
        return builder.build();
    }

    private static String truststorePassword(Map<String, String> environment) {
        String password = environment.get(TRUSTSTORE_PASSWORD);
        if (password != null) {
            return password;
        }
        String passwordFile = environment.get(TRUSTSTORE_PASSWORD_FILE);
        if (passwordFile == null || passwordFile.isBlank()) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " or " + TRUSTSTORE_PASSWORD_FILE
                    + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        Path path = Path.of(passwordFile);
        try {
            return Files.readString(path).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading truststore password from " + path, e);
        }
    }

    private static SSLContext loadTruststore(Path path, String password) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore store = KeyStore.getInstance(storeType(path));
            store.load(in, password.toCharArray());
            TrustManagerFactory trust = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trust.init(store);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trust.getTrustManagers(), new SecureRandom());
            return context;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load truststore " + path, e);
        }
    }

    private static String storeType(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".p12") || name.endsWith(".pfx") ? "PKCS12" : "JKS";
    }
}

package com.scrapesentinel.service.http;

import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void defaultClientFollowsRedirects() {
        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of());

        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
        assertEquals(Duration.ofMillis(200), client.connectTimeout().orElseThrow());
    }

    @Test
    void truststoreRequiresPassword() {
        IllegalStateException error = assertThrows(IllegalStateException.class, () -> HttpClientFactory.create(
                Duration.ofMillis(200),
                Map.of(HttpClientFactory.TRUSTSTORE_PATH, "/tmp/any.jks")
        ));

        assertTrue(error.getMessage().contains(HttpClientFactory.TRUSTSTORE_PASSWORD));
    }

    @Test
    void missingTruststoreFileFails() {
        IllegalStateException error = assertThrows(IllegalStateException.class, () -> HttpClientFactory.create(
                Duration.ofMillis(200),
                Map.of(
                        HttpClientFactory.TRUSTSTORE_PATH, "/tmp/does-not-exist-scraper.jks",
                        HttpClientFactory.TRUSTSTORE_PASSWORD, "changeit"
                )
        ));

        assertTrue(error.getMessage().contains("does not exist"));
    }

    @Test
    void loadsPkcs12TruststoreAndRejectsWrongPassword() throws Exception {
        Path truststore = Files.createTempFile("scraper-truststore-", ".p12");
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        keyStore.load(null, "secret".toCharArray());
        try (OutputStream out = Files.newOutputStream(truststore)) {
            keyStore.store(out, "secret".toCharArray());
        }

        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                HttpClientFactory.TRUSTSTORE_PATH, truststore.toString(),
                HttpClientFactory.TRUSTSTORE_PASSWORD, "secret"
        ));
        IllegalStateException wrong = assertThrows(IllegalStateException.class, () -> HttpClientFactory.create(
                Duration.ofMillis(200),
                Map.of(
                        HttpClientFactory.TRUSTSTORE_PATH, truststore.toString(),
                        HttpClientFactory.TRUSTSTORE_PASSWORD, "wrong"
                )
        ));

        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
        assertTrue(wrong.getMessage().contains("Failed to load truststore"));
    }

    @Test
    void truststorePasswordCanComeFromAFile() throws Exception {
        Path truststore = Files.createTempFile("scraper-truststore-", ".p12");
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        keyStore.load(null, "secret".toCharArray());
        try (OutputStream out = Files.newOutputStream(truststore)) {
            keyStore.store(out, "secret".toCharArray());
        }
        Path passwordFile = Files.createTempFile("scraper-truststore-password-", ".txt");
        Files.writeString(passwordFile, "secret\n");

        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of(
                HttpClientFactory.TRUSTSTORE_PATH, truststore.toString(),
                HttpClientFactory.TRUSTSTORE_PASSWORD_FILE, passwordFile.toString()
        ));
        IllegalStateException unreadable = assertThrows(IllegalStateException.class, () -> HttpClientFactory.create(
                Duration.ofMillis(200),
                Map.of(
                        HttpClientFactory.TRUSTSTORE_PATH, truststore.toString(),
                        HttpClientFactory.TRUSTSTORE_PASSWORD_FILE, passwordFile + ".missing"
                )
        ));

        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
        assertTrue(unreadable.getMessage().contains("Failed reading truststore password"));
    }
}

package com.codeheadsystems.relman.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.relman.model.keys.KeyCheckResponse;
import com.codeheadsystems.relman.model.keys.KeyImportResponse;
import com.codeheadsystems.relman.model.keys.RegenerationResponse;
import com.codeheadsystems.relman.model.token.JwtResponse;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for the key endpoints and the bundle's health check.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class KeysIntegrationTest {

  static final DropwizardAppExtension<RelmanConfiguration> APP =
      new DropwizardAppExtension<>(
          RelmanApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String MALFORMED_KEYS_FILE = """
      pub   rsa4096 2024-01-01
      -----BEGIN PGP PUBLIC KEY BLOCK-----

      not a key
      -----END PGP PUBLIC KEY BLOCK-----
      """;

  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
  }

  @Test
  void healthCheckReportsHealthy() throws Exception {
    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d/healthcheck", APP.getAdminPort())))
        .GET()
        .build(), HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("storage");
  }

  @Test
  void lookupUnknownKey_isPublicAndReturns404() throws Exception {
    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/keys/00112233445566778899aabbccddeeff00112233"))
        .GET()
        .build(), HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(404);
  }

  @Test
  void importMalformedKeysFile_reportsItemFailure() throws Exception {
    HttpResponse<String> response = importKeys("tooling", jwt("alice"));

    assertThat(response.statusCode()).isEqualTo(200);
    KeyImportResponse report = APP.getObjectMapper().readValue(response.body(), KeyImportResponse.class);
    assertThat(report.committee()).isEqualTo("tooling");
    assertThat(report.successCount()).isZero();
    assertThat(report.failureCount()).isEqualTo(1);
    assertThat(report.items()).singleElement().satisfies(item -> {
      assertThat(item.item()).isEqualTo("key-1");
      assertThat(item.error()).isNotBlank();
    });
  }

  @Test
  void importIntoOtherCommittee_returns403() throws Exception {
    HttpResponse<String> response = importKeys("docs", jwt("bob"));

    assertThat(response.statusCode()).isEqualTo(403);
  }

  @Test
  void importIntoUnknownCommittee_returns404() throws Exception {
    HttpResponse<String> response = importKeys("nosuch", jwt("alice"));

    assertThat(response.statusCode()).isEqualTo(404);
  }

  @Test
  void regenerateAll_nonAdministrator_returns403() throws Exception {
    assertThat(post("/api/keys/regenerate-all", jwt("alice")).statusCode()).isEqualTo(403);
  }

  @Test
  void regenerateAll_administrator_writesEveryKeysFile() throws Exception {
    HttpResponse<String> response = post("/api/keys/regenerate-all", jwt("root"));

    assertThat(response.statusCode()).isEqualTo(200);
    RegenerationResponse regeneration = APP.getObjectMapper().readValue(response.body(), RegenerationResponse.class);
    assertThat(regeneration.regenerated()).containsOnlyKeys("docs", "tooling");
    assertThat(regeneration.errors()).isEmpty();
    assertThat(Files.readString(Path.of(regeneration.regenerated().get("docs")))).contains("# Keys:");
  }

  @Test
  void removeAll_withoutToken_returns401() throws Exception {
    assertThat(post("/api/keys/tooling/remove-all", null).statusCode()).isEqualTo(401);
  }

  @Test
  void removeAll_committeeMember_returns403() throws Exception {
    assertThat(post("/api/keys/tooling/remove-all", jwt("alice")).statusCode()).isEqualTo(403);
  }

  @Test
  void checkKeys_administratorOnly() throws Exception {
    assertThat(get("/api/keys/check", jwt("alice")).statusCode()).isEqualTo(403);

    HttpResponse<String> response = get("/api/keys/check", jwt("root"));

    assertThat(response.statusCode()).isEqualTo(200);
    KeyCheckResponse check = APP.getObjectMapper().readValue(response.body(), KeyCheckResponse.class);
    assertThat(check.checked()).isNotNegative();
    assertThat(check.mismatches()).isNotNull();
  }

  private String jwt(String uid) throws Exception {
    String plaintext = RelmanApplication.seedPat(uid).plaintext();
    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/jwt"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString("{\"asfuid\":\"" + uid + "\",\"pat\":\"" + plaintext + "\"}"))
        .build(), HttpResponse.BodyHandlers.ofString());
    assertThat(response.statusCode()).isEqualTo(200);
    return APP.getObjectMapper().readValue(response.body(), JwtResponse.class).jwt();
  }

  private HttpResponse<String> importKeys(String committee, String jwt) throws Exception {
    return httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/keys/" + committee + "/import"))
        .header("Authorization", "Bearer " + jwt)
        .header("Content-Type", "text/plain")
        .POST(HttpRequest.BodyPublishers.ofString(MALFORMED_KEYS_FILE))
        .build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> post(String path, String jwt) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .POST(HttpRequest.BodyPublishers.noBody());
    if (jwt != null) {
      builder.header("Authorization", "Bearer " + jwt);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> get(String path, String jwt) throws Exception {
    return httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .header("Authorization", "Bearer " + jwt)
        .GET()
        .build(), HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}

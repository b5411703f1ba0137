package com.codeheadsystems.relman.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.relman.model.token.JwtResponse;
import com.codeheadsystems.relman.model.token.PatSummary;
import com.codeheadsystems.relman.server.auth.IssuedPat;
import com.fasterxml.jackson.core.type.TypeReference;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for exchanging personal access tokens and managing them with the
 * resulting session token.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class TokenIntegrationTest {

  static final DropwizardAppExtension<RelmanConfiguration> APP =
      new DropwizardAppExtension<>(
          RelmanApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
  }

  @Test
  void exchange_validPat_returnsJwt() throws Exception {
    IssuedPat pat = RelmanApplication.seedPat("alice");

    HttpResponse<String> response = exchange("alice", pat.plaintext());

    assertThat(response.statusCode()).isEqualTo(200);
    JwtResponse jwt = APP.getObjectMapper().readValue(response.body(), JwtResponse.class);
    assertThat(jwt.asfuid()).isEqualTo("alice");
    assertThat(jwt.jwt()).isNotBlank();
  }

  @Test
  void exchange_wrongPat_returns401() throws Exception {
    RelmanApplication.seedPat("alice");

    assertThat(exchange("alice", "not-the-token").statusCode()).isEqualTo(401);
  }

  @Test
  void exchange_otherUsersPat_returns401() throws Exception {
    IssuedPat pat = RelmanApplication.seedPat("bob");

    assertThat(exchange("alice", pat.plaintext()).statusCode()).isEqualTo(401);
  }

  @Test
  void exchange_missingField_returns400() throws Exception {
    HttpResponse<String> response = post("/api/jwt", null, "{\"asfuid\":\"alice\"}");

    assertThat(response.statusCode()).isEqualTo(400);
  }

  @Test
  void listTokens_withJwt_returnsOwnTokens() throws Exception {
    IssuedPat pat = RelmanApplication.seedPat("carol");
    String jwt = jwt("carol", pat.plaintext());

    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/tokens"))
        .header("Authorization", "Bearer " + jwt)
        .GET()
        .build(), HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(200);
    List<PatSummary> pats = APP.getObjectMapper().readValue(response.body(), new TypeReference<>() {
    });
    assertThat(pats).extracting(PatSummary::id).contains(pat.token().id());
    assertThat(pats).allSatisfy(summary -> assertThat(summary.owner()).isEqualTo("carol"));
    assertThat(response.body()).doesNotContain(pat.plaintext());
  }

  @Test
  void revoke_thenExchangeFails() throws Exception {
    IssuedPat pat = RelmanApplication.seedPat("dave");
    String jwt = jwt("dave", pat.plaintext());

    HttpResponse<String> revoked = post("/api/tokens/dave/" + pat.token().id() + "/revoke", jwt, null);

    assertThat(revoked.statusCode()).isEqualTo(204);
    assertThat(exchange("dave", pat.plaintext()).statusCode()).isEqualTo(401);
  }

  @Test
  void revoke_otherUsersToken_returns403() throws Exception {
    IssuedPat alicePat = RelmanApplication.seedPat("alice");
    IssuedPat bobPat = RelmanApplication.seedPat("bob");
    String jwt = jwt("bob", bobPat.plaintext());

    HttpResponse<String> response = post("/api/tokens/alice/" + alicePat.token().id() + "/revoke", jwt, null);

    assertThat(response.statusCode()).isEqualTo(403);
  }

  @Test
  void listTokens_noToken_returns401() throws Exception {
    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/tokens"))
        .GET()
        .build(), HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void listTokens_bogusToken_returns401() throws Exception {
    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/tokens"))
        .header("Authorization", "Bearer not-a-real-token")
        .GET()
        .build(), HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  private String jwt(String uid, String plaintext) throws Exception {
    HttpResponse<String> response = exchange(uid, plaintext);
    assertThat(response.statusCode()).isEqualTo(200);
    return APP.getObjectMapper().readValue(response.body(), JwtResponse.class).jwt();
  }

  private HttpResponse<String> exchange(String uid, String plaintext) throws Exception {
    return post("/api/jwt", null, "{\"asfuid\":\"" + uid + "\",\"pat\":\"" + plaintext + "\"}");
  }

  private HttpResponse<String> post(String path, String jwt, String json) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl() + path));
    if (jwt != null) {
      builder.header("Authorization", "Bearer " + jwt);
    }
    if (json != null) {
      builder.header("Content-Type", "application/json").POST(HttpRequest.BodyPublishers.ofString(json));
    } else {
      builder.POST(HttpRequest.BodyPublishers.noBody());
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}

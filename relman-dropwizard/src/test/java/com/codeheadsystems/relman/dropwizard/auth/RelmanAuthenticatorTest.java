package com.codeheadsystems.relman.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.relman.server.auth.AuthenticationMethod;
import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.JwtManager;
import com.codeheadsystems.relman.server.auth.RandomProvider;
import com.codeheadsystems.relman.server.auth.SessionToken;
import com.codeheadsystems.relman.server.auth.SigningSecret;
import java.time.Clock;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RelmanAuthenticatorTest {

  private final JwtManager jwtManager =
      new JwtManager(SigningSecret.generate(new RandomProvider()), "relman-test", Clock.systemUTC());
  private final RelmanAuthenticator authenticator = new RelmanAuthenticator(jwtManager);

  @Test
  void authenticate_validToken() {
    SessionToken token = jwtManager.issue("alice");

    Optional<FoundationPrincipal> principal = authenticator.authenticate(token.token());

    assertThat(principal).hasValueSatisfying(p -> {
      assertThat(p.uid()).isEqualTo("alice");
      assertThat(p.method()).isEqualTo(AuthenticationMethod.SESSION_TOKEN);
      assertThat(p.jti()).isEqualTo(token.jti());
    });
  }

  @Test
  void authenticate_tokenFromPreviousRun_rejected() {
    JwtManager previousRun =
        new JwtManager(SigningSecret.generate(new RandomProvider()), "relman-test", Clock.systemUTC());

    assertThat(authenticator.authenticate(previousRun.issue("alice").token())).isEmpty();
    assertThat(authenticator.authenticate("garbage")).isEmpty();
  }
}

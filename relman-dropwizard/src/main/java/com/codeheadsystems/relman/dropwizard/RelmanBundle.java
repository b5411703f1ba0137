package com.codeheadsystems.relman.dropwizard;

import com.codeheadsystems.relman.dropwizard.auth.RelmanAuthenticator;
import com.codeheadsystems.relman.dropwizard.health.StorageHealthCheck;
import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.JwtManager;
import com.codeheadsystems.relman.server.auth.PatGenerator;
import com.codeheadsystems.relman.server.auth.RandomProvider;
import com.codeheadsystems.relman.server.auth.SigningSecret;
import com.codeheadsystems.relman.server.manager.KeysManager;
import com.codeheadsystems.relman.server.manager.TokenManager;
import com.codeheadsystems.relman.server.resource.JwtResource;
import com.codeheadsystems.relman.server.resource.KeysResource;
import com.codeheadsystems.relman.server.resource.TokensResource;
import com.codeheadsystems.relman.server.storage.StorageManager;
import com.codeheadsystems.relman.server.storage.WriteAuditor;
import com.codeheadsystems.relman.server.store.FilesystemArtifactStore;
import com.codeheadsystems.relman.server.store.InMemoryStorageBackend;
import com.codeheadsystems.relman.server.store.StorageBackend;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the relman core into an existing Dropwizard application.
 * <p>
 * Registers the token and key resources, the storage health check, and the bearer JWT
 * authentication filter. Requires a {@link RelmanConfiguration} in the application's YAML config.
 * <p>
 * Embed in your application with an in-memory record store (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new RelmanBundle<>());
 * }</pre>
 * <p>
 * Or supply a persistent store:
 * <pre>{@code
 *   bootstrap.addBundle(new RelmanBundle<>(myStorageBackend, WriteAuditor.NO_OP));
 * }</pre>
 */
@Singleton
public class RelmanBundle<C extends RelmanConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(RelmanBundle.class);

  private final StorageBackend storageBackend;
  private final WriteAuditor writeAuditor;
  private final RandomProvider randomProvider = new RandomProvider();
  private final Clock clock = Clock.systemUTC();

  /**
   * Creates a bundle backed by an in-memory record store.
   * <p>
   * For dev/test only: all keys and personal access tokens are lost on restart.
   */
  public RelmanBundle() {
    this(new InMemoryStorageBackend(), WriteAuditor.NO_OP);
    log.warn("""
        #################################################################
        # WARNING: Using an in-memory record store. All signing keys    #
        # and personal access tokens will be lost on restart.           #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied record store.
   *
   * @param storageBackend the record store
   * @param writeAuditor   hook called before every mutation
   */
  @Inject
  public RelmanBundle(StorageBackend storageBackend, WriteAuditor writeAuditor) {
    this.storageBackend = storageBackend;
    this.writeAuditor = writeAuditor;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) throws Exception {
    Path keysDirectory = Files.createDirectories(Path.of(configuration.getKeysDirectory()));
    FilesystemArtifactStore artifactStore = new FilesystemArtifactStore(keysDirectory);
    log.info("Publishing KEYS files under {}", artifactStore.root());

    JwtManager jwtManager = new JwtManager(SigningSecret.generate(randomProvider), configuration.getJwtIssuer(), clock);
    log.info("Generated a new session token signing secret; tokens from earlier runs are no longer valid");

    StorageManager storageManager = new StorageManager(storageBackend, artifactStore,
        configuration.buildMembershipDirectory(), jwtManager, new PatGenerator(randomProvider, clock), writeAuditor);
    TokenManager tokenManager = new TokenManager(storageManager);
    KeysManager keysManager = new KeysManager(storageManager);

    environment.jersey().register(new JwtResource(tokenManager));
    environment.jersey().register(new TokensResource(tokenManager));
    environment.jersey().register(new KeysResource(keysManager));
    environment.healthChecks().register("storage", new StorageHealthCheck(storageBackend, artifactStore));

    // JWT auth filter
    RelmanAuthenticator authenticator = new RelmanAuthenticator(jwtManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<FoundationPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(FoundationPrincipal.class));
  }
}

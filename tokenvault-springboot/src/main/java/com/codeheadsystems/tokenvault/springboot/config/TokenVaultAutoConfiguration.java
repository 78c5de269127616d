package com.codeheadsystems.tokenvault.springboot.config;

import com.codeheadsystems.tokenvault.server.codec.JacksonSessionCodec;
import com.codeheadsystems.tokenvault.server.codec.SessionCodec;
import com.codeheadsystems.tokenvault.server.crypto.BCryptSecretHasher;
import com.codeheadsystems.tokenvault.server.crypto.SecretHasher;
import com.codeheadsystems.tokenvault.server.manager.ArtifactManager;
import com.codeheadsystems.tokenvault.server.manager.ClientManager;
import com.codeheadsystems.tokenvault.server.manager.RevocationManager;
import com.codeheadsystems.tokenvault.server.store.ArtifactStore;
import com.codeheadsystems.tokenvault.server.store.ClientStore;
import com.codeheadsystems.tokenvault.server.store.InMemoryArtifactStore;
import com.codeheadsystems.tokenvault.server.store.InMemoryClientStore;
import com.codeheadsystems.tokenvault.springboot.health.ArtifactStoreHealthIndicator;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the client registry, artifact store and revocation coordinator.
 * <p>
 * Every bean backs off when the application defines its own. Replace the in-memory stores with
 * persistent implementations by declaring {@link ClientStore} and {@link ArtifactStore} beans:
 * <pre>{@code
 *   @Bean
 *   public ArtifactStore artifactStore(DataSource dataSource) {
 *     return new JdbcArtifactStore(dataSource);
 *   }
 * }</pre>
 * To evolve a session type, declare a {@link SessionCodec} bean built with upgrade steps and raise
 * {@code tokenvault.sessionSchemaVersion}.
 */
@AutoConfiguration
@EnableConfigurationProperties(TokenVaultProperties.class)
public class TokenVaultAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(TokenVaultAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public ClientStore clientStore() {
    log.warn("Using in-memory client store. All data will be lost on restart. Do not use in production.");
    return new InMemoryClientStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public ArtifactStore artifactStore() {
    log.warn("Using in-memory artifact store. All data will be lost on restart. Do not use in production.");
    return new InMemoryArtifactStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public SecretHasher secretHasher(TokenVaultProperties props, SecureRandom secureRandom) {
    if (props.getBcryptCost() < 10) {
      log.warn("bcrypt cost {} is below 10. Do not use in production.", props.getBcryptCost());
    }
    return new BCryptSecretHasher(props.getBcryptCost(), secureRandom);
  }

  @Bean
  @ConditionalOnMissingBean
  public SessionCodec sessionCodec(TokenVaultProperties props) {
    return new JacksonSessionCodec(JacksonSessionCodec.defaultObjectMapper(),
        props.getSessionSchemaVersion(), Map.of());
  }

  @Bean
  @ConditionalOnMissingBean
  public ClientManager clientManager(ClientStore clientStore, SecretHasher secretHasher) {
    return new ClientManager(clientStore, secretHasher);
  }

  @Bean
  @ConditionalOnMissingBean
  public ArtifactManager artifactManager(TokenVaultProperties props, ArtifactStore artifactStore,
                                         ClientStore clientStore, SessionCodec sessionCodec, Clock clock) {
    return new ArtifactManager(artifactStore, clientStore, sessionCodec,
        props.getMissingArtifactPolicy(), clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RevocationManager revocationManager(ArtifactStore artifactStore) {
    return new RevocationManager(artifactStore);
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
  static class HealthConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ArtifactStoreHealthIndicator artifactStoreHealthIndicator(ArtifactStore artifactStore) {
      return new ArtifactStoreHealthIndicator(artifactStore);
    }
  }
}

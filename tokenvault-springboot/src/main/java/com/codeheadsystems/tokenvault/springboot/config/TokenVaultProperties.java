package com.codeheadsystems.tokenvault.springboot.config;

import com.codeheadsystems.tokenvault.server.codec.JacksonSessionCodec;
import com.codeheadsystems.tokenvault.server.crypto.BCryptSecretHasher;
import com.codeheadsystems.tokenvault.server.manager.MissingArtifactPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tokenvault")
public class TokenVaultProperties {

  private int bcryptCost = BCryptSecretHasher.DEFAULT_COST;
  private MissingArtifactPolicy missingArtifactPolicy = MissingArtifactPolicy.IGNORE;
  private int sessionSchemaVersion = JacksonSessionCodec.DEFAULT_SCHEMA_VERSION;

  public int getBcryptCost() {
    return bcryptCost;
  }

  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }

  public MissingArtifactPolicy getMissingArtifactPolicy() {
    return missingArtifactPolicy;
  }

  public void setMissingArtifactPolicy(MissingArtifactPolicy missingArtifactPolicy) {
    this.missingArtifactPolicy = missingArtifactPolicy;
  }

  public int getSessionSchemaVersion() {
    return sessionSchemaVersion;
  }

  public void setSessionSchemaVersion(int sessionSchemaVersion) {
    this.sessionSchemaVersion = sessionSchemaVersion;
  }
}

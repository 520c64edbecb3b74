package com.ospicorp.priceapi.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WebConfigTest {

  private static PriceApiProperties.Entsoe entsoe(String token, String tokenFile) {
    return new PriceApiProperties.Entsoe("https://entsoe.test", token, tokenFile,
        Duration.ofSeconds(1), Duration.ofSeconds(1));
  }

  @Test
  void configuredTokenWins(@TempDir Path dir) throws Exception {
    Path file = Files.writeString(dir.resolve("token"), "from-file\n");

    assertThat(WebConfig.resolveSecurityToken(entsoe(" inline ", file.toString())))
        .isEqualTo("inline");
  }

  @Test
  void tokenFileIsReadAndTrimmed(@TempDir Path dir) throws Exception {
    Path file = Files.writeString(dir.resolve("token"), "  from-file\n");

    assertThat(WebConfig.resolveSecurityToken(entsoe(null, file.toString())))
        .isEqualTo("from-file");
  }

  @Test
  void missingTokenFileFailsStartup(@TempDir Path dir) {
    String missing = dir.resolve("absent").toString();

    assertThatThrownBy(() -> WebConfig.resolveSecurityToken(entsoe("", missing)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void noTokenAtAllYieldsEmptyToken() {
    assertThat(WebConfig.resolveSecurityToken(entsoe(null, null))).isEmpty();
  }
}

package io.veomenu.backend.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class SecureTokensTest {

  private Locale defaultLocale;

  @BeforeEach
  void rememberLocale() {
    defaultLocale = Locale.getDefault();
  }

  @AfterEach
  void restoreLocale() {
    Locale.setDefault(defaultLocale);
  }

  @RepeatedTest(20)
  void numericCodesKeepLeadingZeros() {
    assertThat(SecureTokens.newNumericCode(6)).matches("[0-9]{6}");
  }

  @Test
  void numericCodesUseAsciiDigitsWhateverTheDefaultLocale() {
    Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));

    for (int i = 0; i < 20; i++) {
      assertThat(SecureTokens.newNumericCode(6)).matches("[0-9]{6}");
    }
  }

  @Test
  void urlSafeTokensHaveNoPaddingOrReservedCharacters() {
    assertThat(SecureTokens.newUrlSafeToken()).matches("[A-Za-z0-9_-]{43}");
  }

  @Test
  void hashesCompareByValue() {
    String hash = SecureTokens.sha256Hex("secret");

    assertThat(hash).hasSize(64);
    assertThat(SecureTokens.hashesMatch(hash, SecureTokens.sha256Hex("secret"))).isTrue();
    assertThat(SecureTokens.hashesMatch(hash, SecureTokens.sha256Hex("Secret"))).isFalse();
    assertThat(SecureTokens.hashesMatch(hash, null)).isFalse();
  }
}

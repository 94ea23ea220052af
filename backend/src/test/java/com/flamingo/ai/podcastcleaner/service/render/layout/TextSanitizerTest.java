package com.flamingo.ai.podcastcleaner.service.render.layout;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextSanitizer")
class TextSanitizerTest {

  @Test
  @DisplayName("should replace unencodable code points with a question mark")
  void shouldReplace_whenNotEncodable() {
    assertThat(TextSanitizer.sanitize("café 😀 ok", cp -> cp < 0x100)).isEqualTo("café ? ok");
  }

  @Test
  @DisplayName("should turn tabs into spaces and drop other control characters")
  void shouldNormalizeControls_whenPresent() {
    assertThat(TextSanitizer.sanitize("a\tb\u0000c\u0007d\u009fe", cp -> true))
        .isEqualTo("a bcde");
  }

  @Test
  @DisplayName("should return empty text for null input")
  void shouldReturnEmpty_whenNull() {
    assertThat(TextSanitizer.sanitize(null, cp -> true)).isEmpty();
  }
}

package com.flamingo.ai.podcastcleaner.service.highlight;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.podcastcleaner.agent.HighlightAgent;
import com.flamingo.ai.podcastcleaner.exception.GenerationFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("HighlightServiceImpl")
class HighlightServiceImplTest {

  private static final String VIDEO_ID = "dQw4w9WgXcQ";

  @Mock private HighlightAgent highlightAgent;

  private HighlightServiceImpl service;

  @BeforeEach
  void setUp() {
    service = new HighlightServiceImpl(highlightAgent);
  }

  @Test
  @DisplayName("should return exactly five dash bullets")
  void shouldReturnFiveBullets_whenModelReturnsFive() {
    when(highlightAgent.extractTakeaways(anyString(), anyString()))
        .thenReturn("- One.\n- Two.\n- Three.\n- Four.\n- Five.");

    String highlights = service.generateHighlights(VIDEO_ID, "t", "transcript");

    assertThat(highlights.split("\n"))
        .containsExactly("- One.", "- Two.", "- Three.", "- Four.", "- Five.");
  }

  @Test
  @DisplayName("should normalize other bullet styles and drop surrounding prose")
  void shouldNormalizeBullets_whenModelUsesMixedStyles() {
    when(highlightAgent.extractTakeaways(anyString(), anyString()))
        .thenReturn(
            "Here are the takeaways:\n\n* One.\n• Two.\n1. Three.\n2) Four.\n+ Five.\n\nEnjoy!");

    String highlights = service.generateHighlights(VIDEO_ID, "t", "transcript");

    assertThat(highlights)
        .isEqualTo("- One.\n- Two.\n- Three.\n- Four.\n- Five.")
        .doesNotContain("Enjoy");
  }

  @Test
  @DisplayName("should keep only the first five bullets")
  void shouldTruncate_whenModelReturnsMoreThanFive() {
    when(highlightAgent.extractTakeaways(anyString(), anyString()))
        .thenReturn("- 1\n- 2\n- 3\n- 4\n- 5\n- 6\n- 7");

    assertThat(service.generateHighlights(VIDEO_ID, "t", "transcript"))
        .isEqualTo("- 1\n- 2\n- 3\n- 4\n- 5");
  }

  @Test
  @DisplayName("should fail when fewer than five bullets come back")
  void shouldThrowGenerationFailed_whenTooFewBullets() {
    when(highlightAgent.extractTakeaways(anyString(), anyString()))
        .thenReturn("- One.\n- Two.\n- Three.");

    assertThatThrownBy(() -> service.generateHighlights(VIDEO_ID, "t", "transcript"))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessageContaining("Expected 5 takeaways but the model returned 3");
  }

  @Test
  @DisplayName("should let model errors reach the circuit breaker unwrapped")
  void shouldPropagateModelError_whenCalledWithoutBreaker() {
    when(highlightAgent.extractTakeaways(anyString(), anyString()))
        .thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> service.generateHighlights(VIDEO_ID, "t", "transcript"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");
  }
}

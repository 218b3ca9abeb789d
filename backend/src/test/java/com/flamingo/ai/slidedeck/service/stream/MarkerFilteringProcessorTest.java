package com.flamingo.ai.slidedeck.service.stream;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

class MarkerFilteringProcessorTest {

  private MarkerFilteringProcessor processor;

  @BeforeEach
  void setUp() {
    processor = new MarkerFilteringProcessor(new PresentationConfig());
  }

  @Test
  @DisplayName("should emit only a terminal chunk for a short answer with a marker")
  void shouldEmitTerminalChunkForShortAnswer() {
    StepVerifier.create(processor.filter(Flux.just("Great![READY_", "FOR_DRAFT]")))
        .assertNext(
            chunk -> {
              assertThat(chunk.terminal()).isTrue();
              assertThat(chunk.fragment()).isEqualTo("Great!");
              assertThat(chunk.fullText()).isEqualTo("Great!");
              assertThat(chunk.markerSeen()).isTrue();
            })
        .verifyComplete();
  }

  @Test
  @DisplayName("should emit data chunks in order followed by the remainder")
  void shouldEmitDataThenRemainder() {
    List<String> fragments =
        List.of("What is the name of your project, ", "and who is the audience?");

    List<FilteredChunk> chunks =
        processor.filter(Flux.fromIterable(fragments)).collectList().block();

    assertThat(chunks).hasSize(3);
    assertThat(chunks.subList(0, 2)).noneMatch(FilteredChunk::terminal);
    FilteredChunk last = chunks.get(2);
    assertThat(last.terminal()).isTrue();
    assertThat(last.markerSeen()).isFalse();

    String joined = chunks.stream().map(FilteredChunk::fragment).reduce("", String::concat);
    assertThat(joined).isEqualTo(String.join("", fragments));
    assertThat(last.fullText()).isEqualTo(joined);
  }

  @Test
  @DisplayName("should propagate source errors without a terminal chunk")
  void shouldPropagateErrors() {
    Flux<String> source =
        Flux.concat(Flux.just("partial"), Flux.error(new IllegalStateException("boom")));

    StepVerifier.create(processor.filter(source))
        .expectError(IllegalStateException.class)
        .verify();
  }

  @Test
  @DisplayName("should keep separate state per subscription")
  void shouldIsolateSubscriptions() {
    Flux<FilteredChunk> filtered = processor.filter(Flux.just("ok[READY_FOR_DRAFT]"));

    assertThat(filtered.blockLast().fullText()).isEqualTo("ok");
    assertThat(filtered.blockLast().fullText()).isEqualTo("ok");
  }
}

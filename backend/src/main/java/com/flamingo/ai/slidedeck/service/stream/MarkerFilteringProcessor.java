package com.flamingo.ai.slidedeck.service.stream;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Applies a {@link MarkerFilter} to a reactive fragment stream.
 *
 * <p>Each input fragment yields at most one data chunk. After the source completes exactly one
 * terminal chunk follows, carrying the flushed remainder. If the source fails, the error is
 * propagated and no terminal chunk is emitted.
 */
@Component
@Slf4j
public class MarkerFilteringProcessor {

  private final String marker;

  public MarkerFilteringProcessor(PresentationConfig config) {
    this.marker = config.getConversation().getMarker();
  }

  public String getMarker() {
    return marker;
  }

  public Flux<FilteredChunk> filter(Flux<String> fragments) {
    return Flux.defer(
        () -> {
          MarkerFilter filter = new MarkerFilter(marker);
          return fragments
              .<FilteredChunk>handle(
                  (fragment, sink) -> {
                    String safe = filter.accept(fragment);
                    if (!safe.isEmpty()) {
                      sink.next(FilteredChunk.data(safe));
                    }
                  })
              .concatWith(
                  Mono.fromSupplier(
                      () -> {
                        String rest = filter.finish();
                        if (filter.isMarkerSeen()) {
                          log.debug("Control marker detected in model stream");
                        }
                        return FilteredChunk.terminal(
                            rest, filter.filteredText(), filter.isMarkerSeen());
                      }));
        });
  }
}

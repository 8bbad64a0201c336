package io.waypoint.core.navigation;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.waypoint.core.matcher.MatcherOptions;
import io.waypoint.core.matcher.MatcherRegistry;
import io.waypoint.core.model.NavigationTrigger;
import io.waypoint.core.model.RawLocation;
import io.waypoint.core.model.ResolvedLocation;
import io.waypoint.core.model.RouteDefinition;
import io.waypoint.core.testkit.RecordingHistory;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.KeyValuePair;

/**
 * Navigation outcomes produce one structured log entry each, with the generation and both locations as
 * key-value pairs.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger pipelineLogger;
    private HookRegistry hooks;
    private NavigationPipeline pipeline;

    @BeforeEach
    void setUp() {
        MatcherRegistry matcher = new MatcherRegistry(MatcherOptions.DEFAULT);
        matcher.addRoute(RouteDefinition.of("/docs/:page"));
        matcher.addRoute(RouteDefinition.builder("/old").redirect("/docs/intro").build());
        hooks = new HookRegistry();
        LocationResolver resolver = raw -> matcher.match(raw.path())
                .map(m -> ResolvedLocation.of(
                        raw.path(), m.params(), raw.query(), raw.hash(), m.matchedChain()))
                .orElseGet(() -> ResolvedLocation.unmatched(raw.path(), raw.query(), raw.hash()));
        pipeline = new NavigationPipeline(
                resolver, new RecordingHistory(), hooks, new CurrentLocation(), PipelineOptions.DEFAULT, null);

        pipelineLogger = (Logger) LoggerFactory.getLogger(NavigationPipeline.class);
        pipelineLogger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        pipelineLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        pipelineLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Confirmed navigation → navigation.confirmed with required fields")
    void confirmedNavigationLogsStructuredEntry() {
        pipeline.navigate(RawLocation.parse("/old"), NavigationTrigger.PUSH, null).join();

        ILoggingEvent event = single("navigation.confirmed");
        Map<String, Object> kv = keyValues(event);
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
        assertThat(kv)
                .containsEntry("to", "/docs/intro")
                .containsEntry("from", "/")
                .containsEntry("trigger", "PUSH")
                .containsEntry("redirect_hops", 1)
                .containsKeys("generation", "duration_ms");
        assertThat(kv.get("generation")).isEqualTo(pipeline.latestGeneration());
    }

    @Test
    @DisplayName("Aborted navigation → navigation.aborted with failure kind")
    void abortedNavigationLogsKind() {
        hooks.addBeforeEach(Guards.deny());

        pipeline.navigate(RawLocation.parse("/docs/a"), NavigationTrigger.PUSH, null).join();

        assertThat(keyValues(single("navigation.aborted")))
                .containsEntry("kind", "ABORTED")
                .containsEntry("to", "/docs/a");
        assertThat(messages()).doesNotContain("navigation.confirmed");
    }

    @Test
    @DisplayName("Failed navigation → navigation.failed at WARN with the exception attached")
    void failedNavigationLogsWarning() {
        pipeline.navigate(RawLocation.parse("/missing"), NavigationTrigger.PUSH, null)
                .exceptionally(e -> null)
                .join();

        ILoggingEvent event = single("navigation.failed");
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getThrowableProxy()).isNotNull();
        assertThat(keyValues(event)).containsEntry("error", "MatchNotFoundException");
    }

    private ILoggingEvent single(String message) {
        List<ILoggingEvent> matching = logAppender.list.stream()
                .filter(e -> message.equals(e.getMessage()))
                .collect(Collectors.toList());
        assertThat(matching).as("log events with message %s", message).hasSize(1);
        return matching.get(0);
    }

    private List<String> messages() {
        return logAppender.list.stream().map(ILoggingEvent::getMessage).collect(Collectors.toList());
    }

    private static Map<String, Object> keyValues(ILoggingEvent event) {
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        assertThat(pairs).isNotNull();
        return pairs.stream().collect(Collectors.toMap(p -> p.key, p -> p.value));
    }
}

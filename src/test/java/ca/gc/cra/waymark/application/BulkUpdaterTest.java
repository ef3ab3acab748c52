package ca.gc.cra.waymark.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.waymark.domain.Conditions;
import ca.gc.cra.waymark.domain.NamespaceNode;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.errors.PathConflictException;
import ca.gc.cra.waymark.domain.errors.UnknownSettingException;
import ca.gc.cra.waymark.domain.errors.ValidationException;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class BulkUpdaterTest {
  private NamespaceNode root;
  private BulkUpdater updater;
  private Setting<Integer> port;
  private Setting<String> host;
  private Setting<Integer> workers;

  @BeforeEach
  void setUp() {
    root = NamespaceNode.createRoot();
    port = Setting.of(8080, "Listen port", Conditions.within(0, 65536));
    host = Setting.of("localhost");
    workers = Setting.of(4, "Worker threads", Conditions.isPositive());
    root.bind("server.port", port);
    root.bind("server.host", host);
    root.bind("workers", workers);
    updater = new BulkUpdater(root);
  }

  @Test
  void dottedAndNestedKeysAreEquivalent() {
    int applied = updater.update(Map.of("server.port", 9000));
    applied += updater.update(Map.of("server", Map.of("host", "example.org")));

    assertEquals(2, applied);
    assertEquals(9000, port.value());
    assertEquals("example.org", host.value());
  }

  @Test
  void unknownPathFailsAndCreatesNothing() {
    UnknownSettingException ex =
        assertThrows(UnknownSettingException.class, () -> updater.update(Map.of("missing.path", 1)));

    assertEquals("missing.path", ex.path());
    assertFalse(root.contains("missing"));
  }

  @Test
  void unknownLeafInExistingNamespaceFails() {
    assertThrows(UnknownSettingException.class, () -> updater.update(Map.of("server", Map.of("timeout", 5))));
    assertEquals(List.of("host", "port"), root.namespace("server").entries().keySet().stream().sorted().toList());
  }

  @Test
  void valueAimedAtNamespaceIsAPathConflict() {
    assertThrows(PathConflictException.class, () -> updater.update(Map.of("server", 5)));
  }

  @Test
  void invalidKeyIsReportedAsUnknown() {
    assertThrows(UnknownSettingException.class, () -> updater.update(Map.of("bad key", 5)));
  }

  @Test
  void earlierEntriesStayAppliedWhenLaterEntryFails() {
    Map<String, Object> updates = new LinkedHashMap<>();
    updates.put("workers", 8);
    updates.put("server.port", -1);
    updates.put("server.host", "never-applied");

    assertThrows(ValidationException.class, () -> updater.update(updates));

    assertEquals(8, workers.value());
    assertEquals(8080, port.value());
    assertEquals("localhost", host.value());
  }

  @Test
  void decodedListsAreFrozenBeforeValidation() {
    Setting<List<String>> tags = Setting.of(List.of("a"));
    root.bind("tags", tags);

    updater.update(Map.of("tags", new ArrayList<>(List.of("b", "c"))));

    assertEquals(List.of("b", "c"), tags.value());
    assertThrows(UnsupportedOperationException.class, () -> tags.value().add("d"));
  }

  @Test
  void tryUpdateCollectsFailuresAndLogsWarnings() {
    Map<String, Object> updates = new LinkedHashMap<>();
    updates.put("workers", 0);
    updates.put("server.port", 9001);
    updates.put("nope", 1);

    Logger logger = (Logger) LoggerFactory.getLogger(BulkUpdater.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    UpdateReport report;
    try {
      report = updater.tryUpdate(updates);
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertFalse(report.isClean());
    assertEquals(List.of("server.port"), report.applied());
    assertEquals(List.of("workers", "nope"), List.copyOf(report.failures().keySet()));
    assertTrue(report.failures().get("workers") instanceof ValidationException);
    assertTrue(report.failures().get("nope") instanceof UnknownSettingException);
    Map<String, ?> failures = report.failures();
    assertThrows(UnsupportedOperationException.class, failures::clear);
    assertEquals(9001, port.value());
    assertEquals(4, workers.value());

    List<ILoggingEvent> warnings = appender.list.stream().filter(e -> e.getLevel() == Level.WARN).toList();
    assertEquals(2, warnings.size());
    assertTrue(warnings.get(0).getFormattedMessage().startsWith("Skipping update of workers"));
  }

  @Test
  void tryUpdateOnCleanInputReportsEverythingApplied() {
    UpdateReport report = updater.tryUpdate(Map.of("workers", 2));

    assertTrue(report.isClean());
    assertEquals(List.of("workers"), report.applied());
  }

  @Test
  void updaterRootedBelowTreeQualifiesPaths() {
    BulkUpdater scoped = new BulkUpdater(root.namespace("server"));

    UpdateReport report = scoped.tryUpdate(Map.of("port", 1234));

    assertEquals(List.of("server.port"), report.applied());
    assertEquals(1234, port.value());
  }
}

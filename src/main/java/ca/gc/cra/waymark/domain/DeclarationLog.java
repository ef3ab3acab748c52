package ca.gc.cra.waymark.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <strong>What:</strong> Process-wide side table from declaration site to the settings constructed there.
 * <p><strong>Role:</strong> Written once per {@link Setting} at construction time; read only by diagnostics such as
 * "which settings does this class declare". Never consulted when resolving values.</p>
 * <p>Settings are held weakly: once nothing else references a setting it drops out of the log.</p>
 * <p><strong>Thread-safety:</strong> Backed by concurrent and synchronized collections; safe for concurrent writers.</p>
 *
 * @since 0.1.0
 */
public final class DeclarationLog {
  private static final Map<DeclarationSite, Set<Setting<?>>> SITES = new ConcurrentHashMap<>();

  private DeclarationLog() {}

  static void record(DeclarationSite site, Setting<?> setting) {
    // Setting keeps identity equality, so the weak map behaves as an identity set.
    SITES.computeIfAbsent(site, ignored -> Collections.synchronizedSet(
        Collections.newSetFromMap(new WeakHashMap<>()))).add(setting);
  }

  /**
   * Returns the settings constructed at {@code site}.
   *
   * @param site declaration site
   * @return snapshot, possibly empty
   */
  public static List<Setting<?>> settingsAt(DeclarationSite site) {
    Set<Setting<?>> settings = SITES.get(site);
    if (settings == null) {
      return List.of();
    }
    synchronized (settings) {
      return List.copyOf(settings);
    }
  }

  /**
   * Returns every setting constructed by code in {@code className}, grouped by site.
   *
   * @param className fully-qualified class name
   * @return snapshot keyed by declaration site
   */
  public static Map<DeclarationSite, List<Setting<?>>> declaredBy(String className) {
    Map<DeclarationSite, List<Setting<?>>> result = new LinkedHashMap<>();
    SITES.forEach((site, settings) -> {
      if (site.className().equals(className)) {
        List<Setting<?>> live = settingsAt(site);
        if (!live.isEmpty()) {
          result.put(site, live);
        }
      }
    });
    return result;
  }

  /** Forgets every recorded declaration. */
  public static void clear() {
    SITES.clear();
  }
}

package enterprises.orbital.eveapi.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Holds one {@link IdentityCache} per entity kind, each created on first use.  The global instance is shared by
 * every entity created through the default context for the life of the process.  Tests create their own instance
 * to start from an empty cache.
 */
public class ModelCache {

  private static final ModelCache global = new ModelCache();

  private final Map<EntityKind, IdentityCache> modelMap = new EnumMap<>(EntityKind.class);

  public static ModelCache global() {
    return global;
  }

  public IdentityCache forKind(EntityKind kind) {
    synchronized (modelMap) {
      return modelMap.computeIfAbsent(kind, IdentityCache::new);
    }
  }

  public void clear() {
    synchronized (modelMap) {
      modelMap.clear();
    }
  }

}

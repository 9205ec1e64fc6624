package enterprises.orbital.eveapi.model;

/**
 * Kinds of cached entity.  Lookup table kinds are fetched and cached as a whole collection, the others one record
 * at a time.
 */
public enum EntityKind {
  CHARACTER(false),
  CORPORATION(false),
  ALLIANCE(true),
  SKILL(true),
  CERTIFICATE(true);

  private final boolean lookupTable;

  EntityKind(boolean lookupTable) {
    this.lookupTable = lookupTable;
  }

  public boolean isLookupTable() {
    return lookupTable;
  }
}

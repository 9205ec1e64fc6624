package enterprises.orbital.eveapi.model;

/**
 * Outcome of locating a remote record: its numeric id and the fields read for it.
 */
public class ResolvedRecord {
  private final long id;
  private final FieldSet fields;

  public ResolvedRecord(long id, FieldSet fields) {
    this.id = id;
    this.fields = fields;
  }

  public long getId() {
    return id;
  }

  public FieldSet getFields() {
    return fields;
  }
}

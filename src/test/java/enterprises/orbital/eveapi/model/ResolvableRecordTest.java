package enterprises.orbital.eveapi.model;

import org.easymock.EasyMock;
import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils;
import org.joda.time.DateTimeZone;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import enterprises.orbital.eveapi.TestBase;
import enterprises.orbital.eveapi.request.TransportException;

public class ResolvableRecordTest extends TestBase {

  private static final Field<Integer> RANK = Field.remote("rank");
  private static final Field<Integer> LEVEL = Field.local("level");

  RecordResolver mockResolver;
  ModelCache     modelCache;

  @Before
  public void setup() {
    mockResolver = EasyMock.createMock(RecordResolver.class);
    modelCache = new ModelCache();
  }

  @After
  public void teardown() {
    DateTimeUtils.setCurrentMillisSystem();
  }

  private ResolvableRecord newRecord(long id) {
    return new ResolvableRecord(EntityKind.SKILL, LookupKey.byId(id), modelCache, mockResolver);
  }

  private static ResolvedRecord remote(long id, String name, String description) {
    return new ResolvedRecord(id, new FieldSet().set(Fields.NAME, name).set(Fields.DESCRIPTION, description));
  }

  @Test
  public void testResolvesAtMostOnce() throws Exception {
    EasyMock.expect(mockResolver.resolve(EasyMock.anyObject(LookupKey.class), EasyMock.anyObject(IdentityCache.class)))
            .andReturn(remote(5L, "Gunnery", "Shoot things"));
    EasyMock.replay(mockResolver);
    ResolvableRecord record = newRecord(5L);
    Assert.assertFalse(record.isResolved());
    Assert.assertEquals("Gunnery", record.get(Fields.NAME));
    Assert.assertEquals("Shoot things", record.get(Fields.DESCRIPTION));
    // Absent after resolution, stays absent without another call
    Assert.assertNull(record.get(RANK));
    Assert.assertNull(record.get(RANK));
    Assert.assertTrue(record.isResolved());
    Assert.assertEquals(Long.valueOf(5L), record.getId());
    EasyMock.verify(mockResolver);
  }

  @Test
  public void testPresetAndLocalFieldsDoNotResolve() throws Exception {
    EasyMock.replay(mockResolver);
    ResolvableRecord record = newRecord(5L);
    record.preset(Fields.NAME, "Known").preset(LEVEL, 4);
    Assert.assertEquals("Known", record.get(Fields.NAME));
    Assert.assertEquals(Integer.valueOf(4), record.get(LEVEL));
    Assert.assertNull(record.get(Field.<Long> local("skillpoints")));
    Assert.assertNull(record.peek(RANK));
    Assert.assertEquals(Long.valueOf(5L), record.getId());
    Assert.assertFalse(record.isResolved());
    EasyMock.verify(mockResolver);
  }

  @Test
  public void testPresetValuesSurviveResolution() throws Exception {
    EasyMock.expect(mockResolver.resolve(EasyMock.anyObject(LookupKey.class), EasyMock.anyObject(IdentityCache.class)))
            .andReturn(remote(5L, "Remote", "From server"));
    EasyMock.replay(mockResolver);
    ResolvableRecord record = newRecord(5L);
    record.preset(Fields.NAME, "Local");
    Assert.assertEquals("From server", record.get(Fields.DESCRIPTION));
    Assert.assertEquals("Local", record.get(Fields.NAME));
    // The cache holds what the server said
    Assert.assertEquals("Remote", modelCache.forKind(EntityKind.SKILL).get(5L).get(Fields.NAME));
    EasyMock.verify(mockResolver);
  }

  @Test
  public void testFailureLeavesRecordUnresolved() throws Exception {
    EasyMock.expect(mockResolver.resolve(EasyMock.anyObject(LookupKey.class), EasyMock.anyObject(IdentityCache.class)))
            .andThrow(new TransportException("connection reset"))
            .andReturn(remote(5L, "Gunnery", "Shoot things"));
    EasyMock.replay(mockResolver);
    ResolvableRecord record = newRecord(5L);
    try {
      record.get(Fields.NAME);
      Assert.fail("Expected transport failure");
    } catch (TransportException e) {
      // expected
    }
    Assert.assertFalse(record.isResolved());
    Assert.assertFalse(modelCache.forKind(EntityKind.SKILL).has(5L));

    // Next read retries
    Assert.assertEquals("Gunnery", record.get(Fields.NAME));
    Assert.assertTrue(record.isResolved());
    Assert.assertTrue(modelCache.forKind(EntityKind.SKILL).has(5L));
    EasyMock.verify(mockResolver);
  }

  @Test
  public void testNameLookupLearnsId() throws Exception {
    EasyMock.expect(mockResolver.resolve(EasyMock.anyObject(LookupKey.class), EasyMock.anyObject(IdentityCache.class)))
            .andReturn(remote(42L, "Gunnery", "Shoot things"));
    EasyMock.replay(mockResolver);
    ResolvableRecord record = new ResolvableRecord(EntityKind.SKILL, LookupKey.byName(Fields.NAME, "gunnery"),
                                                   modelCache, mockResolver);
    Assert.assertEquals(Long.valueOf(42L), record.getId());
    Assert.assertEquals("Gunnery", record.get(Fields.NAME));
    Assert.assertEquals("Gunnery", modelCache.forKind(EntityKind.SKILL).get(42L).get(Fields.NAME));
    EasyMock.verify(mockResolver);
  }

  @Test
  public void testNoMatchIsNotAnError() throws Exception {
    EasyMock.expect(mockResolver.resolve(EasyMock.anyObject(LookupKey.class), EasyMock.anyObject(IdentityCache.class)))
            .andReturn(null);
    EasyMock.replay(mockResolver);
    ResolvableRecord record = new ResolvableRecord(EntityKind.SKILL, LookupKey.byName(Fields.NAME, "nothing"),
                                                   modelCache, mockResolver);
    Assert.assertNull(record.getId());
    Assert.assertNull(record.get(Fields.NAME));
    Assert.assertTrue(record.isResolved());
    Assert.assertEquals(0, modelCache.forKind(EntityKind.SKILL).size());
    EasyMock.verify(mockResolver);
  }

  @Test
  public void testPresetConflict() {
    ResolvableRecord record = newRecord(5L);
    record.preset(Fields.NAME, "First");
    try {
      record.preset(Fields.NAME, "Second");
      Assert.fail("Expected write-once violation");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testCachedUntil() throws Exception {
    DateTime cachedUntil = new DateTime(2020, 3, 1, 13, 0, 0, DateTimeZone.UTC);
    ResolvableRecord record = newRecord(5L);
    Assert.assertFalse(record.isCached());
    record.preset(Fields.CACHED_UNTIL, cachedUntil);
    DateTimeUtils.setCurrentMillisFixed(cachedUntil.minusMinutes(1).getMillis());
    Assert.assertTrue(record.isCached());
    DateTimeUtils.setCurrentMillisFixed(cachedUntil.plusMinutes(1).getMillis());
    Assert.assertFalse(record.isCached());
  }
}

package enterprises.orbital.eveapi.model;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import enterprises.orbital.eveapi.TestBase;

public class IdentityCacheTest extends TestBase {

  private static final Field<Integer> RANK = Field.remote("rank");

  @Test
  public void testMergeKeepsExistingFields() {
    IdentityCache cache = new IdentityCache(EntityKind.SKILL);
    cache.put(1L, new FieldSet().set(Fields.NAME, "X").set(RANK, 3));
    cache.put(1L, new FieldSet().set(Fields.NAME, "X"));
    FieldSet cached = cache.get(1L);
    Assert.assertEquals("X", cached.get(Fields.NAME));
    Assert.assertEquals(Integer.valueOf(3), cached.get(RANK));

    // Conflicting values never replace cached ones
    cache.put(1L, new FieldSet().set(Fields.NAME, "Y").set(Fields.DESCRIPTION, "new"));
    cached = cache.get(1L);
    Assert.assertEquals("X", cached.get(Fields.NAME));
    Assert.assertEquals("new", cached.get(Fields.DESCRIPTION));
  }

  @Test
  public void testGetReturnsCopy() {
    IdentityCache cache = new IdentityCache(EntityKind.CORPORATION);
    long id = getUniqueRandomLong();
    cache.put(id, new FieldSet().set(Fields.NAME, "Alpha"));
    cache.get(id).set(RANK, 1);
    Assert.assertFalse(cache.get(id).has(RANK));
    Assert.assertNull(cache.get(id + 1));
    Assert.assertTrue(cache.has(id));
  }

  @Test
  public void testNameLookupPrefersLowestId() {
    IdentityCache cache = new IdentityCache(EntityKind.SKILL);
    cache.put(30L, new FieldSet().set(Fields.NAME, "Duplicate"));
    cache.put(20L, new FieldSet().set(Fields.NAME, "Other"));
    cache.put(10L, new FieldSet().set(Fields.NAME, "duplicate"));
    Assert.assertEquals(Long.valueOf(10L), cache.findIdByName(Fields.NAME, "DUPLICATE"));
    Assert.assertEquals(Long.valueOf(20L), cache.findIdByName(Fields.NAME, "other"));
    Assert.assertNull(cache.findIdByName(Fields.NAME, "missing"));
    Assert.assertNull(cache.findIdByName(Fields.DESCRIPTION, "other"));
    Assert.assertEquals(Arrays.asList(10L, 20L, 30L), cache.ids());
  }

  @Test
  public void testCollectionLoaded() {
    IdentityCache cache = new IdentityCache(EntityKind.ALLIANCE);
    Assert.assertFalse(cache.isCollectionLoaded());
    Map<Long, FieldSet> collection = new HashMap<>();
    collection.put(1L, new FieldSet().set(Fields.NAME, "A"));
    collection.put(2L, new FieldSet().set(Fields.NAME, "B"));
    cache.putCollection(collection);
    Assert.assertTrue(cache.isCollectionLoaded());
    Assert.assertEquals(2, cache.size());
    cache.clear();
    Assert.assertFalse(cache.isCollectionLoaded());
    Assert.assertEquals(0, cache.size());
  }

  @Test
  public void testModelCachePerKind() {
    ModelCache models = new ModelCache();
    IdentityCache skills = models.forKind(EntityKind.SKILL);
    Assert.assertSame(skills, models.forKind(EntityKind.SKILL));
    Assert.assertNotSame(skills, models.forKind(EntityKind.CERTIFICATE));
    Assert.assertEquals(EntityKind.SKILL, skills.getKind());
    Assert.assertTrue(EntityKind.SKILL.isLookupTable());
    Assert.assertFalse(EntityKind.CHARACTER.isLookupTable());
    models.clear();
    Assert.assertNotSame(skills, models.forKind(EntityKind.SKILL));
  }
}

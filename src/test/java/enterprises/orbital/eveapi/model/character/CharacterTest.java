package enterprises.orbital.eveapi.model.character;

import java.util.List;

import org.easymock.EasyMock;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Assert;
import org.junit.Test;

import enterprises.orbital.eveapi.model.EntityKind;
import enterprises.orbital.eveapi.model.ModelTestBase;
import enterprises.orbital.eveapi.model.corporation.Corporation;
import enterprises.orbital.eveapi.model.eve.Certificate;
import enterprises.orbital.eveapi.model.eve.Skill;
import enterprises.orbital.eveapi.request.MissingCredentialException;
import enterprises.orbital.eveapi.request.RemoteApiException;
import enterprises.orbital.eveapi.request.TransportResponse;

public class CharacterTest extends ModelTestBase {

  private static final String INFO_100 = url(CharacterResolver.INFO_ENDPOINT, "characterID=100&" + KEY_QUERY);
  private static final String SHEET_100 = url(CharacterResolver.SHEET_ENDPOINT, "characterID=100&" + KEY_QUERY);

  @Test
  public void testCoveredCharacter() throws Exception {
    expectKeyInfo("apikeyinfo_account.xml");
    expectUrl(INFO_100, "characterinfo_100.xml");
    expectUrl(SHEET_100, "charactersheet_100.xml");
    replay();
    Character alice = new Character(context, credential, 100L);
    Assert.assertEquals("Alice Pilot", alice.getName());
    Assert.assertEquals("Caldari", alice.getRace());
    Assert.assertEquals("Deteis", alice.getBloodline());
    Assert.assertEquals("Merchandisers", alice.getAncestry());
    Assert.assertEquals("Female", alice.getGender());
    Assert.assertEquals(new DateTime(2019, 5, 2, 9, 58, 0, DateTimeZone.UTC), alice.getDateOfBirth());
    Assert.assertEquals(1500000.25, alice.getBalance(), 0.001);
    Assert.assertEquals(2.5, alice.getSecurityStatus(), 0.001);
    Assert.assertEquals(Long.valueOf(5000000L), alice.getSkillpoints());
    Assert.assertEquals(3, alice.getEmploymentHistory().size());

    Corporation employer = alice.getCorporation();
    Assert.assertEquals(500L, employer.getCorporationId());
    Assert.assertEquals("Alpha Corp", employer.getName());
    Assert.assertEquals("Test Alliance Please Ignore", alice.getAlliance().getName());
    Assert.assertTrue(alice.isCached());
    verify();
  }

  @Test
  public void testSkillsAndCertificates() throws Exception {
    expectKeyInfo("apikeyinfo_account.xml");
    expectUrl(INFO_100, "characterinfo_100.xml");
    expectUrl(SHEET_100, "charactersheet_100.xml");
    expectUrl(url("eve/SkillTree"), "skilltree.xml");
    replay();
    Character alice = new Character(context, credential, 100L);
    List<Skill> skills = alice.skills();
    Assert.assertEquals(2, skills.size());
    Skill gunnery = skills.get(0);
    Assert.assertEquals(Long.valueOf(3300L), gunnery.getSkillId());
    Assert.assertEquals(Integer.valueOf(5), gunnery.getLevel());
    Assert.assertEquals(Long.valueOf(256000L), gunnery.getSkillpoints());
    Assert.assertEquals("Gunnery", gunnery.getName());
    Assert.assertEquals(Integer.valueOf(3), skills.get(1).getLevel());
    Assert.assertEquals("Small Hybrid Turret", skills.get(1).getName());

    List<Certificate> certificates = alice.certificates();
    Assert.assertEquals(2, certificates.size());
    Assert.assertEquals(1L, certificates.get(0).getCertificateId());
    Assert.assertEquals(2L, certificates.get(1).getCertificateId());
    verify();
  }

  @Test
  public void testKeyForAnotherCharacter() throws Exception {
    // The corporation key only covers character 100
    expectKeyInfo("apikeyinfo_corporation.xml");
    expectUrl(url(CharacterResolver.INFO_ENDPOINT, "characterID=101"), "characterinfo_101.xml");
    replay();
    Character bob = new Character(context, credential, 101L);
    Assert.assertEquals("Bob Hauler", bob.getName());
    Assert.assertEquals(-1.25, bob.getSecurityStatus(), 0.001);
    Assert.assertNull(bob.getGender());
    Assert.assertNull(bob.getBalance());
    Assert.assertNull(bob.getAlliance());
    Assert.assertTrue(bob.skills().isEmpty());
    Assert.assertTrue(bob.certificates().isEmpty());
    verify();
  }

  @Test
  public void testAnonymousCharacter() throws Exception {
    expectUrl(url(CharacterResolver.INFO_ENDPOINT, "characterID=100"), "characterinfo_100.xml");
    replay();
    Character alice = new Character(context, null, 100L);
    Assert.assertEquals("Alice Pilot", alice.getName());
    Assert.assertNull(alice.getDateOfBirth());
    Assert.assertTrue(alice.skills().isEmpty());
    verify();
  }

  @Test
  public void testEmploymentHistoryCorporations() throws Exception {
    expectUrl(url(CharacterResolver.INFO_ENDPOINT, "characterID=100"), "characterinfo_100.xml");
    replay();
    List<Corporation> corporations = new Character(context, null, 100L).corporations();
    Assert.assertEquals(3, corporations.size());

    Assert.assertEquals(500L, corporations.get(0).getCorporationId());
    Assert.assertEquals("Alpha Corp", corporations.get(0).getName());
    Assert.assertNull(corporations.get(0).getEndDate());

    Assert.assertEquals(600L, corporations.get(1).getCorporationId());
    Assert.assertEquals(new DateTime(2020, 1, 10, 0, 0, 0, DateTimeZone.UTC), corporations.get(1).getStartDate());
    Assert.assertEquals(new DateTime(2021, 5, 31, 23, 59, 59, DateTimeZone.UTC), corporations.get(1).getEndDate());

    Assert.assertEquals(1000167L, corporations.get(2).getCorporationId());
    Assert.assertEquals("State War Academy", corporations.get(2).getName());
    Assert.assertEquals(new DateTime(2020, 1, 9, 23, 59, 59, DateTimeZone.UTC), corporations.get(2).getEndDate());
    verify();
  }

  @Test
  public void testListedCharacterNeedsNoCall() throws Exception {
    replay();
    Character bob = Character.listed(context, credential, 101L, "Bob Hauler", 600L, "Beta Industries");
    Assert.assertEquals("Bob Hauler", bob.getName());
    Assert.assertEquals("Beta Industries", bob.getCorporation().getName());
    Assert.assertFalse(bob.getRecord().isResolved());
    verify();
  }

  @Test
  public void testSkillQueue() throws Exception {
    expectUrl(url(Character.SKILL_QUEUE_ENDPOINT, "characterID=100&" + KEY_QUERY), "skillqueue_100.xml");
    replay();
    Character alice = Character.listed(context, credential, 100L, "Alice Pilot", 500L, "Alpha Corp");
    List<SkillQueueEntry> queue = alice.skillQueue();
    Assert.assertEquals(2, queue.size());
    Assert.assertEquals(0, queue.get(0).getPosition());
    Assert.assertEquals(4, queue.get(0).getLevel());
    Assert.assertEquals(8000L, queue.get(0).getStartSkillpoints());
    Assert.assertEquals(45255L, queue.get(0).getEndSkillpoints());
    Assert.assertEquals(new DateTime(2020, 3, 3, 0, 0, 0, DateTimeZone.UTC), queue.get(0).getEndTime());
    Assert.assertEquals(Long.valueOf(3301L), queue.get(0).getSkill().getSkillId());
    Assert.assertEquals(Integer.valueOf(4), queue.get(0).getSkill().getLevel());
    Assert.assertEquals(1, queue.get(1).getPosition());
    Assert.assertEquals(5, queue.get(1).getLevel());

    Assert.assertSame(queue, alice.skillQueue());
    verify();
  }

  @Test
  public void testSkillQueueRequiresKey() throws Exception {
    replay();
    try {
      new Character(context, null, 100L).skillQueue();
      Assert.fail("Expected missing credential");
    } catch (MissingCredentialException e) {
      // expected
    }
    verify();
  }

  @Test
  public void testFailedSheetLeavesNothingBehind() throws Exception {
    expectKeyInfo("apikeyinfo_account.xml");
    EasyMock.expect(mockTransport.get(INFO_100)).andReturn(okResponse("characterinfo_100.xml")).times(2);
    EasyMock.expect(mockTransport.get(SHEET_100))
            .andReturn(new TransportResponse(500, "Internal Server Error", ""))
            .andReturn(okResponse("charactersheet_100.xml"));
    replay();
    Character alice = new Character(context, credential, 100L);
    try {
      alice.getName();
      Assert.fail("Expected remote failure");
    } catch (RemoteApiException e) {
      Assert.assertEquals(500, e.getStatus());
    }
    Assert.assertFalse(alice.getRecord().isResolved());
    Assert.assertFalse(modelCache.forKind(EntityKind.CHARACTER).has(100L));

    Assert.assertEquals("Female", alice.getGender());
    Assert.assertTrue(modelCache.forKind(EntityKind.CHARACTER).has(100L));
    verify();
  }
}

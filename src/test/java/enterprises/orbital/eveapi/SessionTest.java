package enterprises.orbital.eveapi;

import java.util.List;

import org.joda.time.DateTimeUtils;
import org.junit.Assert;
import org.junit.Test;

import enterprises.orbital.eveapi.account.InvalidCredentialException;
import enterprises.orbital.eveapi.account.KeyType;
import enterprises.orbital.eveapi.model.ModelTestBase;
import enterprises.orbital.eveapi.model.character.Character;
import enterprises.orbital.eveapi.model.corporation.Corporation;

public class SessionTest extends ModelTestBase {

  @Test
  public void testRejectedKey() throws Exception {
    expectKeyInfo("error_authentication.xml");
    replay();
    try {
      EveApi.newSession(context, KEY_ID, V_CODE);
      Assert.fail("Expected invalid credential");
    } catch (InvalidCredentialException e) {
      Assert.assertEquals(KEY_ID, e.getKeyId());
    }
    verify();
  }

  @Test
  public void testCharacters() throws Exception {
    expectKeyInfo("apikeyinfo_account.xml");
    expectUrl(url(Session.CHARACTERS_ENDPOINT, KEY_QUERY), "characters.xml");
    replay();
    Session session = EveApi.newSession(context, KEY_ID, V_CODE);
    Assert.assertEquals(KeyType.ACCOUNT, session.getScope().getType());
    Assert.assertFalse(session.isCached());

    List<Character> characters = session.characters();
    Assert.assertEquals(2, characters.size());
    Character alice = characters.get(0);
    Assert.assertEquals(100L, alice.getCharacterId());
    Assert.assertEquals("Alice Pilot", alice.getName());
    Assert.assertEquals("Alpha Corp", alice.getCorporation().getName());
    Assert.assertEquals("Bob Hauler", characters.get(1).getName());
    Assert.assertSame(characters, session.characters());
    Assert.assertTrue(session.corporations().isEmpty());

    Assert.assertTrue(session.isCached());
    DateTimeUtils.setCurrentMillisFixed(FIXTURE_TIME.plusHours(2).getMillis());
    Assert.assertFalse(session.isCached());
    verify();
  }

  @Test
  public void testCorporationKeyCorporations() throws Exception {
    expectKeyInfo("apikeyinfo_corporation.xml");
    replay();
    Session session = new Session(context, credential);
    List<Corporation> corporations = session.corporations();
    Assert.assertEquals(1, corporations.size());
    Assert.assertEquals(500L, corporations.get(0).getCorporationId());
    Assert.assertFalse(corporations.get(0).getRecord().isResolved());
    verify();
  }
}

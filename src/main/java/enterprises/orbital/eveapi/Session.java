package enterprises.orbital.eveapi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import org.joda.time.DateTime;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.account.CredentialScope;
import enterprises.orbital.eveapi.model.ModelUtil;
import enterprises.orbital.eveapi.model.character.Character;
import enterprises.orbital.eveapi.model.corporation.Corporation;
import enterprises.orbital.eveapi.request.ApiDocument;
import enterprises.orbital.eveapi.request.ApiNode;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * Entry point for data reachable through one key.  The key is validated when the session is created.
 */
public class Session {
  private static final Logger log = Logger.getLogger(Session.class.getName());

  public static final String CHARACTERS_ENDPOINT = "account/Characters";

  private final ApiContext context;
  private final Credential credential;
  private final CredentialScope scope;
  private List<Character> characters;
  private DateTime cachedUntil;

  /**
   * Create a session, resolving the key's scope.
   *
   * @throws enterprises.orbital.eveapi.account.InvalidCredentialException if the key is not recognized.
   * @throws EveApiException                                              on any other call failure.
   */
  public Session(ApiContext context, Credential credential) throws EveApiException {
    this.context = context;
    this.credential = credential;
    this.scope = credential.scope();
  }

  public ApiContext getContext() {
    return context;
  }

  public Credential getCredential() {
    return credential;
  }

  public CredentialScope getScope() {
    return scope;
  }

  /**
   * Characters accessible with this key.  Listed once per session, each character carries its name and employer
   * from the listing.
   */
  public synchronized List<Character> characters() throws EveApiException {
    if (characters != null) return characters;
    ApiDocument xml = context.getDispatcher().call(CHARACTERS_ENDPOINT, null, credential);
    List<Character> chars = new ArrayList<>();
    for (ApiNode row : xml.allNodes("//result/rowset[@name='characters']/row")) {
      Long characterId = ModelUtil.parseLong(row.attribute("characterID"));
      if (characterId == null) continue;
      chars.add(Character.listed(context, credential, characterId, ModelUtil.emptyToNull(row.attribute("name")),
                                 ModelUtil.parseLong(row.attribute("corporationID")),
                                 ModelUtil.emptyToNull(row.attribute("corporationName"))));
    }
    cachedUntil = xml.cachedUntil();
    characters = Collections.unmodifiableList(chars);
    log.fine("Listed " + characters.size() + " characters for " + credential);
    return characters;
  }

  /**
   * Corporations this key may read.  Only corporation keys cover corporations.  This is not a character's
   * employment history, see {@link Character#corporations()} for that.
   */
  public List<Corporation> corporations() {
    List<Long> ids = scope.getCorporationIds();
    if (ids == null) return Collections.emptyList();
    List<Corporation> result = new ArrayList<>(ids.size());
    for (Long next : ids) {
      result.add(new Corporation(context, credential, next));
    }
    return result;
  }

  /**
   * True while the character listing is within its server cache time.  False if the listing has not been
   * retrieved.
   */
  public synchronized boolean isCached() {
    return cachedUntil != null && !ModelUtil.isExpired(cachedUntil);
  }
}

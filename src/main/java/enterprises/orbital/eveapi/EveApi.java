package enterprises.orbital.eveapi;

import enterprises.orbital.eveapi.request.EveApiException;

/**
 * Convenience entry points.
 *
 * <pre>
 * Session session = EveApi.newSession(keyId, vCode);
 * for (Character pilot : session.characters()) {
 *   for (Corporation corp : pilot.corporations()) {
 *     ...
 *   }
 * }
 * </pre>
 */
public final class EveApi {

  private EveApi() {}

  public static Session newSession(long keyId, String verificationCode) throws EveApiException {
    return newSession(ApiContext.getDefault(), keyId, verificationCode);
  }

  public static Session newSession(ApiContext context, long keyId, String verificationCode)
    throws EveApiException {
    return new Session(context, context.credential(keyId, verificationCode));
  }
}

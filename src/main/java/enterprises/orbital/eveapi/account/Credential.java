package enterprises.orbital.eveapi.account;

import java.util.Objects;

import enterprises.orbital.eveapi.request.EveApiException;

/**
 * An API key: key ID plus verification code.  The key's scope is resolved on first use through the supplied
 * resolver, which shares results between all credentials with the same pair.
 */
public class Credential {
  private final long keyId;
  private final String verificationCode;
  private final CredentialResolver resolver;

  public Credential(
                    long keyId,
                    String verificationCode,
                    CredentialResolver resolver) {
    this.keyId = keyId;
    this.verificationCode = Objects.requireNonNull(verificationCode, "verificationCode");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public long getKeyId() {
    return keyId;
  }

  public String getVerificationCode() {
    return verificationCode;
  }

  /**
   * Retrieve the scope of this key, calling the remote API the first time any credential with this pair is
   * resolved.
   *
   * @return the key's scope.
   * @throws InvalidCredentialException if the server does not recognize the key.
   * @throws EveApiException            on any other call failure.
   */
  public CredentialScope scope() throws EveApiException {
    return resolver.resolve(this);
  }

  public boolean isValidForCharacter(long characterId) throws EveApiException {
    return scope().isValidForCharacter(characterId);
  }

  public boolean isValidForCorporation(long corporationId) throws EveApiException {
    return scope().isValidForCorporation(corporationId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyId, verificationCode);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    Credential other = (Credential) obj;
    return keyId == other.keyId && verificationCode.equals(other.verificationCode);
  }

  @Override
  public String toString() {
    return "Credential [keyId=" + keyId + "]";
  }
}

package enterprises.orbital.eveapi.model.eve;

import enterprises.orbital.eveapi.ApiContext;
import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.EntityKind;
import enterprises.orbital.eveapi.model.Field;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.LookupKey;
import enterprises.orbital.eveapi.model.ResolvableRecord;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * A certificate from the certificate tree.  Like skills, the tree is loaded once and shared.
 */
public class Certificate {
  public static final Field<Integer> GRADE = Field.remote("grade");
  public static final Field<Long> CATEGORY_ID = Field.remote("categoryID");
  public static final Field<String> CATEGORY_NAME = Field.remote("categoryName");
  public static final Field<Long> CLASS_ID = Field.remote("classID");
  public static final Field<String> CLASS_NAME = Field.remote("className");

  private final long certificateId;
  private final ResolvableRecord record;

  public Certificate(
                     ApiContext context,
                     Credential credential,
                     long certificateId) {
    this.certificateId = certificateId;
    this.record = new ResolvableRecord(EntityKind.CERTIFICATE, LookupKey.byId(certificateId),
                                       context.getModelCache(),
                                       new CertificateTreeResolver(context.getDispatcher(), credential));
  }

  public long getCertificateId() {
    return certificateId;
  }

  public String getDescription() throws EveApiException {
    return record.get(Fields.DESCRIPTION);
  }

  public Integer getGrade() throws EveApiException {
    return record.get(GRADE);
  }

  public Long getCategoryId() throws EveApiException {
    return record.get(CATEGORY_ID);
  }

  public String getCategoryName() throws EveApiException {
    return record.get(CATEGORY_NAME);
  }

  public Long getClassId() throws EveApiException {
    return record.get(CLASS_ID);
  }

  public String getClassName() throws EveApiException {
    return record.get(CLASS_NAME);
  }

  public boolean isCached() {
    return record.isCached();
  }

  public ResolvableRecord getRecord() {
    return record;
  }

  @Override
  public String toString() {
    return "Certificate [certificateId=" + certificateId + "]";
  }
}

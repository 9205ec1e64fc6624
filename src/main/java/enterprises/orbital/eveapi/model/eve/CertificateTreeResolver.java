package enterprises.orbital.eveapi.model.eve;

import java.util.HashMap;
import java.util.Map;

import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.AbstractRefResolver;
import enterprises.orbital.eveapi.model.FieldSet;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.ModelUtil;
import enterprises.orbital.eveapi.request.ApiDocument;
import enterprises.orbital.eveapi.request.ApiNode;
import enterprises.orbital.eveapi.request.EndpointDispatcher;

/**
 * Reads the certificate tree: categories contain classes, classes contain certificates.  Every certificate record
 * carries the id and name of its enclosing category and class.
 */
public class CertificateTreeResolver extends AbstractRefResolver {

  public static final String ENDPOINT = "eve/CertificateTree";

  public CertificateTreeResolver(EndpointDispatcher dispatcher, Credential credential) {
    super(dispatcher, credential);
  }

  @Override
  protected String endpoint() {
    return ENDPOINT;
  }

  @Override
  protected Map<Long, FieldSet> processServerData(ApiDocument xml) {
    Map<Long, FieldSet> certificates = new HashMap<>();
    for (ApiNode category : xml.allNodes("//result/rowset[@name='categories']/row")) {
      Long categoryId = ModelUtil.parseLong(category.attribute("categoryID"));
      String categoryName = category.attribute("categoryName");
      for (ApiNode certClass : category.allNodes("rowset[@name='classes']/row")) {
        Long classId = ModelUtil.parseLong(certClass.attribute("classID"));
        String className = certClass.attribute("className");
        for (ApiNode cert : certClass.allNodes("rowset[@name='certificates']/row")) {
          Long certificateId = ModelUtil.parseLong(cert.attribute("certificateID"));
          if (certificateId == null) continue;
          FieldSet next = new FieldSet();
          next.set(Fields.DESCRIPTION, cert.attribute("description"));
          next.set(Certificate.GRADE, ModelUtil.parseInteger(cert.attribute("grade")));
          next.set(Certificate.CATEGORY_ID, categoryId);
          next.set(Certificate.CATEGORY_NAME, categoryName);
          next.set(Certificate.CLASS_ID, classId);
          next.set(Certificate.CLASS_NAME, className);
          certificates.put(certificateId, next);
        }
      }
    }
    return certificates;
  }
}

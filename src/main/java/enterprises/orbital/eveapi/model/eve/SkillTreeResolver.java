package enterprises.orbital.eveapi.model.eve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
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
 * Reads the skill tree.  Skills are nested inside their skill groups, each skill row carries its description and
 * rank as child elements and its prerequisites as a nested rowset.
 */
public class SkillTreeResolver extends AbstractRefResolver {

  public static final String ENDPOINT = "eve/SkillTree";

  public SkillTreeResolver(EndpointDispatcher dispatcher, Credential credential) {
    super(dispatcher, credential);
  }

  @Override
  protected String endpoint() {
    return ENDPOINT;
  }

  @Override
  protected Map<Long, FieldSet> processServerData(ApiDocument xml) {
    Map<Long, FieldSet> skills = new HashMap<>();
    for (ApiNode group : xml.allNodes("//result/rowset[@name='skillGroups']/row")) {
      Long groupId = ModelUtil.parseLong(group.attribute("groupID"));
      String groupName = group.attribute("groupName");
      for (ApiNode skill : group.allNodes("rowset[@name='skills']/row")) {
        Long skillId = ModelUtil.parseLong(skill.attribute("typeID"));
        if (skillId == null) continue;
        FieldSet next = new FieldSet();
        next.set(Fields.NAME, skill.attribute("typeName"));
        next.set(Fields.DESCRIPTION, skill.firstValue("description[1]"));
        next.set(Skill.RANK, ModelUtil.parseInteger(skill.firstValue("rank[1]")));
        next.set(Skill.PUBLISHED, ModelUtil.parseBoolean(skill.attribute("published")));
        // Groups sometimes list skills which declare another group, prefer the skill's own
        Long declaredGroup = ModelUtil.parseLong(skill.attribute("groupID"));
        next.set(Skill.GROUP_ID, declaredGroup != null ? declaredGroup : groupId);
        next.set(Skill.GROUP_NAME, groupName);
        List<RequiredSkill> required = new ArrayList<>();
        for (ApiNode req : skill.allNodes("rowset[@name='requiredSkills']/row")) {
          Long reqId = ModelUtil.parseLong(req.attribute("typeID"));
          Integer reqLevel = ModelUtil.parseInteger(req.attribute("skillLevel"));
          if (reqId != null) required.add(new RequiredSkill(reqId, reqLevel == null ? 0 : reqLevel));
        }
        next.set(Skill.REQUIRED_SKILLS, Collections.unmodifiableList(required));
        skills.put(skillId, next);
      }
    }
    return skills;
  }
}

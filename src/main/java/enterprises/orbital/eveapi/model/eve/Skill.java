package enterprises.orbital.eveapi.model.eve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import enterprises.orbital.eveapi.ApiContext;
import enterprises.orbital.eveapi.account.Credential;
import enterprises.orbital.eveapi.model.EntityKind;
import enterprises.orbital.eveapi.model.Field;
import enterprises.orbital.eveapi.model.Fields;
import enterprises.orbital.eveapi.model.LookupKey;
import enterprises.orbital.eveapi.model.ResolvableRecord;
import enterprises.orbital.eveapi.request.EveApiException;

/**
 * A skill from the skill tree.  The first skill attribute read anywhere in the process loads the whole tree, which
 * then serves every other skill.
 * <p>
 * Skills obtained from a character also carry the character's trained level and skill points.  Skills obtained as
 * prerequisites carry the required level.
 */
public class Skill {
  public static final Field<Long> GROUP_ID = Field.remote("groupID");
  public static final Field<String> GROUP_NAME = Field.remote("groupName");
  public static final Field<Integer> RANK = Field.remote("rank");
  public static final Field<Boolean> PUBLISHED = Field.remote("published");
  public static final Field<List<RequiredSkill>> REQUIRED_SKILLS = Field.remote("requiredSkills");

  // Only known for skills listed by a character or as a prerequisite
  public static final Field<Integer> LEVEL = Field.local("level");
  public static final Field<Long> SKILLPOINTS = Field.local("skillpoints");

  private final ApiContext context;
  private final Credential credential;
  private final ResolvableRecord record;

  public Skill(
               ApiContext context,
               Credential credential,
               long skillId) {
    this(context, credential, LookupKey.byId(skillId));
  }

  private Skill(
                ApiContext context,
                Credential credential,
                LookupKey key) {
    this.context = context;
    this.credential = credential;
    this.record = new ResolvableRecord(EntityKind.SKILL, key, context.getModelCache(),
                                       new SkillTreeResolver(context.getDispatcher(), credential));
  }

  public static Skill byName(
                             ApiContext context,
                             Credential credential,
                             String name) {
    return new Skill(context, credential, LookupKey.byName(Fields.NAME, name));
  }

  /**
   * Create a skill annotated with a trained level and skill points.
   */
  public static Skill trained(ApiContext context, Credential credential, long skillId, Integer level,
                              Long skillpoints) {
    Skill result = new Skill(context, credential, skillId);
    result.record.preset(LEVEL, level);
    result.record.preset(SKILLPOINTS, skillpoints);
    return result;
  }

  public Long getSkillId() throws EveApiException {
    return record.getId();
  }

  public String getName() throws EveApiException {
    return record.get(Fields.NAME);
  }

  public String getDescription() throws EveApiException {
    return record.get(Fields.DESCRIPTION);
  }

  public Long getGroupId() throws EveApiException {
    return record.get(GROUP_ID);
  }

  public String getGroupName() throws EveApiException {
    return record.get(GROUP_NAME);
  }

  public Integer getRank() throws EveApiException {
    return record.get(RANK);
  }

  public Boolean isPublished() throws EveApiException {
    return record.get(PUBLISHED);
  }

  public Integer getLevel() {
    return record.peek(LEVEL);
  }

  public Long getSkillpoints() {
    return record.peek(SKILLPOINTS);
  }

  /**
   * @return prerequisites of this skill, each annotated with the required level.
   */
  public List<Skill> getRequiredSkills() throws EveApiException {
    List<RequiredSkill> required = record.get(REQUIRED_SKILLS);
    if (required == null) return Collections.emptyList();
    List<Skill> result = new ArrayList<>(required.size());
    for (RequiredSkill next : required) {
      result.add(trained(context, credential, next.getSkillId(), next.getLevel(), null));
    }
    return result;
  }

  public boolean isCached() {
    return record.isCached();
  }

  public ResolvableRecord getRecord() {
    return record;
  }

  @Override
  public String toString() {
    return "Skill [" + record.getKey() + "]";
  }
}

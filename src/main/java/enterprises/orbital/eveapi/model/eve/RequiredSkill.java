package enterprises.orbital.eveapi.model.eve;

import java.util.Objects;

/**
 * Prerequisite of a skill: another skill trained to a minimum level.
 */
public final class RequiredSkill {
  private final long skillId;
  private final int level;

  public RequiredSkill(long skillId, int level) {
    this.skillId = skillId;
    this.level = level;
  }

  public long getSkillId() {
    return skillId;
  }

  public int getLevel() {
    return level;
  }

  @Override
  public int hashCode() {
    return Objects.hash(skillId, level);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    RequiredSkill other = (RequiredSkill) obj;
    return skillId == other.skillId && level == other.level;
  }

  @Override
  public String toString() {
    return "RequiredSkill [skillId=" + skillId + ", level=" + level + "]";
  }
}

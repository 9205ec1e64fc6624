package enterprises.orbital.eveapi.model.character;

import java.util.Objects;

/**
 * A skill row from a character sheet.
 */
public final class CharacterSkill {
  private final long typeId;
  private final long skillpoints;
  private final int level;

  public CharacterSkill(
                        long typeId,
                        long skillpoints,
                        int level) {
    this.typeId = typeId;
    this.skillpoints = skillpoints;
    this.level = level;
  }

  public long getTypeId() {
    return typeId;
  }

  public long getSkillpoints() {
    return skillpoints;
  }

  public int getLevel() {
    return level;
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeId, skillpoints, level);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    CharacterSkill other = (CharacterSkill) obj;
    return typeId == other.typeId && skillpoints == other.skillpoints && level == other.level;
  }

  @Override
  public String toString() {
    return "CharacterSkill [typeId=" + typeId + ", skillpoints=" + skillpoints + ", level=" + level + "]";
  }
}

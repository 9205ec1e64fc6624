package enterprises.orbital.eveapi.model.character;

import org.joda.time.DateTime;

import enterprises.orbital.eveapi.model.eve.Skill;

/**
 * A queued skill.  Start and end times are absent while training is paused.
 */
public class SkillQueueEntry {
  private final int position;
  private final Skill skill;
  private final int level;
  private final long startSkillpoints;
  private final long endSkillpoints;
  private final DateTime startTime;
  private final DateTime endTime;

  public SkillQueueEntry(int position, Skill skill, int level, long startSkillpoints, long endSkillpoints,
                         DateTime startTime, DateTime endTime) {
    this.position = position;
    this.skill = skill;
    this.level = level;
    this.startSkillpoints = startSkillpoints;
    this.endSkillpoints = endSkillpoints;
    this.startTime = startTime;
    this.endTime = endTime;
  }

  public int getPosition() {
    return position;
  }

  public Skill getSkill() {
    return skill;
  }

  public int getLevel() {
    return level;
  }

  public long getStartSkillpoints() {
    return startSkillpoints;
  }

  public long getEndSkillpoints() {
    return endSkillpoints;
  }

  public DateTime getStartTime() {
    return startTime;
  }

  public DateTime getEndTime() {
    return endTime;
  }

  @Override
  public String toString() {
    return "SkillQueueEntry [position=" + position + ", skill=" + skill + ", level=" + level + "]";
  }
}

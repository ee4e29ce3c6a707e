package dev.workflowcron.scheduler.schedule;

import java.util.List;

public record ScheduleStats(int total, int enabled, int disabled) {

  public static ScheduleStats of(List<ScheduleRecord> schedules) {
    int enabled = (int) schedules.stream().filter(ScheduleRecord::enabled).count();
    return new ScheduleStats(schedules.size(), enabled, schedules.size() - enabled);
  }
}

package io.github.hotbrkm.outreach.dispatcher.schedule;

import java.util.List;

public record SchedulerStatistics(boolean running, List<String> tasks, boolean windowOpen, boolean sendingSuspended,
                                  int sentToday, int dailyLimit, int remainingToday, int campaignsInFlight) {

    public SchedulerStatistics {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public boolean limitReached() {
        return remainingToday <= 0;
    }
}

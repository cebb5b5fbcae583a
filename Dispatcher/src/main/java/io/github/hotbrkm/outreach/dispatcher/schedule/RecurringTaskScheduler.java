package io.github.hotbrkm.outreach.dispatcher.schedule;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers {@link RecurringTask}s on a Spring {@link TaskScheduler} at a fixed interval.
 */
@Slf4j
public class RecurringTaskScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Map<String, RecurringTask> tasks = new ConcurrentHashMap<>();

    public RecurringTaskScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RecurringTask scheduleEvery(String name, Duration interval, Runnable action) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(action, "action must not be null");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive for task " + name);
        }
        RecurringTask task = new RecurringTask(name, interval, action);
        if (tasks.putIfAbsent(name, task) != null) {
            throw new IllegalStateException("Task already registered: " + name);
        }
        task.attach(taskScheduler.scheduleAtFixedRate(task::runNow, clock.instant().plus(interval), interval));
        log.info("task={}, event=task_registered, interval={}", name, interval);
        return task;
    }

    /**
     * Runs the action once, as soon as a scheduler thread is free.
     */
    public void runOnce(String name, Runnable action) {
        taskScheduler.schedule(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("task={}, event=one_shot_failed", name, e);
            }
        }, clock.instant());
    }

    public RecurringTask task(String name) {
        return tasks.get(name);
    }

    public List<String> taskNames() {
        List<String> names = new ArrayList<>(tasks.keySet());
        names.sort(null);
        return names;
    }

    public void cancelAll() {
        tasks.values().forEach(RecurringTask::cancel);
        tasks.clear();
    }
}

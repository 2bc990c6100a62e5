package com.platform.fleetsync.schedule;

import com.platform.fleetsync.drift.BulkDriftResult;
import com.platform.fleetsync.drift.DriftDetectionService;
import com.platform.fleetsync.error.DuplicateResourceException;
import com.platform.fleetsync.error.ResourceNotFoundException;
import com.platform.fleetsync.error.ValidationException;
import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.RootCallContext;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drift schedule CRUD and execution.
 * 
 * Runs happen:
 * 1. On every scheduler tick, for enabled schedules that are due
 * 2. On demand through {@link #runNow(Long)}
 * 
 * Each run stores a {@link DriftScheduleRun} and advances the schedule's
 * next run, whether the run completed or failed. A running schedule owns one
 * call context; {@link #cancelRun(Long)} cancels every device call it has left.
 */
@Slf4j
@Service
public class DriftScheduleService {
    
    static final String MDC_SCHEDULE_ID = "scheduleId";
    static final String MDC_RUN_ID = "runId";
    
    private final DriftScheduleRepository repository;
    private final DriftDetectionService detectionService;
    private final DriftSchedulerProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final RootCallContext rootContext;
    
    private final Map<Long, CallContext> activeRuns = new ConcurrentHashMap<>();
    private final AtomicLong runCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);
    
    public DriftScheduleService(
            DriftScheduleRepository repository,
            DriftDetectionService detectionService,
            DriftSchedulerProperties properties,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            RootCallContext rootContext) {
        this.repository = repository;
        this.detectionService = detectionService;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.rootContext = rootContext;
    }
    
    @PostConstruct
    public void init() {
        MeterRegistry meterRegistry = metricsRegistry.getMeterRegistry();
        Gauge.builder("fleetsync.drift.scheduler.runs", runCount, AtomicLong::get)
            .description("Drift schedule runs since startup")
            .register(meterRegistry);
        
        Gauge.builder("fleetsync.drift.scheduler.failures", failureCount, AtomicLong::get)
            .description("Drift schedule runs that failed")
            .register(meterRegistry);
        
        log.info("Drift scheduler initialized (enabled={}, tick={}ms)", properties.isEnabled(), properties.getTickMs());
    }
    
    // ==================== CRUD ====================
    
    public List<DriftSchedule> list() {
        return repository.findAll();
    }
    
    public DriftSchedule get(Long id) {
        return repository.findById(id)
            .orElseThrow(() -> ResourceNotFoundException.schedule(id));
    }
    
    public DriftSchedule create(DriftSchedule schedule) {
        validate(schedule);
        if (repository.existsByName(schedule.getName())) {
            throw new DuplicateResourceException("DriftSchedule", schedule.getName());
        }
        
        DriftSchedule toSave = schedule.toBuilder()
            .id(null)
            .deviceIds(distinct(schedule.getDeviceIds()))
            .lastRun(null)
            .nextRun(schedule.isEnabled() ? Instant.now().plusSeconds(schedule.getIntervalSeconds()) : null)
            .runCount(0)
            .version(null)
            .build();
        DriftSchedule saved = repository.save(toSave);
        log.info("Drift schedule created: {} ({}), every {}s over {}",
            saved.getName(), saved.getId(), saved.getIntervalSeconds(), describeSelection(saved));
        return saved;
    }
    
    public DriftSchedule update(Long id, DriftSchedule changes) {
        DriftSchedule existing = get(id);
        validate(changes);
        if (!existing.getName().equals(changes.getName()) && repository.existsByName(changes.getName())) {
            throw new DuplicateResourceException("DriftSchedule", changes.getName());
        }
        
        DriftSchedule updated = existing.toBuilder()
            .name(changes.getName())
            .description(changes.getDescription())
            .enabled(changes.isEnabled())
            .intervalSeconds(changes.getIntervalSeconds())
            .deviceIds(distinct(changes.getDeviceIds()))
            .build();
        updated.setNextRun(nextRunAfter(updated, existing.getLastRun() != null ? existing.getLastRun() : Instant.now()));
        DriftSchedule saved = repository.save(updated);
        log.info("Drift schedule updated: {} ({})", saved.getName(), id);
        return saved;
    }
    
    public void delete(Long id) {
        if (!repository.deleteById(id)) {
            throw ResourceNotFoundException.schedule(id);
        }
        log.info("Drift schedule deleted: {}", id);
    }
    
    /**
     * Flip the enabled flag. Enabling schedules the next run one interval from now.
     */
    public DriftSchedule toggle(Long id) {
        DriftSchedule schedule = get(id);
        schedule.setEnabled(!schedule.isEnabled());
        schedule.setNextRun(nextRunAfter(schedule, Instant.now()));
        DriftSchedule saved = repository.save(schedule);
        log.info("Drift schedule {} {}", id, saved.isEnabled() ? "enabled" : "disabled");
        return saved;
    }
    
    public List<DriftScheduleRun> getRuns(Long id, Integer limit) {
        get(id);
        int effective = limit == null || limit <= 0 ? properties.getHistoryLimit() : limit;
        return repository.findRuns(id, effective);
    }
    
    // ==================== Execution ====================
    
    @Scheduled(fixedDelayString = "${fleetsync.drift.scheduler.tick-ms:30000}")
    public void tick() {
        if (!properties.isEnabled()) {
            return;
        }
        
        List<DriftSchedule> due = repository.findDue(Instant.now());
        if (due.isEmpty()) {
            return;
        }
        log.debug("{} drift schedule(s) due", due.size());
        
        for (DriftSchedule schedule : due) {
            try {
                run(schedule);
            } catch (RuntimeException e) {
                failureCount.incrementAndGet();
                metricsRegistry.incrementCounter("fleetsync.drift.scheduler.error");
                log.error("Drift schedule {} could not be run: {}", schedule.getId(), e.getMessage(), e);
            }
        }
    }
    
    public DriftScheduleRun runNow(Long id) {
        return run(get(id));
    }
    
    /**
     * Cancel the schedule's run in progress.
     *
     * @return false when the schedule is not running
     */
    public boolean cancelRun(Long id) {
        get(id);
        CallContext runContext = activeRuns.get(id);
        if (runContext == null) {
            return false;
        }
        runContext.cancel();
        log.info("[AUDIT] Drift schedule {} run cancelled", id);
        return true;
    }
    
    DriftScheduleRun run(DriftSchedule schedule) {
        MDC.put(MDC_SCHEDULE_ID, String.valueOf(schedule.getId()));
        Instant startedAt = Instant.now();
        DriftScheduleRun run = repository.saveRun(DriftScheduleRun.builder()
            .scheduleId(schedule.getId())
            .status(DriftScheduleRun.RUNNING)
            .startedAt(startedAt)
            .build());
        MDC.put(MDC_RUN_ID, String.valueOf(run.getId()));
        CallContext runContext = rootContext.get().child();
        activeRuns.put(schedule.getId(), runContext);
        
        try {
            log.info("Running drift schedule '{}' over {}", schedule.getName(), describeSelection(schedule));
            try {
                BulkDriftResult result = detectionService.detectBulk(schedule.getDeviceIds(), runContext);
                run.setStatus(DriftScheduleRun.COMPLETED);
                run.setTotalDevices(result.getTotal());
                run.setInSync(result.getInSync());
                run.setDrifted(result.getDrifted());
                run.setErrors(result.getErrors());
                run.setResult(result);
            } catch (RuntimeException e) {
                failureCount.incrementAndGet();
                run.setStatus(DriftScheduleRun.FAILED);
                run.setErrorMessage(e.getMessage());
                log.error("Drift schedule {} run {} failed: {}", schedule.getId(), run.getId(), e.getMessage(), e);
            }
            
            Instant completedAt = Instant.now();
            long durationMs = Duration.between(startedAt, completedAt).toMillis();
            run.setCompletedAt(completedAt);
            run.setDurationMs(durationMs);
            DriftScheduleRun saved = repository.saveRun(run);
            
            advance(schedule.getId(), startedAt);
            runCount.incrementAndGet();
            metricsRegistry.incrementCounter("fleetsync.drift.scheduler.run", "status", saved.getStatus());
            structuredLogger.drift().scheduleRun(schedule.getId(), saved.getStatus(), durationMs);
            log.info("[AUDIT] Drift schedule '{}' run {}: status={}, total={}, in_sync={}, drifted={}, errors={}, duration={}ms",
                schedule.getName(), saved.getId(), saved.getStatus(), saved.getTotalDevices(),
                saved.getInSync(), saved.getDrifted(), saved.getErrors(), durationMs);
            return saved;
        } finally {
            activeRuns.remove(schedule.getId(), runContext);
            runContext.close();
            MDC.remove(MDC_RUN_ID);
            MDC.remove(MDC_SCHEDULE_ID);
        }
    }
    
    /**
     * Record the run on the schedule. Re-read so edits made during the run are kept.
     */
    private void advance(Long scheduleId, Instant ranAt) {
        repository.findById(scheduleId).ifPresentOrElse(current -> {
            current.setLastRun(ranAt);
            current.setRunCount(current.getRunCount() + 1);
            current.setNextRun(nextRunAfter(current, ranAt));
            repository.save(current);
        }, () -> log.warn("Drift schedule {} was deleted during its run", scheduleId));
    }
    
    private static Instant nextRunAfter(DriftSchedule schedule, Instant from) {
        if (!schedule.isEnabled()) {
            return null;
        }
        Instant next = from.plusSeconds(schedule.getIntervalSeconds());
        Instant now = Instant.now();
        return next.isBefore(now) ? now : next;
    }
    
    private void validate(DriftSchedule schedule) {
        if (schedule.getName() == null || schedule.getName().isBlank()) {
            throw new ValidationException("name", "Schedule name is required");
        }
        if (schedule.getIntervalSeconds() < properties.getMinIntervalSeconds()
                || schedule.getIntervalSeconds() > properties.getMaxIntervalSeconds()) {
            throw new ValidationException("interval_seconds", schedule.getIntervalSeconds(),
                "Interval must be between " + properties.getMinIntervalSeconds()
                    + " and " + properties.getMaxIntervalSeconds() + " seconds");
        }
        if (schedule.getDeviceIds() != null && schedule.getDeviceIds().stream().anyMatch(id -> id == null || id <= 0)) {
            throw new ValidationException("device_ids", schedule.getDeviceIds(), "Device ids must be positive");
        }
    }
    
    private static List<Long> distinct(List<Long> ids) {
        return ids == null ? new ArrayList<>() : new ArrayList<>(new LinkedHashSet<>(ids));
    }
    
    private static String describeSelection(DriftSchedule schedule) {
        return schedule.getDeviceIds() == null || schedule.getDeviceIds().isEmpty()
            ? "all devices"
            : schedule.getDeviceIds().size() + " device(s)";
    }
}

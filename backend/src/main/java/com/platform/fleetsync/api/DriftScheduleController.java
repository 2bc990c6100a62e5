package com.platform.fleetsync.api;

import com.platform.fleetsync.schedule.DriftSchedule;
import com.platform.fleetsync.schedule.DriftScheduleRun;
import com.platform.fleetsync.schedule.DriftScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST API for recurring drift checks.
 */
@RestController
@RequestMapping("/api/drift/schedules")
@RequiredArgsConstructor
public class DriftScheduleController {
    
    private final DriftScheduleService scheduleService;
    
    @GetMapping
    public List<DriftSchedule> getAllSchedules() {
        return scheduleService.list();
    }
    
    @GetMapping("/{id}")
    public DriftSchedule getSchedule(@PathVariable Long id) {
        return scheduleService.get(id);
    }
    
    @PostMapping
    public ResponseEntity<DriftSchedule> createSchedule(@Valid @RequestBody ApiRequests.ScheduleRequest request) {
        DriftSchedule created = scheduleService.create(toSchedule(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
    
    @PutMapping("/{id}")
    public DriftSchedule updateSchedule(@PathVariable Long id, @Valid @RequestBody ApiRequests.ScheduleRequest request) {
        return scheduleService.update(id, toSchedule(request));
    }
    
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSchedule(@PathVariable Long id) {
        scheduleService.delete(id);
        return ResponseEntity.noContent().build();
    }
    
    @PostMapping("/{id}/toggle")
    public DriftSchedule toggleSchedule(@PathVariable Long id) {
        return scheduleService.toggle(id);
    }
    
    /**
     * Run history, newest first.
     */
    @GetMapping("/{id}/runs")
    public List<DriftScheduleRun> getRuns(@PathVariable Long id, @RequestParam(required = false) Integer limit) {
        return scheduleService.getRuns(id, limit);
    }
    
    @PostMapping("/{id}/run")
    public DriftScheduleRun runSchedule(@PathVariable Long id) {
        return scheduleService.runNow(id);
    }
    
    /**
     * Cancel the device calls of the schedule's run in progress.
     */
    @PostMapping("/{id}/cancel")
    public Map<String, Object> cancelRun(@PathVariable Long id) {
        boolean cancelled = scheduleService.cancelRun(id);
        return Map.of("schedule_id", id, "cancelled", cancelled);
    }
    
    private static DriftSchedule toSchedule(ApiRequests.ScheduleRequest request) {
        return DriftSchedule.builder()
            .name(request.getName())
            .description(request.getDescription())
            .enabled(request.getEnabled() == null || request.getEnabled())
            .intervalSeconds(request.getIntervalSeconds())
            .deviceIds(request.getDeviceIds() != null ? new ArrayList<>(request.getDeviceIds()) : new ArrayList<>())
            .build();
    }
}

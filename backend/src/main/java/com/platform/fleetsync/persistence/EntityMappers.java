package com.platform.fleetsync.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.configuration.ConfigHistoryEntry;
import com.platform.fleetsync.configuration.ConfigTemplate;
import com.platform.fleetsync.configuration.StoredConfiguration;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceSettings;
import com.platform.fleetsync.drift.BulkDriftResult;
import com.platform.fleetsync.drift.DriftReport;
import com.platform.fleetsync.drift.DriftTrend;
import com.platform.fleetsync.drift.FieldDelta;
import com.platform.fleetsync.error.ValidationException;
import com.platform.fleetsync.persistence.entity.ConfigHistoryEntity;
import com.platform.fleetsync.persistence.entity.ConfigTemplateEntity;
import com.platform.fleetsync.persistence.entity.DeviceConfigurationEntity;
import com.platform.fleetsync.persistence.entity.DeviceEntity;
import com.platform.fleetsync.persistence.entity.DriftReportEntity;
import com.platform.fleetsync.persistence.entity.DriftScheduleEntity;
import com.platform.fleetsync.persistence.entity.DriftScheduleRunEntity;
import com.platform.fleetsync.persistence.entity.DriftTrendEntity;
import com.platform.fleetsync.persistence.entity.ResolutionPolicyEntity;
import com.platform.fleetsync.persistence.entity.ResolutionRequestEntity;
import com.platform.fleetsync.protocol.Generation;
import com.platform.fleetsync.resolution.ResolutionPolicy;
import com.platform.fleetsync.resolution.ResolutionRequest;
import com.platform.fleetsync.schedule.DriftSchedule;
import com.platform.fleetsync.schedule.DriftScheduleRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bidirectional mappers between domain objects and JPA entities.
 * 
 * Malformed stored blobs surface as {@link ValidationException}, naming the
 * record and the blob.
 */
@Slf4j
@Component
public class EntityMappers {
    
    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() { };
    private static final TypeReference<List<FieldDelta>> DELTA_LIST = new TypeReference<>() { };
    
    private final ObjectMapper objectMapper;
    
    public EntityMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    // ==================== Device ====================
    
    public DeviceEntity toEntity(Device domain) {
        return DeviceEntity.builder()
            .id(domain.getId())
            .mac(domain.getMac())
            .ip(domain.getIp())
            .type(domain.getType())
            .name(domain.getName())
            .firmware(domain.getFirmware())
            .generation(domain.getGeneration().number())
            .status(domain.getStatus())
            .lastSeen(domain.getLastSeen())
            .settingsJson(write(domain.getSettings()))
            .templateIdsJson(write(domain.getTemplateIds() != null ? domain.getTemplateIds() : List.of()))
            .overridesJson(domain.getOverrides() != null ? write(domain.getOverrides()) : null)
            .desiredConfigJson(domain.getDesiredConfig() != null ? write(domain.getDesiredConfig()) : null)
            .configApplied(domain.isConfigApplied())
            .syncStatus(domain.getSyncStatus())
            .lastSynced(domain.getLastSynced())
            .createdAt(domain.getCreatedAt())
            .updatedAt(domain.getUpdatedAt())
            .version(domain.getVersion())
            .build();
    }
    
    public Device toDomain(DeviceEntity entity) {
        String owner = "device " + entity.getId();
        return Device.builder()
            .id(entity.getId())
            .mac(entity.getMac())
            .ip(entity.getIp())
            .type(entity.getType())
            .name(entity.getName())
            .firmware(entity.getFirmware())
            .generation(Generation.fromNumber(Math.max(1, entity.getGeneration())))
            .status(entity.getStatus())
            .lastSeen(entity.getLastSeen())
            .settings(isBlank(entity.getSettingsJson())
                ? new DeviceSettings()
                : read(entity.getSettingsJson(), DeviceSettings.class, owner, "settings"))
            .templateIds(isBlank(entity.getTemplateIdsJson())
                ? new ArrayList<>()
                : new ArrayList<>(read(entity.getTemplateIdsJson(), ID_LIST, owner, "template_ids")))
            .overrides(readObject(entity.getOverridesJson(), owner, "overrides"))
            .desiredConfig(readObject(entity.getDesiredConfigJson(), owner, "desired_config"))
            .configApplied(entity.isConfigApplied())
            .syncStatus(entity.getSyncStatus())
            .lastSynced(entity.getLastSynced())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .version(entity.getVersion())
            .build();
    }
    
    // ==================== ConfigTemplate ====================
    
    public ConfigTemplateEntity toEntity(ConfigTemplate domain) {
        return ConfigTemplateEntity.builder()
            .id(domain.getId())
            .name(domain.getName())
            .description(domain.getDescription())
            .scope(domain.getScope())
            .deviceType(domain.getDeviceType())
            .configJson(write(domain.getConfig() != null ? domain.getConfig() : objectMapper.createObjectNode()))
            .createdAt(domain.getCreatedAt())
            .updatedAt(domain.getUpdatedAt())
            .version(domain.getVersion())
            .build();
    }
    
    public ConfigTemplate toDomain(ConfigTemplateEntity entity) {
        ObjectNode config = readObject(entity.getConfigJson(), "template " + entity.getId(), "config");
        return ConfigTemplate.builder()
            .id(entity.getId())
            .name(entity.getName())
            .description(entity.getDescription())
            .scope(entity.getScope())
            .deviceType(entity.getDeviceType())
            .config(config != null ? config : objectMapper.createObjectNode())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .version(entity.getVersion())
            .build();
    }
    
    // ==================== Stored configuration ====================
    
    public DeviceConfigurationEntity toEntity(StoredConfiguration domain) {
        return DeviceConfigurationEntity.builder()
            .id(domain.getId())
            .deviceId(domain.getDeviceId())
            .configJson(write(domain.getConfig()))
            .lastSynced(domain.getLastSynced())
            .updatedAt(domain.getUpdatedAt())
            .build();
    }
    
    public StoredConfiguration toDomain(DeviceConfigurationEntity entity) {
        return StoredConfiguration.builder()
            .id(entity.getId())
            .deviceId(entity.getDeviceId())
            .config(readObject(entity.getConfigJson(), "stored configuration of device " + entity.getDeviceId(), "config"))
            .lastSynced(entity.getLastSynced())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }
    
    public ConfigHistoryEntity toEntity(ConfigHistoryEntry domain) {
        return ConfigHistoryEntity.builder()
            .id(domain.getId())
            .deviceId(domain.getDeviceId())
            .action(domain.getAction())
            .oldConfigJson(domain.getOldConfig() != null ? write(domain.getOldConfig()) : null)
            .newConfigJson(domain.getNewConfig() != null ? write(domain.getNewConfig()) : null)
            .changedBy(domain.getChangedBy())
            .createdAt(domain.getCreatedAt())
            .build();
    }
    
    public ConfigHistoryEntry toDomain(ConfigHistoryEntity entity) {
        String owner = "history entry " + entity.getId();
        return ConfigHistoryEntry.builder()
            .id(entity.getId())
            .deviceId(entity.getDeviceId())
            .action(entity.getAction())
            .oldConfig(readObject(entity.getOldConfigJson(), owner, "old_config"))
            .newConfig(readObject(entity.getNewConfigJson(), owner, "new_config"))
            .changedBy(entity.getChangedBy())
            .createdAt(entity.getCreatedAt())
            .build();
    }
    
    // ==================== Drift ====================
    
    public DriftReportEntity toEntity(DriftReport domain) {
        return DriftReportEntity.builder()
            .id(domain.getId())
            .deviceId(domain.getDeviceId())
            .inSync(domain.isInSync())
            .differenceCount(domain.getDriftCount())
            .differencesJson(write(domain.getDifferences()))
            .checkedAt(domain.getCheckedAt())
            .build();
    }
    
    public DriftReport toDomain(DriftReportEntity entity) {
        List<FieldDelta> differences = isBlank(entity.getDifferencesJson())
            ? new ArrayList<>()
            : new ArrayList<>(read(entity.getDifferencesJson(), DELTA_LIST, "drift report " + entity.getId(), "differences"));
        return DriftReport.builder()
            .id(entity.getId())
            .deviceId(entity.getDeviceId())
            .inSync(entity.isInSync())
            .differences(differences)
            .checkedAt(entity.getCheckedAt())
            .build();
    }
    
    public DriftTrendEntity toEntity(DriftTrend domain) {
        return DriftTrendEntity.builder()
            .id(domain.getId())
            .deviceId(domain.getDeviceId())
            .path(domain.getPath())
            .category(domain.getCategory())
            .severity(domain.getSeverity())
            .occurrences(domain.getOccurrences())
            .firstSeen(domain.getFirstSeen())
            .lastSeen(domain.getLastSeen())
            .resolved(domain.isResolved())
            .resolvedAt(domain.getResolvedAt())
            .build();
    }
    
    public DriftTrend toDomain(DriftTrendEntity entity) {
        return DriftTrend.builder()
            .id(entity.getId())
            .deviceId(entity.getDeviceId())
            .path(entity.getPath())
            .category(entity.getCategory())
            .severity(entity.getSeverity())
            .occurrences(entity.getOccurrences())
            .firstSeen(entity.getFirstSeen())
            .lastSeen(entity.getLastSeen())
            .resolved(entity.isResolved())
            .resolvedAt(entity.getResolvedAt())
            .build();
    }
    
    // ==================== Schedules ====================
    
    public DriftScheduleEntity toEntity(DriftSchedule domain) {
        return DriftScheduleEntity.builder()
            .id(domain.getId())
            .name(domain.getName())
            .description(domain.getDescription())
            .enabled(domain.isEnabled())
            .intervalSeconds(domain.getIntervalSeconds())
            .deviceIdsJson(write(domain.getDeviceIds() != null ? domain.getDeviceIds() : List.of()))
            .lastRun(domain.getLastRun())
            .nextRun(domain.getNextRun())
            .runCount(domain.getRunCount())
            .createdAt(domain.getCreatedAt())
            .updatedAt(domain.getUpdatedAt())
            .version(domain.getVersion())
            .build();
    }
    
    public DriftSchedule toDomain(DriftScheduleEntity entity) {
        return DriftSchedule.builder()
            .id(entity.getId())
            .name(entity.getName())
            .description(entity.getDescription())
            .enabled(entity.isEnabled())
            .intervalSeconds(entity.getIntervalSeconds())
            .deviceIds(isBlank(entity.getDeviceIdsJson())
                ? new ArrayList<>()
                : new ArrayList<>(read(entity.getDeviceIdsJson(), ID_LIST, "schedule " + entity.getId(), "device_ids")))
            .lastRun(entity.getLastRun())
            .nextRun(entity.getNextRun())
            .runCount(entity.getRunCount())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .version(entity.getVersion())
            .build();
    }
    
    public DriftScheduleRunEntity toEntity(DriftScheduleRun domain) {
        return DriftScheduleRunEntity.builder()
            .id(domain.getId())
            .scheduleId(domain.getScheduleId())
            .status(domain.getStatus())
            .startedAt(domain.getStartedAt())
            .completedAt(domain.getCompletedAt())
            .durationMs(domain.getDurationMs())
            .totalDevices(domain.getTotalDevices())
            .inSync(domain.getInSync())
            .drifted(domain.getDrifted())
            .errors(domain.getErrors())
            .resultJson(domain.getResult() != null ? write(domain.getResult()) : null)
            .errorMessage(domain.getErrorMessage())
            .build();
    }
    
    public DriftScheduleRun toDomain(DriftScheduleRunEntity entity) {
        BulkDriftResult result = isBlank(entity.getResultJson())
            ? null
            : read(entity.getResultJson(), BulkDriftResult.class, "schedule run " + entity.getId(), "result");
        return DriftScheduleRun.builder()
            .id(entity.getId())
            .scheduleId(entity.getScheduleId())
            .status(entity.getStatus())
            .startedAt(entity.getStartedAt())
            .completedAt(entity.getCompletedAt())
            .durationMs(entity.getDurationMs())
            .totalDevices(entity.getTotalDevices())
            .inSync(entity.getInSync())
            .drifted(entity.getDrifted())
            .errors(entity.getErrors())
            .result(result)
            .errorMessage(entity.getErrorMessage())
            .build();
    }
    
    // ==================== Resolution ====================
    
    public ResolutionPolicyEntity toEntity(ResolutionPolicy domain) {
        return ResolutionPolicyEntity.builder()
            .id(domain.getId())
            .name(domain.getName())
            .category(domain.getCategory())
            .strategy(domain.getStrategy())
            .enabled(domain.isEnabled())
            .priority(domain.getPriority())
            .description(domain.getDescription())
            .createdAt(domain.getCreatedAt())
            .updatedAt(domain.getUpdatedAt())
            .build();
    }
    
    public ResolutionPolicy toDomain(ResolutionPolicyEntity entity) {
        return ResolutionPolicy.builder()
            .id(entity.getId())
            .name(entity.getName())
            .category(entity.getCategory())
            .strategy(entity.getStrategy())
            .enabled(entity.isEnabled())
            .priority(entity.getPriority())
            .description(entity.getDescription())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }
    
    public ResolutionRequestEntity toEntity(ResolutionRequest domain) {
        return ResolutionRequestEntity.builder()
            .id(domain.getId())
            .deviceId(domain.getDeviceId())
            .policyId(domain.getPolicyId())
            .path(domain.getPath())
            .category(domain.getCategory())
            .severity(domain.getSeverity())
            .strategy(domain.getStrategy())
            .expectedJson(domain.getExpected() != null ? write(domain.getExpected()) : null)
            .actualJson(domain.getActual() != null ? write(domain.getActual()) : null)
            .status(domain.getStatus())
            .createdAt(domain.getCreatedAt())
            .decidedAt(domain.getDecidedAt())
            .decidedBy(domain.getDecidedBy())
            .decisionReason(domain.getDecisionReason())
            .outcome(domain.getOutcome())
            .outcomeDetail(domain.getOutcomeDetail())
            .executedAt(domain.getExecutedAt())
            .build();
    }
    
    public ResolutionRequest toDomain(ResolutionRequestEntity entity) {
        String owner = "resolution request " + entity.getId();
        return ResolutionRequest.builder()
            .id(entity.getId())
            .deviceId(entity.getDeviceId())
            .policyId(entity.getPolicyId())
            .path(entity.getPath())
            .category(entity.getCategory())
            .severity(entity.getSeverity())
            .strategy(entity.getStrategy())
            .expected(isBlank(entity.getExpectedJson()) ? null : read(entity.getExpectedJson(), JsonNode.class, owner, "expected"))
            .actual(isBlank(entity.getActualJson()) ? null : read(entity.getActualJson(), JsonNode.class, owner, "actual"))
            .status(entity.getStatus())
            .createdAt(entity.getCreatedAt())
            .decidedAt(entity.getDecidedAt())
            .decidedBy(entity.getDecidedBy())
            .decisionReason(entity.getDecisionReason())
            .outcome(entity.getOutcome())
            .outcomeDetail(entity.getOutcomeDetail())
            .executedAt(entity.getExecutedAt())
            .build();
    }
    
    // ==================== JSON helpers ====================
    
    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}: {}", value.getClass().getSimpleName(), e.getMessage());
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
    
    public ObjectNode readObject(String json, String owner, String blob) {
        if (isBlank(json)) {
            return null;
        }
        JsonNode node = read(json, JsonNode.class, owner, blob);
        if (node.isNull()) {
            return null;
        }
        if (!(node instanceof ObjectNode objectNode)) {
            throw ValidationException.configuration(blob, owner + " has a non-object " + blob + " blob");
        }
        return objectNode;
    }
    
    private <T> T read(String json, Class<T> type, String owner, String blob) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Malformed {} blob on {}: {}", blob, owner, e.getOriginalMessage());
            throw ValidationException.configuration(blob, owner + " has malformed " + blob + ": " + e.getOriginalMessage());
        }
    }
    
    private <T> T read(String json, TypeReference<T> type, String owner, String blob) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Malformed {} blob on {}: {}", blob, owner, e.getOriginalMessage());
            throw ValidationException.configuration(blob, owner + " has malformed " + blob + ": " + e.getOriginalMessage());
        }
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

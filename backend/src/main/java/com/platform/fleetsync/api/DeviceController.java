package com.platform.fleetsync.api;

import com.platform.fleetsync.device.ConnectionTestResult;
import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceService;
import com.platform.fleetsync.protocol.DeviceStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the device inventory and live device operations.
 */
@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
public class DeviceController {
    
    private final DeviceService deviceService;
    
    @GetMapping
    public List<Device> getAllDevices() {
        return deviceService.list();
    }
    
    @GetMapping("/{id}")
    public Device getDevice(@PathVariable Long id) {
        return deviceService.get(id);
    }
    
    /**
     * Add a device by address. The device is contacted before it is stored.
     */
    @PostMapping
    public ResponseEntity<Device> addDevice(@Valid @RequestBody ApiRequests.AddDeviceRequest request) {
        Device device = deviceService.add(request.getIp(), request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(device);
    }
    
    @PatchMapping("/{id}")
    public Device renameDevice(@PathVariable Long id, @Valid @RequestBody ApiRequests.RenameDeviceRequest request) {
        return deviceService.rename(id, request.getName());
    }
    
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDevice(@PathVariable Long id) {
        deviceService.delete(id);
        return ResponseEntity.noContent().build();
    }
    
    @GetMapping("/{id}/status")
    public DeviceStatus getStatus(@PathVariable Long id) {
        return deviceService.getStatus(id);
    }
    
    @PostMapping("/{id}/control")
    public Map<String, Object> control(@PathVariable Long id, @Valid @RequestBody ApiRequests.ControlRequest request) {
        deviceService.control(id, request.getAction(), request.getComponent(), request.getChannel());
        return Map.of(
            "device_id", id,
            "action", request.getAction(),
            "success", true
        );
    }
    
    /**
     * Set a component state directly: switch on/off/toggle, light brightness, cover position.
     */
    @PutMapping("/{id}/components/{component}/{channel}")
    public Map<String, Object> setComponentState(
            @PathVariable Long id,
            @PathVariable String component,
            @PathVariable int channel,
            @Valid @RequestBody ApiRequests.ComponentStateRequest request) {
        deviceService.setComponentState(id, component, channel, request.getValue());
        return Map.of(
            "device_id", id,
            "component", component,
            "channel", channel,
            "value", request.getValue()
        );
    }
    
    @PostMapping("/{id}/test")
    public ConnectionTestResult testConnection(@PathVariable Long id) {
        return deviceService.testConnection(id);
    }
    
    @PutMapping("/{id}/credential")
    public Device updateCredential(@PathVariable Long id, @Valid @RequestBody ApiRequests.CredentialRequest request) {
        return deviceService.updateCredential(id, request.getUsername(), request.getPassword());
    }
    
    @DeleteMapping("/{id}/credential")
    public Device clearCredential(@PathVariable Long id) {
        return deviceService.clearCredential(id);
    }
}

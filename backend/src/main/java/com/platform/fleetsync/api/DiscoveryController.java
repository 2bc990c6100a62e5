package com.platform.fleetsync.api;

import com.platform.fleetsync.discovery.DiscoveryResult;
import com.platform.fleetsync.discovery.DiscoveryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/discovery")
@RequiredArgsConstructor
public class DiscoveryController {
    
    private final DiscoveryService discoveryService;
    
    /**
     * Scan a range and fold every device found into the inventory.
     */
    @PostMapping
    public DiscoveryResult discover(@Valid @RequestBody ApiRequests.DiscoveryRequest request) {
        return discoveryService.discover(request.getRange());
    }
}

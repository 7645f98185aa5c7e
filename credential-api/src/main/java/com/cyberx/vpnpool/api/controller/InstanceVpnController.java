package com.cyberx.vpnpool.api.controller;

import com.cyberx.vpnpool.api.dto.ApiResponse;
import com.cyberx.vpnpool.api.dto.ClaimResponse;
import com.cyberx.vpnpool.api.dto.InstanceClaimRequest;
import com.cyberx.vpnpool.api.dto.LinkInstanceRequest;
import com.cyberx.vpnpool.api.dto.VpnCredentialResponse;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.service.ClaimResult;
import com.cyberx.vpnpool.api.service.CredentialExportService;
import com.cyberx.vpnpool.api.service.CredentialLifecycleService;
import com.cyberx.vpnpool.api.service.CredentialPoolAllocator;
import com.cyberx.vpnpool.api.service.CredentialQueryService;
import com.cyberx.vpnpool.api.service.PoolStatistics;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * Hooks for the instance provisioning workflow. A credential can be reserved before
 * the instance exists and linked once the instance id is known.
 */
@RestController
@RequestMapping("/api/internal/vpn/instances")
@RequiredArgsConstructor
@Tag(name = "VPN Instances", description = "Credential assignment for provisioned instances")
public class InstanceVpnController {

    private final CredentialPoolAllocator poolAllocator;
    private final CredentialQueryService queryService;
    private final CredentialLifecycleService lifecycleService;
    private final CredentialExportService exportService;

    @PostMapping("/claim")
    @Operation(summary = "Claim one auto-assign credential for an instance")
    public ResponseEntity<ClaimResponse> claim(@RequestBody(required = false) InstanceClaimRequest request) {
        Long instanceId = request != null ? request.getInstanceId() : null;
        ClaimResult result = poolAllocator.claimForInstance(instanceId);
        return ResponseEntity.ok(ClaimResponse.from(result));
    }

    @PutMapping("/credentials/{credentialId}/instance")
    @Operation(summary = "Link a reserved credential to its instance")
    public ResponseEntity<ApiResponse<VpnCredentialResponse>> link(
            @PathVariable Long credentialId,
            @Valid @RequestBody LinkInstanceRequest request) {
        VpnCredential linked = poolAllocator.linkInstance(credentialId, request.getInstanceId());
        return ResponseEntity.ok(ApiResponse.ok("VPN linked to instance", VpnCredentialResponse.from(linked)));
    }

    @GetMapping("/{instanceId}/config")
    @Operation(summary = "Render the config for an instance")
    public ResponseEntity<byte[]> downloadConfig(@PathVariable Long instanceId) {
        VpnCredential credential = queryService.getInstanceCredential(instanceId);
        String filename = exportService.filenameFor(credential, null, null);
        return DownloadResponses.config(filename, exportService.renderConfig(credential));
    }

    @DeleteMapping("/{instanceId}/credential")
    @Operation(summary = "Instance destroyed: permanently deactivate its credential")
    public ResponseEntity<ApiResponse<Map<String, Object>>> revoke(@PathVariable Long instanceId) {
        Optional<VpnCredential> revoked = lifecycleService.revokeInstanceCredential(instanceId);
        if (revoked.isEmpty()) {
            return ResponseEntity.ok(ApiResponse.ok("No VPN credential assigned to instance", Map.of("revoked", false)));
        }
        return ResponseEntity.ok(ApiResponse.ok("VPN credential revoked",
            Map.of("revoked", true, "credentialId", revoked.get().getId())));
    }

    @GetMapping("/stats")
    @Operation(summary = "Auto-assign pool statistics")
    public ResponseEntity<ApiResponse<PoolStatistics>> stats() {
        return ResponseEntity.ok(ApiResponse.ok(queryService.getInstancePoolStats()));
    }
}

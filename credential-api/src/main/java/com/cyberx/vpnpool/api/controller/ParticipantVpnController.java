package com.cyberx.vpnpool.api.controller;

import com.cyberx.vpnpool.api.dto.ApiResponse;
import com.cyberx.vpnpool.api.dto.ClaimResponse;
import com.cyberx.vpnpool.api.dto.CredentialRequest;
import com.cyberx.vpnpool.api.dto.RequestBatchResponse;
import com.cyberx.vpnpool.api.dto.VpnCredentialResponse;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.exception.CredentialNotFoundException;
import com.cyberx.vpnpool.api.service.ClaimResult;
import com.cyberx.vpnpool.api.service.CredentialExportService;
import com.cyberx.vpnpool.api.service.CredentialPoolAllocator;
import com.cyberx.vpnpool.api.service.CredentialQueryService;
import com.cyberx.vpnpool.common.naming.Requester;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Self-service endpoints. The caller is identified by the {@code X-User-Id} and
 * {@code X-Username} headers set by the authenticating gateway.
 */
@RestController
@RequestMapping("/api/vpn")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "VPN", description = "Participant VPN credential requests and downloads")
public class ParticipantVpnController {

    private final CredentialPoolAllocator poolAllocator;
    private final CredentialQueryService queryService;
    private final CredentialExportService exportService;

    @PostMapping("/request")
    @Operation(
            summary = "Request VPN credentials",
            description = "Claims up to 25 self-service credentials. Fewer than requested are returned when the pool runs low."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Claim processed, check success and assignedCount"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Missing caller identity")
    })
    public ResponseEntity<ClaimResponse> requestCredentials(
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-Username", required = false) String username,
            @RequestBody(required = false) CredentialRequest request) {
        int count = request != null ? request.getCount() : 1;
        ClaimResult result = poolAllocator.claimForUser(userId, username, count, AssignmentType.USER_REQUESTABLE);
        return ResponseEntity.ok(ClaimResponse.from(result));
    }

    @GetMapping("/my-credentials")
    @Operation(summary = "List my VPN credentials", description = "Newest assignment first")
    public ResponseEntity<ApiResponse<List<VpnCredentialResponse>>> getMyCredentials(
            @RequestHeader("X-User-Id") Long userId) {
        List<VpnCredentialResponse> credentials = queryService.getUserCredentials(userId).stream()
            .map(VpnCredentialResponse::from)
            .toList();
        return ResponseEntity.ok(ApiResponse.ok(credentials));
    }

    @GetMapping("/my-credentials/count")
    @Operation(summary = "Count my VPN credentials")
    public ResponseEntity<ApiResponse<Map<String, Long>>> getMyCredentialCount(
            @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(ApiResponse.ok(Map.of("count", queryService.getUserCredentialCount(userId))));
    }

    @GetMapping("/available-count")
    @Operation(summary = "Number of self-service credentials left in the pool")
    public ResponseEntity<ApiResponse<Map<String, Long>>> getAvailableCount() {
        long available = queryService.getAvailableCount(AssignmentType.USER_REQUESTABLE);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("available", available)));
    }

    @GetMapping("/batches")
    @Operation(summary = "List my request batches", description = "Newest first")
    public ResponseEntity<ApiResponse<List<RequestBatchResponse>>> getMyBatches(
            @RequestHeader("X-User-Id") Long userId) {
        List<RequestBatchResponse> batches = queryService.getUserRequestBatches(userId).stream()
            .map(RequestBatchResponse::from)
            .toList();
        return ResponseEntity.ok(ApiResponse.ok(batches));
    }

    @GetMapping("/batches/{batchId}")
    @Operation(summary = "List the credentials of one of my batches")
    public ResponseEntity<ApiResponse<List<VpnCredentialResponse>>> getBatch(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable String batchId) {
        List<VpnCredentialResponse> credentials = queryService.getCredentialsByBatch(userId, batchId).stream()
            .map(VpnCredentialResponse::from)
            .toList();
        return ResponseEntity.ok(ApiResponse.ok(credentials));
    }

    @GetMapping("/credentials/{id}/config")
    @Operation(summary = "Download one of my configs")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "WireGuard config file"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not found or not yours")
    })
    public ResponseEntity<byte[]> downloadConfig(
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-Username", required = false) String username,
            @PathVariable Long id) {
        VpnCredential credential = queryService.getUserCredential(userId, id);
        String filename = exportService.filenameFor(credential, new Requester(userId, username), null);
        return DownloadResponses.config(filename, exportService.renderConfig(credential));
    }

    @GetMapping("/download-all")
    @Operation(summary = "Download all my configs as a ZIP")
    public ResponseEntity<byte[]> downloadAll(
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-Username", required = false) String username) {
        List<VpnCredential> credentials = queryService.getUserCredentials(userId);
        if (credentials.isEmpty()) {
            throw new CredentialNotFoundException("No VPN credentials assigned to you");
        }
        byte[] archive = exportService.exportZip(credentials, new Requester(userId, username));
        return DownloadResponses.zip("vpn_configs.zip", archive);
    }

    @GetMapping("/batches/{batchId}/download")
    @Operation(summary = "Download one of my batches as a ZIP")
    public ResponseEntity<byte[]> downloadBatch(
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-Username", required = false) String username,
            @PathVariable String batchId) {
        List<VpnCredential> credentials = queryService.getCredentialsByBatch(userId, batchId);
        if (credentials.isEmpty()) {
            throw new CredentialNotFoundException("Batch not found: " + batchId);
        }
        byte[] archive = exportService.exportZip(credentials, new Requester(userId, username));
        return DownloadResponses.zip(CredentialExportService.batchArchiveName(batchId), archive);
    }
}

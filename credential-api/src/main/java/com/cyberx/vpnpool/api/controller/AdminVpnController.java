package com.cyberx.vpnpool.api.controller;

import com.cyberx.vpnpool.api.dto.ApiResponse;
import com.cyberx.vpnpool.api.dto.AssignRequest;
import com.cyberx.vpnpool.api.dto.AssignmentTypeRequest;
import com.cyberx.vpnpool.api.dto.BulkAssignRequest;
import com.cyberx.vpnpool.api.dto.BulkAssignmentTypeRequest;
import com.cyberx.vpnpool.api.dto.BulkDeleteRequest;
import com.cyberx.vpnpool.api.dto.ClaimResponse;
import com.cyberx.vpnpool.api.dto.NamingPatternRequest;
import com.cyberx.vpnpool.api.dto.ServerDefaultsRequest;
import com.cyberx.vpnpool.api.dto.VpnCredentialResponse;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.api.exception.CredentialNotFoundException;
import com.cyberx.vpnpool.api.service.AppSettingService;
import com.cyberx.vpnpool.api.service.AssignmentTypeService;
import com.cyberx.vpnpool.api.service.BulkAssignResult;
import com.cyberx.vpnpool.api.service.BulkDeleteResult;
import com.cyberx.vpnpool.api.service.BulkUpdateResult;
import com.cyberx.vpnpool.api.service.ClaimResult;
import com.cyberx.vpnpool.api.service.CredentialExportService;
import com.cyberx.vpnpool.api.service.CredentialImportService;
import com.cyberx.vpnpool.api.service.CredentialLifecycleService;
import com.cyberx.vpnpool.api.service.CredentialPoolAllocator;
import com.cyberx.vpnpool.api.service.CredentialQueryService;
import com.cyberx.vpnpool.api.service.ImportResult;
import com.cyberx.vpnpool.api.service.UserAssignment;
import com.cyberx.vpnpool.common.naming.Requester;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import com.cyberx.vpnpool.common.wireguard.ServerDefaults;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pool administration. Access control is enforced upstream; {@code X-Username}
 * is recorded as the actor where a change is attributed.
 */
@RestController
@RequestMapping("/api/admin/vpn")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "VPN Admin", description = "Credential pool import, assignment and lifecycle")
public class AdminVpnController {

    private static final String ACTOR_HEADER = "X-Username";

    private final CredentialImportService importService;
    private final CredentialQueryService queryService;
    private final CredentialPoolAllocator poolAllocator;
    private final AssignmentTypeService assignmentTypeService;
    private final CredentialLifecycleService lifecycleService;
    private final CredentialExportService exportService;
    private final AppSettingService appSettingService;

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Import a ZIP of WireGuard configs",
            description = "Stores every new config in the archive. Already known configs are skipped, malformed ones reported."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Import processed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Empty upload or invalid assignment type")
    })
    public ResponseEntity<ApiResponse<ImportResult>> importArchive(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "endpoint", required = false) String endpoint,
            @RequestParam(value = "assignmentType", required = false) String assignmentType) {
        ImportResult result = importService.importArchive(bytesOf(file), endpoint, assignmentTypeOrDefault(assignmentType));
        String message = "Imported " + result.importedCount() + " VPN credentials";
        if (result.importedCount() == 0 && result.skippedCount() == 0 && !result.errors().isEmpty()) {
            return ResponseEntity.ok(ApiResponse.failed(result.errors().get(0), result));
        }
        return ResponseEntity.ok(ApiResponse.ok(message, result));
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Import a single .conf file")
    public ResponseEntity<ApiResponse<VpnCredentialResponse>> uploadConfig(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "endpoint", required = false) String endpoint,
            @RequestParam(value = "assignmentType", required = false) String assignmentType) {
        String text = new String(bytesOf(file), StandardCharsets.UTF_8);
        Optional<VpnCredential> imported = importService.importConfig(text, endpoint, assignmentTypeOrDefault(assignmentType));
        return imported
            .map(c -> ResponseEntity.ok(ApiResponse.ok("VPN credential imported", VpnCredentialResponse.from(c))))
            .orElseGet(() -> ResponseEntity.ok(ApiResponse.ok("Config already in pool", null)));
    }

    @GetMapping("/credentials")
    @Operation(summary = "List credentials", description = "Paginated, ordered by id, with optional filters")
    public ResponseEntity<Map<String, Object>> listCredentials(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size,
            @RequestParam(required = false) Boolean isAvailable,
            @RequestParam(required = false) Long assignedToUserId,
            @RequestParam(required = false) String assignmentType,
            @RequestParam(required = false) String search) {
        Page<VpnCredential> credentials = queryService.listCredentials(
            page, size, isAvailable, assignedToUserId, assignmentType, search);

        Map<String, Object> response = new HashMap<>();
        response.put("content", credentials.getContent().stream().map(VpnCredentialResponse::from).toList());
        response.put("totalElements", credentials.getTotalElements());
        response.put("totalPages", credentials.getTotalPages());
        response.put("currentPage", credentials.getNumber());
        response.put("size", credentials.getSize());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/credentials/{id}")
    @Operation(summary = "Get one credential")
    public ResponseEntity<ApiResponse<VpnCredentialResponse>> getCredential(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.ok(VpnCredentialResponse.from(queryService.getCredential(id))));
    }

    @GetMapping("/credentials/{id}/config")
    @Operation(summary = "Download a credential's config")
    public ResponseEntity<byte[]> downloadConfig(@PathVariable Long id) {
        VpnCredential credential = queryService.getCredential(id);
        Requester requester = credential.getAssignedToUserId() != null
            ? new Requester(credential.getAssignedToUserId(), credential.getAssignedToUsername())
            : null;
        String filename = exportService.filenameFor(credential, requester, null);
        return DownloadResponses.config(filename, exportService.renderConfig(credential));
    }

    @PutMapping("/credentials/{id}/assignment-type")
    @Operation(summary = "Change the pool class of an unassigned credential")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Updated"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown assignment type"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Credential is assigned")
    })
    public ResponseEntity<ApiResponse<Map<String, Object>>> setAssignmentType(
            @PathVariable Long id,
            @Valid @RequestBody AssignmentTypeRequest request) {
        boolean changed = assignmentTypeService.setAssignmentType(id, request.getAssignmentType());
        return ResponseEntity.ok(ApiResponse.ok(
            changed ? "Assignment type updated" : "Assignment type unchanged",
            Map.of("id", id, "assignmentType", request.getAssignmentType().strip(), "changed", changed)));
    }

    @PutMapping("/credentials/assignment-type")
    @Operation(summary = "Change the pool class of several credentials", description = "Failures are reported per credential")
    public ResponseEntity<ApiResponse<BulkUpdateResult>> bulkSetAssignmentType(
            @Valid @RequestBody BulkAssignmentTypeRequest request) {
        BulkUpdateResult result = assignmentTypeService.bulkSetAssignmentType(
            request.getCredentialIds(), request.getAssignmentType());
        return ResponseEntity.ok(ApiResponse.ok("Updated " + result.successCount() + " VPN credentials", result));
    }

    @PostMapping("/credentials/{id}/release")
    @Operation(summary = "Return an assigned credential to the pool")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Released"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Credential was permanently deactivated")
    })
    public ResponseEntity<ApiResponse<VpnCredentialResponse>> releaseCredential(@PathVariable Long id) {
        VpnCredential released = lifecycleService.releaseCredential(id);
        return ResponseEntity.ok(ApiResponse.ok("VPN credential released", VpnCredentialResponse.from(released)));
    }

    @PostMapping("/credentials/bulk-delete")
    @Operation(summary = "Delete several credentials")
    public ResponseEntity<ApiResponse<BulkDeleteResult>> deleteCredentials(@Valid @RequestBody BulkDeleteRequest request) {
        BulkDeleteResult result = lifecycleService.deleteCredentials(request.getCredentialIds());
        return ResponseEntity.ok(ApiResponse.ok("Deleted " + result.deletedCount() + " VPN credentials", result));
    }

    @DeleteMapping("/credentials")
    @Operation(summary = "Delete every credential", description = "Requires confirm=true")
    public ResponseEntity<ApiResponse<Map<String, Long>>> deleteAllCredentials(
            @RequestParam(name = "confirm", defaultValue = "false") boolean confirm,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        if (!confirm) {
            throw new BadRequestException("Deleting all VPN credentials requires confirm=true");
        }
        log.warn("Delete of all VPN credentials requested by {}", actor);
        long deleted = lifecycleService.deleteAllCredentials();
        return ResponseEntity.ok(ApiResponse.ok("Deleted all VPN credentials", Map.of("deletedCount", deleted)));
    }

    @PostMapping("/assign")
    @Operation(
            summary = "Assign credentials to one user",
            description = "Same allocation as a self-service request, on behalf of the given user."
    )
    public ResponseEntity<ClaimResponse> assign(@Valid @RequestBody AssignRequest request) {
        ClaimResult result = poolAllocator.claimForUser(request.getUserId(), request.getUsername(),
            request.getCount(), assignmentTypeOrDefault(request.getAssignmentType()));
        log.info("Admin assignment to user {}: {}", request.getUserId(), result.message());
        return ResponseEntity.ok(ClaimResponse.from(result));
    }

    @PostMapping("/bulk-assign")
    @Operation(summary = "Assign one credential to each listed user")
    public ResponseEntity<ApiResponse<BulkAssignResult>> bulkAssign(@Valid @RequestBody BulkAssignRequest request) {
        List<UserAssignment> users = request.getUsers().stream()
            .map(u -> new UserAssignment(u.getUserId(), u.getUsername()))
            .toList();
        BulkAssignResult result = poolAllocator.bulkAssign(users, assignmentTypeOrDefault(request.getAssignmentType()));
        return ResponseEntity.ok(ApiResponse.ok(
            "Assigned " + result.successCount() + " of " + users.size() + " users", result));
    }

    @PostMapping("/users/{userId}/revoke")
    @Operation(summary = "Permanently deactivate a removed user's credentials")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> revokeUserCredentials(@PathVariable Long userId) {
        int revoked = lifecycleService.revokeUserCredentials(userId);
        return ResponseEntity.ok(ApiResponse.ok("Revoked " + revoked + " VPN credentials", Map.of("revokedCount", revoked)));
    }

    @GetMapping("/users/{userId}/credentials")
    @Operation(summary = "List a user's credentials", description = "Newest assignment first")
    public ResponseEntity<ApiResponse<List<VpnCredentialResponse>>> getUserCredentials(@PathVariable Long userId) {
        List<VpnCredentialResponse> credentials = queryService.getUserCredentials(userId).stream()
            .map(VpnCredentialResponse::from)
            .toList();
        return ResponseEntity.ok(ApiResponse.ok(credentials));
    }

    @GetMapping("/users/{userId}/configs/download")
    @Operation(
            summary = "Download all of a user's configs as a ZIP",
            description = "namingPattern applies to this download only; the global pattern is used when it is omitted."
    )
    public ResponseEntity<byte[]> downloadUserConfigs(
            @PathVariable Long userId,
            @RequestParam(required = false) String namingPattern) {
        List<VpnCredential> credentials = queryService.getUserCredentials(userId);
        if (credentials.isEmpty()) {
            throw new CredentialNotFoundException("User " + userId + " does not have any VPN credentials");
        }
        String username = credentials.get(0).getAssignedToUsername();
        byte[] archive = exportService.exportZip(credentials, new Requester(userId, username), namingPattern);
        String owner = username != null && !username.isBlank() ? username : String.valueOf(userId);
        return DownloadResponses.zip("vpn_configs_" + owner + ".zip", archive);
    }

    @GetMapping("/stats")
    @Operation(summary = "Pool statistics")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("pool", queryService.getStatistics());
        stats.put("instancePool", queryService.getInstancePoolStats());
        Map<String, Long> availableByType = new HashMap<>();
        for (AssignmentType type : AssignmentType.values()) {
            availableByType.put(type.name(), queryService.getAvailableCount(type));
        }
        stats.put("availableByType", availableByType);
        return ResponseEntity.ok(ApiResponse.ok(stats));
    }

    @GetMapping("/settings/naming-pattern")
    @Operation(summary = "Get the config filename pattern")
    public ResponseEntity<ApiResponse<Map<String, String>>> getNamingPattern() {
        return ResponseEntity.ok(ApiResponse.ok(Map.of("pattern", appSettingService.getNamingPattern())));
    }

    @PutMapping("/settings/naming-pattern")
    @Operation(summary = "Set the config filename pattern")
    public ResponseEntity<ApiResponse<Map<String, String>>> setNamingPattern(
            @Valid @RequestBody NamingPatternRequest request,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        String pattern = appSettingService.setNamingPattern(request.getPattern(), actor);
        return ResponseEntity.ok(ApiResponse.ok("Naming pattern updated", Map.of("pattern", pattern)));
    }

    @GetMapping("/settings/server-defaults")
    @Operation(summary = "Get the WireGuard server defaults used for generated configs")
    public ResponseEntity<ApiResponse<ServerDefaults>> getServerDefaults() {
        return ResponseEntity.ok(ApiResponse.ok(appSettingService.resolveServerDefaults(null)));
    }

    @PutMapping("/settings/server-defaults")
    @Operation(summary = "Update the WireGuard server defaults")
    public ResponseEntity<ApiResponse<ServerDefaults>> updateServerDefaults(
            @RequestBody ServerDefaultsRequest request,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        ServerDefaults updated = appSettingService.updateServerDefaults(request.toServerDefaults(), actor);
        return ResponseEntity.ok(ApiResponse.ok("Server defaults updated", updated));
    }

    private static AssignmentType assignmentTypeOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return AssignmentType.USER_REQUESTABLE;
        }
        return AssignmentType.fromValue(value)
            .orElseThrow(() -> new BadRequestException("Invalid assignment type: " + value
                + ". Must be one of: " + AssignmentType.allowedValues()));
    }

    private static byte[] bytesOf(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("File is required");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file", e);
        }
    }
}

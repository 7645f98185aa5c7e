package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.api.exception.CredentialNotFoundException;
import com.cyberx.vpnpool.api.exception.StillAssignedException;
import com.cyberx.vpnpool.api.repository.VpnCredentialRepository;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import com.cyberx.vpnpool.common.pool.RequesterKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Hands out credentials from the pool under concurrent demand.
 *
 * <p>Every claim runs in one transaction: candidate rows are selected in random order
 * with {@code FOR UPDATE SKIP LOCKED}, stamped with the requester, and committed
 * together. Rows locked by a concurrent claim are invisible rather than waited on,
 * so no credential is issued twice and no claimant blocks behind another. A claim
 * that finds nothing returns a zero result immediately.</p>
 *
 * <p>Nothing here releases credentials; see {@link CredentialLifecycleService}.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialPoolAllocator {

    static final String NO_CAPACITY_MESSAGE = "No available VPN credentials";

    private final VpnCredentialRepository credentialRepository;
    private final PoolPolicyProperties poolPolicyProperties;
    private final PoolEventPublisher eventPublisher;
    private final PoolMetricsService metricsService;

    /**
     * Claim credentials for a requester.
     *
     * @param requesterKind user or instance
     * @param requesterId user id, or instance id (null reserves for an instance that does not exist yet)
     * @param count number of credentials wanted
     * @param assignmentTypeFilter pool class to claim from
     * @return assigned count, explanatory message and the claimed rows
     */
    @Transactional
    public ClaimResult claim(RequesterKind requesterKind, Long requesterId, int count,
                             AssignmentType assignmentTypeFilter) {
        return requesterKind == RequesterKind.INSTANCE
            ? doClaimForInstance(requesterId, assignmentTypeFilter)
            : doClaimForUser(requesterId, null, count, assignmentTypeFilter);
    }

    /**
     * Participant self-service claim. Requests above the per-request cap are truncated.
     */
    @Transactional
    public ClaimResult claimForUser(Long userId, String username, int count, AssignmentType assignmentTypeFilter) {
        return doClaimForUser(userId, username, count, assignmentTypeFilter);
    }

    /**
     * Claim exactly one INSTANCE_AUTO_ASSIGN credential for an instance.
     * Retrying for an instance that already holds an active credential returns that
     * credential instead of taking another row.
     *
     * @param instanceId the instance id, or null when the instance is created after the
     *                   reservation; link it later with {@link #linkInstance(Long, Long)}
     */
    @Transactional
    public ClaimResult claimForInstance(Long instanceId) {
        return doClaimForInstance(instanceId, AssignmentType.INSTANCE_AUTO_ASSIGN);
    }

    /**
     * Attach an instance to a credential reserved for it before the instance existed.
     */
    @Transactional
    public VpnCredential linkInstance(Long credentialId, Long instanceId) {
        if (instanceId == null) {
            throw new BadRequestException("Instance ID is required");
        }
        VpnCredential credential = credentialRepository.findByIdForUpdate(credentialId)
            .orElseThrow(() -> new CredentialNotFoundException(credentialId));

        if (Boolean.TRUE.equals(credential.getIsAvailable())) {
            throw new BadRequestException("VPN " + credentialId + " was not reserved for an instance");
        }
        if (credential.getAssignedToUserId() != null) {
            throw new StillAssignedException(credentialId,
                "VPN " + credentialId + " is assigned to user " + credential.getAssignedToUserId());
        }
        Long current = credential.getAssignedToInstanceId();
        if (current != null && !current.equals(instanceId)) {
            throw new StillAssignedException(credentialId,
                "VPN " + credentialId + " is already linked to instance " + current);
        }
        for (VpnCredential held : credentialRepository.findActiveByInstanceIdForUpdate(instanceId)) {
            if (!held.getId().equals(credentialId)) {
                throw new StillAssignedException(credentialId,
                    "Instance " + instanceId + " already holds VPN " + held.getId());
            }
        }

        credential.setAssignedToInstanceId(instanceId);
        if (credential.getAssignedInstanceAt() == null) {
            credential.setAssignedInstanceAt(LocalDateTime.now(ZoneOffset.UTC));
        }
        log.info("Linked VPN {} to instance {}", credentialId, instanceId);
        eventPublisher.publish(PoolEvent.of(PoolEventType.INSTANCE_LINKED, RequesterKind.INSTANCE, instanceId,
            List.of(credentialId), null, null));
        return credentialRepository.save(credential);
    }

    /**
     * Admin bulk assignment: one credential per user, failures collected per user.
     * All successful assignments commit together.
     */
    @Transactional
    public BulkAssignResult bulkAssign(List<UserAssignment> users, AssignmentType assignmentTypeFilter) {
        int successCount = 0;
        List<Long> failedIds = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (UserAssignment user : users) {
            ClaimResult result = doClaimForUser(user.userId(), user.username(), 1, assignmentTypeFilter);
            if (result.isSuccess()) {
                successCount++;
            } else {
                failedIds.add(user.userId());
                errors.add("User " + user.userId() + ": " + result.message());
            }
        }

        log.info("Bulk assigned {} of {} users from {} pool", successCount, users.size(), assignmentTypeFilter);
        return new BulkAssignResult(successCount, failedIds, limit(errors));
    }

    private ClaimResult doClaimForUser(Long userId, String username, int count, AssignmentType filter) {
        if (userId == null) {
            throw new BadRequestException("User ID is required");
        }
        if (count < 1) {
            return ClaimResult.none("Count must be at least 1");
        }
        int effectiveCount = Math.min(count, poolPolicyProperties.getMaxPerRequest());

        List<VpnCredential> candidates = credentialRepository.lockAvailableForClaim(filter, effectiveCount);
        if (candidates.isEmpty()) {
            log.warn("No available {} credentials for user {} (requested {})", filter, userId, count);
            metricsService.recordClaim(filter, effectiveCount, 0);
            return ClaimResult.none(NO_CAPACITY_MESSAGE);
        }

        String batchId = UUID.randomUUID().toString();
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        for (VpnCredential credential : candidates) {
            credential.setAssignedToUserId(userId);
            credential.setAssignedToUsername(username);
            credential.setAssignedAt(now);
            credential.setRequestBatchId(batchId);
            credential.setIsAvailable(false);
        }
        // Flushed so a later claim in the same transaction (bulk assign) no longer sees these rows as available
        List<VpnCredential> assigned = credentialRepository.saveAllAndFlush(candidates);

        int assignedCount = assigned.size();
        metricsService.recordClaim(filter, effectiveCount, assignedCount);
        eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIALS_ASSIGNED, RequesterKind.USER, userId,
            ids(assigned), batchId, Map.of("requestedCount", count, "assignmentType", filter.name())));

        if (assignedCount < effectiveCount) {
            log.warn("Partial claim for user {}: {} of {} {} credentials (batch {})",
                userId, assignedCount, effectiveCount, filter, batchId);
            return new ClaimResult(assignedCount,
                "Assigned " + assignedCount + " VPNs (only " + assignedCount + " available)", assigned);
        }
        log.info("Assigned {} {} credentials to user {} (batch {})", assignedCount, filter, userId, batchId);
        return new ClaimResult(assignedCount, "Assigned " + assignedCount + " VPN credentials", assigned);
    }

    private ClaimResult doClaimForInstance(Long instanceId, AssignmentType filter) {
        if (instanceId != null) {
            List<VpnCredential> held = credentialRepository.findActiveByInstanceIdForUpdate(instanceId);
            if (!held.isEmpty()) {
                VpnCredential existing = held.get(0);
                log.info("Instance {} already holds VPN {}, returning it", instanceId, existing.getId());
                return new ClaimResult(1, "VPN already assigned to instance", List.of(existing));
            }
        }

        List<VpnCredential> candidates = credentialRepository.lockAvailableForClaim(filter, 1);
        if (candidates.isEmpty()) {
            log.warn("No available {} credentials for instance {}", filter, instanceId);
            metricsService.recordClaim(filter, 1, 0);
            return ClaimResult.none(NO_CAPACITY_MESSAGE);
        }

        VpnCredential credential = candidates.get(0);
        credential.setAssignedToInstanceId(instanceId);
        credential.setAssignedInstanceAt(LocalDateTime.now(ZoneOffset.UTC));
        credential.setIsAvailable(false);
        VpnCredential assigned = credentialRepository.save(credential);

        metricsService.recordClaim(filter, 1, 1);
        eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIALS_ASSIGNED, RequesterKind.INSTANCE, instanceId,
            List.of(assigned.getId()), null, Map.of("assignmentType", filter.name())));

        if (instanceId == null) {
            log.info("Reserved VPN {} for an instance pending creation", assigned.getId());
            return new ClaimResult(1, "VPN reserved for instance", List.of(assigned));
        }
        log.info("Assigned VPN {} to instance {}", assigned.getId(), instanceId);
        return new ClaimResult(1, "VPN assigned to instance", List.of(assigned));
    }

    private List<String> limit(List<String> errors) {
        int max = poolPolicyProperties.getMaxReportedErrors();
        return errors.size() > max ? List.copyOf(errors.subList(0, max)) : errors;
    }

    private static List<Long> ids(List<VpnCredential> credentials) {
        return credentials.stream().map(VpnCredential::getId).toList();
    }
}

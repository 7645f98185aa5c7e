package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.api.exception.CredentialNotFoundException;
import com.cyberx.vpnpool.api.exception.CredentialRevokedException;
import com.cyberx.vpnpool.api.repository.VpnCredentialRepository;
import com.cyberx.vpnpool.common.pool.RequesterKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit state changes after allocation: deletion, permanent revocation and
 * admin release. Nothing expires on its own.
 *
 * Revocation is one-way. A revoked credential keeps its owner reference for
 * traceability and is never returned to the pool, since the downloaded config
 * may still work offline.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialLifecycleService {

    private final VpnCredentialRepository credentialRepository;
    private final PoolPolicyProperties poolPolicyProperties;
    private final PoolEventPublisher eventPublisher;

    @Transactional
    public BulkDeleteResult deleteCredentials(List<Long> credentialIds) {
        if (credentialIds == null || credentialIds.isEmpty()) {
            throw new BadRequestException("No credential IDs provided");
        }

        List<Long> deleted = new ArrayList<>();
        List<Long> failedIds = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(credentialIds)) {
            Optional<VpnCredential> credential = credentialRepository.findById(id);
            if (credential.isEmpty()) {
                failedIds.add(id);
                errors.add("VPN " + id + ": Not found");
                continue;
            }
            credentialRepository.delete(credential.get());
            deleted.add(id);
        }

        if (!deleted.isEmpty()) {
            eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIALS_DELETED, null, null,
                deleted, null, null));
        }
        log.info("Deleted {} VPN credentials, {} not found", deleted.size(), failedIds.size());
        int max = poolPolicyProperties.getMaxReportedErrors();
        return new BulkDeleteResult(deleted.size(), failedIds,
            errors.size() > max ? List.copyOf(errors.subList(0, max)) : errors);
    }

    /**
     * Remove every credential from the pool.
     *
     * @return number of rows deleted
     */
    @Transactional
    public long deleteAllCredentials() {
        long count = credentialRepository.count();
        credentialRepository.deleteAllInBatch();
        eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIALS_DELETED, null, null,
            List.of(), null, Map.of("deletedCount", count, "all", true)));
        log.warn("Deleted all {} VPN credentials", count);
        return count;
    }

    /**
     * The user was removed: permanently deactivate everything assigned to them.
     *
     * @return number of credentials revoked
     */
    @Transactional
    public int revokeUserCredentials(Long userId) {
        List<VpnCredential> credentials = credentialRepository.findByAssignedToUserIdOrderByAssignedAtDesc(userId);
        credentials.forEach(CredentialLifecycleService::deactivate);
        credentialRepository.saveAll(credentials);

        if (!credentials.isEmpty()) {
            eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIALS_REVOKED, RequesterKind.USER, userId,
                credentials.stream().map(VpnCredential::getId).toList(), null, null));
        }
        log.info("Revoked {} VPN credentials of user {}", credentials.size(), userId);
        return credentials.size();
    }

    /**
     * The instance was destroyed: permanently deactivate its credential.
     *
     * @return the revoked credential, empty if the instance had none
     */
    @Transactional
    public Optional<VpnCredential> revokeInstanceCredential(Long instanceId) {
        List<VpnCredential> held = credentialRepository.findActiveByInstanceIdForUpdate(instanceId);
        if (held.isEmpty()) {
            return Optional.empty();
        }
        held.forEach(CredentialLifecycleService::deactivate);
        credentialRepository.saveAll(held);
        List<Long> ids = held.stream().map(VpnCredential::getId).toList();
        eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIALS_REVOKED, RequesterKind.INSTANCE,
            instanceId, ids, null, null));
        log.info("Revoked VPN {} of instance {}", ids, instanceId);
        return Optional.of(held.get(0));
    }

    /**
     * Return an active credential to the pool, clearing its assignment.
     *
     * @throws CredentialRevokedException if the credential was deactivated
     * @throws BadRequestException if the credential is not assigned
     */
    @Transactional
    public VpnCredential releaseCredential(Long credentialId) {
        VpnCredential credential = credentialRepository.findByIdForUpdate(credentialId)
            .orElseThrow(() -> new CredentialNotFoundException(credentialId));

        if (!Boolean.TRUE.equals(credential.getIsActive())) {
            log.warn("Refused release of deactivated VPN {}", credentialId);
            throw new CredentialRevokedException(credentialId);
        }
        if (Boolean.TRUE.equals(credential.getIsAvailable())) {
            throw new BadRequestException("VPN " + credentialId + " is not assigned");
        }

        Long previousUser = credential.getAssignedToUserId();
        Long previousInstance = credential.getAssignedToInstanceId();
        credential.setAssignedToUserId(null);
        credential.setAssignedToUsername(null);
        credential.setAssignedAt(null);
        credential.setAssignedToInstanceId(null);
        credential.setAssignedInstanceAt(null);
        credential.setRequestBatchId(null);
        credential.setIsAvailable(true);
        VpnCredential released = credentialRepository.save(credential);

        eventPublisher.publish(PoolEvent.of(PoolEventType.CREDENTIAL_RELEASED,
            previousUser != null ? RequesterKind.USER : RequesterKind.INSTANCE,
            previousUser != null ? previousUser : previousInstance,
            List.of(credentialId), null, null));
        log.info("Released VPN {} back to the pool (was user={}, instance={})",
            credentialId, previousUser, previousInstance);
        return released;
    }

    private static void deactivate(VpnCredential credential) {
        credential.setIsAvailable(false);
        credential.setIsActive(false);
    }
}

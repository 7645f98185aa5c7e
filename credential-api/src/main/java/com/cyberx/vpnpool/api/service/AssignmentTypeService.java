package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.api.exception.CredentialNotFoundException;
import com.cyberx.vpnpool.api.exception.StillAssignedException;
import com.cyberx.vpnpool.api.repository.VpnCredentialRepository;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Moves unassigned credentials between pool classes.
 *
 * The row is read with a write lock, so a claim in flight on the same row either
 * finishes first (and the change is refused) or sees the new type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentTypeService {

    private final VpnCredentialRepository credentialRepository;
    private final PoolPolicyProperties poolPolicyProperties;

    /**
     * @return true if the type changed, false if the credential already had it
     * @throws BadRequestException if {@code newType} is not a known assignment type
     * @throws CredentialNotFoundException if the credential does not exist
     * @throws StillAssignedException if the credential is not available
     */
    @Transactional
    public boolean setAssignmentType(Long credentialId, String newType) {
        return apply(credentialId, parse(newType));
    }

    /**
     * Apply the single-credential rule to each id independently. An unknown type
     * rejects the whole call before anything changes.
     */
    @Transactional
    public BulkUpdateResult bulkSetAssignmentType(List<Long> credentialIds, String newType) {
        AssignmentType type = parse(newType);
        if (credentialIds == null || credentialIds.isEmpty()) {
            throw new BadRequestException("No credential IDs provided");
        }

        int changed = 0;
        int unchanged = 0;
        List<String> errors = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(credentialIds)) {
            try {
                if (apply(id, type)) {
                    changed++;
                } else {
                    unchanged++;
                }
            } catch (CredentialNotFoundException e) {
                errors.add("VPN " + id + ": Not found");
            } catch (StillAssignedException e) {
                errors.add("VPN " + id + ": " + e.getMessage());
            }
        }

        log.info("Bulk assignment type change to {}: {} changed, {} unchanged, {} failed",
            type, changed, unchanged, errors.size());
        int max = poolPolicyProperties.getMaxReportedErrors();
        return new BulkUpdateResult(changed, unchanged,
            errors.size() > max ? List.copyOf(errors.subList(0, max)) : errors);
    }

    private boolean apply(Long credentialId, AssignmentType type) {
        VpnCredential credential = credentialRepository.findByIdForUpdate(credentialId)
            .orElseThrow(() -> new CredentialNotFoundException(credentialId));

        if (!Boolean.TRUE.equals(credential.getIsAvailable())) {
            log.warn("Refused assignment type change on VPN {}: currently assigned", credentialId);
            throw new StillAssignedException(credentialId,
                "Cannot change assignment type of VPN " + credentialId + " while it is assigned");
        }
        if (credential.getAssignmentType() == type) {
            return false;
        }

        AssignmentType previous = credential.getAssignmentType();
        credential.setAssignmentType(type);
        credentialRepository.save(credential);
        log.info("VPN {} assignment type {} -> {}", credentialId, previous, type);
        return true;
    }

    private static AssignmentType parse(String value) {
        return AssignmentType.fromValue(value)
            .orElseThrow(() -> new BadRequestException(
                "Invalid assignment type: " + value + ". Must be one of: " + AssignmentType.allowedValues()));
    }
}

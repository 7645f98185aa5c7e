package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.api.exception.CredentialNotFoundException;
import com.cyberx.vpnpool.api.repository.RequestBatchSummary;
import com.cyberx.vpnpool.api.repository.VpnCredentialRepository;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CredentialQueryService {

    private static final int MAX_PAGE_SIZE = 100;

    private final VpnCredentialRepository credentialRepository;

    public VpnCredential getCredential(Long id) {
        return credentialRepository.findById(id)
            .orElseThrow(() -> new CredentialNotFoundException(id));
    }

    /**
     * Admin listing ordered by id. Every filter is optional; {@code search} matches
     * the IPv4 address or the assigned username, ignoring case.
     */
    public Page<VpnCredential> listCredentials(int page, int size, Boolean isAvailable, Long assignedToUserId,
                                               String assignmentType, String search) {
        if (page < 0) {
            throw new BadRequestException("Page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new BadRequestException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }

        AssignmentType type = null;
        if (StringUtils.hasText(assignmentType)) {
            type = AssignmentType.fromValue(assignmentType)
                .orElseThrow(() -> new BadRequestException("Invalid assignment type: " + assignmentType
                    + ". Must be one of: " + AssignmentType.allowedValues()));
        }
        String pattern = StringUtils.hasText(search)
            ? "%" + search.strip().toLowerCase(Locale.ROOT) + "%"
            : null;

        Pageable pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.ASC, "id"));
        return credentialRepository.search(isAvailable, assignedToUserId, type, pattern, pageable);
    }

    public List<VpnCredential> getUserCredentials(Long userId) {
        return credentialRepository.findByAssignedToUserIdOrderByAssignedAtDesc(userId);
    }

    public long getUserCredentialCount(Long userId) {
        return credentialRepository.countByAssignedToUserId(userId);
    }

    public List<RequestBatchSummary> getUserRequestBatches(Long userId) {
        return credentialRepository.findRequestBatchesByUserId(userId);
    }

    public List<VpnCredential> getCredentialsByBatch(Long userId, String batchId) {
        return credentialRepository.findByAssignedToUserIdAndRequestBatchIdOrderByAssignedAtAsc(userId, batchId);
    }

    /**
     * A credential owned by the user, for downloads.
     *
     * @throws CredentialNotFoundException if it does not exist or belongs to someone else
     */
    public VpnCredential getUserCredential(Long userId, Long credentialId) {
        VpnCredential credential = getCredential(credentialId);
        if (!userId.equals(credential.getAssignedToUserId())) {
            throw new CredentialNotFoundException(credentialId);
        }
        return credential;
    }

    public VpnCredential getInstanceCredential(Long instanceId) {
        return credentialRepository.findFirstByAssignedToInstanceIdAndIsActiveTrueOrderByIdAsc(instanceId)
            .orElseThrow(() -> new CredentialNotFoundException("No VPN credential assigned to instance " + instanceId));
    }

    public long getAvailableCount(AssignmentType assignmentType) {
        return credentialRepository.countByAssignmentTypeAndIsAvailableTrueAndIsActiveTrue(assignmentType);
    }

    public PoolStatistics getStatistics() {
        return PoolStatistics.of(
            credentialRepository.count(),
            credentialRepository.countByIsAvailableTrue(),
            credentialRepository.countByIsActiveFalse());
    }

    public PoolStatistics getInstancePoolStats() {
        AssignmentType type = AssignmentType.INSTANCE_AUTO_ASSIGN;
        return PoolStatistics.of(
            credentialRepository.countByAssignmentType(type),
            credentialRepository.countByAssignmentTypeAndIsAvailableTrueAndIsActiveTrue(type),
            credentialRepository.countByAssignmentTypeAndIsActiveFalse(type));
    }
}

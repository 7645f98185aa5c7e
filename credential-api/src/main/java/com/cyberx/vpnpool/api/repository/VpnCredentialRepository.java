package com.cyberx.vpnpool.api.repository;

import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VpnCredentialRepository extends JpaRepository<VpnCredential, Long> {

    /**
     * Claim candidates for the pool allocator.
     *
     * Picks up to {@code limit} available, active rows of one assignment type in random order
     * and locks them until the surrounding transaction ends. Rows already locked by a concurrent
     * claim are skipped instead of waited on, so two claims never see the same row and never
     * block each other.
     *
     * Must run inside a transaction. Use {@link #lockAvailableForClaim(AssignmentType, int)}.
     *
     * @param assignmentType assignment type name (native query compatibility)
     * @param limit maximum number of rows
     * @return locked rows, possibly fewer than {@code limit}, possibly empty
     */
    @Query(value = "SELECT * FROM vpn_credentials c " +
                   "WHERE c.assignment_type = :assignmentType " +
                   "AND c.is_available = true " +
                   "AND c.is_active = true " +
                   "ORDER BY random() " +
                   "LIMIT :limit " +
                   "FOR UPDATE SKIP LOCKED", nativeQuery = true)
    List<VpnCredential> lockAvailableForClaimInternal(
        @Param("assignmentType") String assignmentType,
        @Param("limit") int limit
    );

    default List<VpnCredential> lockAvailableForClaim(AssignmentType assignmentType, int limit) {
        return lockAvailableForClaimInternal(assignmentType.name(), limit);
    }

    /**
     * Load one row with an exclusive lock, waiting for a concurrent claim on it to finish.
     * Used by single-row admin mutations that must see the committed availability state.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM VpnCredential c WHERE c.id = :id")
    Optional<VpnCredential> findByIdForUpdate(@Param("id") Long id);

    /**
     * Active credentials already held by an instance, locked. Normally zero or one row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM VpnCredential c " +
           "WHERE c.assignedToInstanceId = :instanceId AND c.isActive = true " +
           "ORDER BY c.id")
    List<VpnCredential> findActiveByInstanceIdForUpdate(@Param("instanceId") Long instanceId);

    boolean existsByFileHash(String fileHash);

    List<VpnCredential> findByAssignedToUserIdOrderByAssignedAtDesc(Long userId);

    List<VpnCredential> findByAssignedToUserIdAndRequestBatchIdOrderByAssignedAtAsc(Long userId, String requestBatchId);

    Optional<VpnCredential> findFirstByAssignedToInstanceIdAndIsActiveTrueOrderByIdAsc(Long instanceId);

    long countByAssignedToUserId(Long userId);

    long countByIsAvailableTrue();

    long countByAssignmentType(AssignmentType assignmentType);

    long countByAssignmentTypeAndIsAvailableTrueAndIsActiveTrue(AssignmentType assignmentType);

    long countByIsActiveFalse();

    long countByAssignmentTypeAndIsActiveFalse(AssignmentType assignmentType);

    /**
     * Request batches handed to a user, newest first.
     */
    @Query("SELECT c.requestBatchId AS batchId, MIN(c.assignedAt) AS requestedAt, COUNT(c) AS credentialCount " +
           "FROM VpnCredential c " +
           "WHERE c.assignedToUserId = :userId AND c.requestBatchId IS NOT NULL " +
           "GROUP BY c.requestBatchId " +
           "ORDER BY MIN(c.assignedAt) DESC")
    List<RequestBatchSummary> findRequestBatchesByUserId(@Param("userId") Long userId);

    /**
     * Admin listing with optional filters. {@code search} must already be a lowercase
     * LIKE pattern (e.g. {@code %10.20%}) or null.
     */
    @Query("SELECT c FROM VpnCredential c " +
           "WHERE (:isAvailable IS NULL OR c.isAvailable = :isAvailable) " +
           "AND (:userId IS NULL OR c.assignedToUserId = :userId) " +
           "AND (:assignmentType IS NULL OR c.assignmentType = :assignmentType) " +
           "AND (:search IS NULL " +
           "     OR LOWER(c.ipv4Address) LIKE :search " +
           "     OR LOWER(c.assignedToUsername) LIKE :search)")
    Page<VpnCredential> search(
        @Param("isAvailable") Boolean isAvailable,
        @Param("userId") Long userId,
        @Param("assignmentType") AssignmentType assignmentType,
        @Param("search") String search,
        Pageable pageable
    );
}

package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.config.PoolPolicyProperties;
import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.api.exception.BadRequestException;
import com.cyberx.vpnpool.api.exception.StillAssignedException;
import com.cyberx.vpnpool.api.repository.VpnCredentialRepository;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import com.cyberx.vpnpool.common.pool.RequesterKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.cyberx.vpnpool.api.TestCredentials.credential;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialPoolAllocatorTest {

    @Mock
    private VpnCredentialRepository credentialRepository;

    @Mock
    private PoolEventPublisher eventPublisher;

    @Mock
    private PoolMetricsService metricsService;

    private CredentialPoolAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new CredentialPoolAllocator(credentialRepository, new PoolPolicyProperties(),
            eventPublisher, metricsService);
    }

    private static List<VpnCredential> available(int count) {
        List<VpnCredential> credentials = new ArrayList<>();
        for (long id = 1; id <= count; id++) {
            credentials.add(credential(id, AssignmentType.USER_REQUESTABLE));
        }
        return credentials;
    }

    private void saveAllAndFlushReturnsArgument() {
        when(credentialRepository.saveAllAndFlush(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void testClaimForUser_EnoughAvailable_AssignsAllWithOneBatchId() {
        when(credentialRepository.lockAvailableForClaim(AssignmentType.USER_REQUESTABLE, 3)).thenReturn(available(3));
        saveAllAndFlushReturnsArgument();

        ClaimResult result = allocator.claimForUser(7L, "alice", 3, AssignmentType.USER_REQUESTABLE);

        assertEquals(3, result.assignedCount());
        assertEquals("Assigned 3 VPN credentials", result.message());
        assertNotNull(result.requestBatchId());
        for (VpnCredential credential : result.credentials()) {
            assertEquals(7L, credential.getAssignedToUserId());
            assertEquals("alice", credential.getAssignedToUsername());
            assertFalse(credential.getIsAvailable());
            assertNotNull(credential.getAssignedAt());
            assertEquals(result.requestBatchId(), credential.getRequestBatchId());
            assertNull(credential.getAssignedToInstanceId());
        }
        verify(metricsService).recordClaim(AssignmentType.USER_REQUESTABLE, 3, 3);
    }

    @Test
    void testClaimForUser_FewerAvailable_ReturnsPartialResult() {
        when(credentialRepository.lockAvailableForClaim(AssignmentType.USER_REQUESTABLE, 5)).thenReturn(available(3));
        saveAllAndFlushReturnsArgument();

        ClaimResult result = allocator.claimForUser(7L, "alice", 5, AssignmentType.USER_REQUESTABLE);

        assertTrue(result.isSuccess());
        assertEquals(3, result.assignedCount());
        assertEquals("Assigned 3 VPNs (only 3 available)", result.message());
        verify(metricsService).recordClaim(AssignmentType.USER_REQUESTABLE, 5, 3);
    }

    @Test
    void testClaimForUser_NoneAvailable_ReturnsZeroWithoutWriting() {
        when(credentialRepository.lockAvailableForClaim(AssignmentType.USER_REQUESTABLE, 1)).thenReturn(List.of());

        ClaimResult result = allocator.claimForUser(8L, "bob", 1, AssignmentType.USER_REQUESTABLE);

        assertFalse(result.isSuccess());
        assertEquals(0, result.assignedCount());
        assertEquals("No available VPN credentials", result.message());
        assertTrue(result.credentials().isEmpty());
        verify(credentialRepository, never()).saveAllAndFlush(anyList());
        verify(eventPublisher, never()).publish(any());
    }

    @Test
    void testClaimForUser_CountAboveCap_IsTruncatedTo25() {
        when(credentialRepository.lockAvailableForClaim(AssignmentType.USER_REQUESTABLE, 25)).thenReturn(available(25));
        saveAllAndFlushReturnsArgument();

        ClaimResult result = allocator.claimForUser(7L, "alice", 100, AssignmentType.USER_REQUESTABLE);

        assertEquals(25, result.assignedCount());
        assertEquals("Assigned 25 VPN credentials", result.message());
        verify(credentialRepository).lockAvailableForClaim(AssignmentType.USER_REQUESTABLE, 25);
    }

    @Test
    void testClaimForUser_CountBelowOne_ReturnsZeroWithoutQuerying() {
        ClaimResult result = allocator.claimForUser(7L, "alice", 0, AssignmentType.USER_REQUESTABLE);

        assertEquals(0, result.assignedCount());
        assertEquals("Count must be at least 1", result.message());
        verifyNoInteractions(credentialRepository);
    }

    @Test
    void testClaimForUser_MissingUserId_ThrowsBadRequest() {
        assertThrows(BadRequestException.class,
            () -> allocator.claimForUser(null, "alice", 1, AssignmentType.USER_REQUESTABLE));
    }

    @Test
    void testClaimForUser_SeparateCalls_GetDifferentBatchIds() {
        when(credentialRepository.lockAvailableForClaim(AssignmentType.USER_REQUESTABLE, 2))
            .thenReturn(available(2))
            .thenReturn(List.of(credential(10L, AssignmentType.USER_REQUESTABLE),
                credential(11L, AssignmentType.USER_REQUESTABLE)));
        saveAllAndFlushReturnsArgument();

        ClaimResult first = allocator.claimForUser(7L, "alice", 2, AssignmentType.USER_REQUESTABLE);
        ClaimResult second = allocator.claimForUser(7L, "alice", 2, AssignmentType.USER_REQUESTABLE);

        assertNotEquals(first.requestBatchId(), second.requestBatchId());
    }

    @Test
    void testClaimForUser_Success_PublishesAssignedEvent() {
        when(credentialRepository.lockAvailableForClaim(AssignmentType.USER_REQUESTABLE, 2)).thenReturn(available(2));
        saveAllAndFlushReturnsArgument();

        ClaimResult result = allocator.claimForUser(7L, "alice", 2, AssignmentType.USER_REQUESTABLE);

        ArgumentCaptor<PoolEvent> event = ArgumentCaptor.forClass(PoolEvent.class);
        verify(eventPublisher).publish(event.capture());
        assertEquals(PoolEventType.CREDENTIALS_ASSIGNED, event.getValue().eventType());
        assertEquals(RequesterKind.USER, event.getValue().requesterKind());
        assertEquals(7L, event.getValue().requesterId());
        assertEquals(List.of(1L, 2L), event.getValue().credentialIds());
        assertEquals(result.requestBatchId(), event.getValue().requestBatchId());
    }

    @Test
    void testClaim_InstanceRequester_ClaimsExactlyOne() {
        VpnCredential candidate = credential(5L, AssignmentType.INSTANCE_AUTO_ASSIGN);
        when(credentialRepository.lockAvailableForClaim(AssignmentType.INSTANCE_AUTO_ASSIGN, 1))
            .thenReturn(List.of(candidate));
        when(credentialRepository.save(any(VpnCredential.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ClaimResult result = allocator.claim(RequesterKind.INSTANCE, 42L, 3, AssignmentType.INSTANCE_AUTO_ASSIGN);

        assertEquals(1, result.assignedCount());
        assertEquals(42L, candidate.getAssignedToInstanceId());
        assertNull(candidate.getAssignedToUserId());
        assertNull(candidate.getRequestBatchId());
        assertFalse(candidate.getIsAvailable());
        assertNotNull(candidate.getAssignedInstanceAt());
    }

    @Test
    void testClaimForInstance_InstanceNotYetKnown_ReservesWithoutInstanceId() {
        VpnCredential candidate = credential(5L, AssignmentType.INSTANCE_AUTO_ASSIGN);
        when(credentialRepository.lockAvailableForClaim(AssignmentType.INSTANCE_AUTO_ASSIGN, 1))
            .thenReturn(List.of(candidate));
        when(credentialRepository.save(any(VpnCredential.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ClaimResult result = allocator.claimForInstance(null);

        assertEquals(1, result.assignedCount());
        assertEquals("VPN reserved for instance", result.message());
        assertNull(candidate.getAssignedToInstanceId());
        assertFalse(candidate.getIsAvailable());
    }

    @Test
    void testClaimForInstance_InstanceAlreadyHoldsCredential_ReturnsItWithoutClaiming() {
        VpnCredential held = credential(1L, AssignmentType.INSTANCE_AUTO_ASSIGN);
        held.setIsAvailable(false);
        held.setAssignedToInstanceId(42L);
        when(credentialRepository.findActiveByInstanceIdForUpdate(42L)).thenReturn(List.of(held));

        ClaimResult result = allocator.claimForInstance(42L);

        assertEquals(1, result.assignedCount());
        assertEquals(1L, result.credentials().get(0).getId());
        verify(credentialRepository, never()).lockAvailableForClaim(any(), anyInt());
        verify(credentialRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void testClaimForInstance_AssignedAtIsUtc() {
        VpnCredential candidate = credential(5L, AssignmentType.INSTANCE_AUTO_ASSIGN);
        when(credentialRepository.lockAvailableForClaim(AssignmentType.INSTANCE_AUTO_ASSIGN, 1))
            .thenReturn(List.of(candidate));
        when(credentialRepository.save(any(VpnCredential.class))).thenAnswer(invocation -> invocation.getArgument(0));

        allocator.claimForInstance(42L);

        Duration skew = Duration.between(candidate.getAssignedInstanceAt(), LocalDateTime.now(ZoneOffset.UTC)).abs();
        assertTrue(skew.toMinutes() < 1, "assigned_instance_at should be UTC but was off by " + skew);
    }

    @Test
    void testClaimForInstance_PoolEmpty_ReturnsNoCapacity() {
        when(credentialRepository.lockAvailableForClaim(AssignmentType.INSTANCE_AUTO_ASSIGN, 1)).thenReturn(List.of());

        ClaimResult result = allocator.claimForInstance(42L);

        assertEquals(0, result.assignedCount());
        assertEquals("No available VPN credentials", result.message());
        verify(metricsService).recordClaim(AssignmentType.INSTANCE_AUTO_ASSIGN, 1, 0);
    }

    @Test
    void testLinkInstance_ReservedCredential_SetsInstanceId() {
        VpnCredential reserved = credential(5L, AssignmentType.INSTANCE_AUTO_ASSIGN);
        reserved.setIsAvailable(false);
        when(credentialRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(reserved));
        when(credentialRepository.save(reserved)).thenReturn(reserved);

        VpnCredential linked = allocator.linkInstance(5L, 42L);

        assertEquals(42L, linked.getAssignedToInstanceId());
        assertNotNull(linked.getAssignedInstanceAt());
    }

    @Test
    void testLinkInstance_AvailableCredential_ThrowsBadRequest() {
        when(credentialRepository.findByIdForUpdate(5L))
            .thenReturn(Optional.of(credential(5L, AssignmentType.INSTANCE_AUTO_ASSIGN)));

        assertThrows(BadRequestException.class, () -> allocator.linkInstance(5L, 42L));
        verify(credentialRepository, never()).save(any());
    }

    @Test
    void testLinkInstance_LinkedToOtherInstance_ThrowsStillAssigned() {
        VpnCredential linked = credential(5L, AssignmentType.INSTANCE_AUTO_ASSIGN);
        linked.setIsAvailable(false);
        linked.setAssignedToInstanceId(41L);
        when(credentialRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(linked));

        assertThrows(StillAssignedException.class, () -> allocator.linkInstance(5L, 42L));
        assertEquals(41L, linked.getAssignedToInstanceId());
    }

    @Test
    void testLinkInstance_InstanceHoldsAnotherCredential_ThrowsStillAssigned() {
        VpnCredential reserved = credential(5L, AssignmentType.INSTANCE_AUTO_ASSIGN);
        reserved.setIsAvailable(false);
        VpnCredential held = credential(6L, AssignmentType.INSTANCE_AUTO_ASSIGN);
        held.setIsAvailable(false);
        held.setAssignedToInstanceId(42L);
        when(credentialRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(reserved));
        when(credentialRepository.findActiveByInstanceIdForUpdate(42L)).thenReturn(List.of(held));

        assertThrows(StillAssignedException.class, () -> allocator.linkInstance(5L, 42L));
        assertNull(reserved.getAssignedToInstanceId());
        verify(credentialRepository, never()).save(any());
    }

    @Test
    void testBulkAssign_SomeUsersUnserved_AccumulatesErrors() {
        when(credentialRepository.lockAvailableForClaim(eq(AssignmentType.USER_REQUESTABLE), anyInt()))
            .thenReturn(List.of(credential(1L, AssignmentType.USER_REQUESTABLE)))
            .thenReturn(List.of(credential(2L, AssignmentType.USER_REQUESTABLE)))
            .thenReturn(List.of());
        saveAllAndFlushReturnsArgument();

        BulkAssignResult result = allocator.bulkAssign(List.of(
            new UserAssignment(1L, "u1"),
            new UserAssignment(2L, "u2"),
            new UserAssignment(3L, "u3")
        ), AssignmentType.USER_REQUESTABLE);

        assertEquals(2, result.successCount());
        assertEquals(List.of(3L), result.failedUserIds());
        assertEquals(List.of("User 3: No available VPN credentials"), result.errors());
    }
}

package com.cyberx.vpnpool.api.entity;

import com.cyberx.vpnpool.common.naming.NamedCredential;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One pre-provisioned WireGuard credential, the pool's unit of allocation.
 *
 * Availability rules:
 * - isAvailable is true only while neither assignedToUserId nor assignedToInstanceId is set
 *   (an instance reservation made before the instance exists is the one exception: the row is
 *   unavailable with both references still null until linkInstance runs)
 * - at most one of assignedToUserId / assignedToInstanceId is set
 * - assignmentType only changes while isAvailable is true
 * - once isActive is false the row is never claimed again
 *
 * Optional WireGuard fields (dns .. fwMark) are null when the imported file did not have them.
 */
@Entity
@Table(name = "vpn_credentials",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_vpn_file_hash", columnNames = "file_hash")
    },
    indexes = {
        @Index(name = "idx_vpn_assignment_type", columnList = "assignment_type, is_available"),
        @Index(name = "idx_vpn_assigned_to_user_id", columnList = "assigned_to_user_id"),
        @Index(name = "idx_vpn_assigned_to_instance_id", columnList = "assigned_to_instance_id"),
        @Index(name = "idx_vpn_request_batch_id", columnList = "request_batch_id"),
        @Index(name = "idx_vpn_assigned_to_username", columnList = "assigned_to_username")
    })
@Getter
@Setter
@NoArgsConstructor
public class VpnCredential extends BaseAuditableEntity implements NamedCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "file_hash", length = 64)
    private String fileHash;

    // Comma-separated CIDR list, no spaces: "10.20.200.149/32,fd00:a:14:c8:95::95/128"
    @Column(name = "interface_ip", nullable = false, columnDefinition = "TEXT")
    private String interfaceIp;

    @Column(name = "ipv4_address", length = 50)
    private String ipv4Address;

    @Column(name = "ipv6_local", length = 100)
    private String ipv6Local;

    @Column(name = "ipv6_global", length = 100)
    private String ipv6Global;

    @Column(name = "private_key", nullable = false, columnDefinition = "TEXT")
    private String privateKey;

    @Column(name = "preshared_key", columnDefinition = "TEXT")
    private String presharedKey;

    @Column(name = "endpoint", nullable = false, length = 255)
    private String endpoint;

    @Column(name = "public_key", columnDefinition = "TEXT")
    private String publicKey;

    @Column(name = "dns", columnDefinition = "TEXT")
    private String dns;

    @Column(name = "mtu", length = 10)
    private String mtu;

    @Column(name = "allowed_ips", columnDefinition = "TEXT")
    private String allowedIps;

    @Column(name = "persistent_keepalive", length = 10)
    private String persistentKeepalive;

    @Column(name = "route_table", length = 50)
    private String table;

    @Column(name = "save_config", length = 10)
    private String saveConfig;

    @Column(name = "fwmark", length = 50)
    private String fwMark;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_type", nullable = false, length = 30)
    private AssignmentType assignmentType = AssignmentType.USER_REQUESTABLE;

    @Column(name = "is_available", nullable = false)
    private Boolean isAvailable = true;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Column(name = "assigned_to_user_id")
    private Long assignedToUserId;

    @Column(name = "assigned_to_username", length = 255)
    private String assignedToUsername;

    @Column(name = "assigned_at")
    private LocalDateTime assignedAt;

    @Column(name = "assigned_to_instance_id")
    private Long assignedToInstanceId;

    @Column(name = "assigned_instance_at")
    private LocalDateTime assignedInstanceAt;

    @Column(name = "request_batch_id", length = 50)
    private String requestBatchId;

    @Override
    public String toString() {
        return "VpnCredential(id=" + id + ", ip=" + ipv4Address + ", type=" + assignmentType
            + ", available=" + isAvailable + ", active=" + isActive + ")";
    }
}

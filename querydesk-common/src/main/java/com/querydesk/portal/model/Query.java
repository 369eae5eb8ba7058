package com.querydesk.portal.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "queries", indexes = {
        @Index(name = "idx_queries_status", columnList = "status"),
        @Index(name = "idx_queries_category", columnList = "category"),
        @Index(name = "idx_queries_created_at", columnList = "createdAt"),
        @Index(name = "idx_queries_requester_email", columnList = "requesterEmail"),
        @Index(name = "idx_queries_requester_identity", columnList = "requesterIdentity")
})
public class Query {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 200)
    private String requesterName;

    @Column(nullable = false, updatable = false, length = 200)
    private String requesterEmail;

    // Student login name; null for guests
    @Column(updatable = false, length = 100)
    private String requesterIdentity;

    @Column(updatable = false, length = 100)
    private String category;

    @Column(nullable = false, updatable = false, length = 5000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QueryStatus status;

    @Column(columnDefinition = "TEXT")
    private String adminResponse;

    private LocalDateTime respondedAt;

    private boolean responseSeen;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime resolvedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = QueryStatus.PENDING;
        }
    }

    public boolean isGuest() {
        return requesterIdentity == null;
    }
}

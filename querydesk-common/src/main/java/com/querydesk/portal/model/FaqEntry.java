package com.querydesk.portal.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;

@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
// Curation updates must not write back a stale frequency
@DynamicUpdate
@Table(name = "faqs",
        uniqueConstraints = @UniqueConstraint(name = "uk_faqs_question_key", columnNames = "questionKey"),
        indexes = {
                @Index(name = "idx_faqs_frequency", columnList = "frequency"),
                @Index(name = "idx_faqs_category", columnList = "category")
        })
public class FaqEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String question;

    // SHA-256 hex of the normalized question
    @Column(nullable = false, length = 64)
    private String questionKey;

    @Column(columnDefinition = "TEXT")
    private String answer;

    @Column(length = 100)
    private String category;

    @Builder.Default
    @Column(nullable = false)
    private int frequency = 1;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    private Long sourceQueryId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}

package com.querydesk.portal.service;

import com.querydesk.portal.exception.ForbiddenException;
import com.querydesk.portal.exception.NotFoundException;
import com.querydesk.portal.exception.ValidationException;
import com.querydesk.portal.model.BlockedEmail;
import com.querydesk.portal.model.Student;
import com.querydesk.portal.repository.BlockedEmailRepository;
import com.querydesk.portal.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class BlocklistService {

    private final StudentRepository studentRepository;
    private final BlockedEmailRepository blockedEmailRepository;

    /**
     * Rejects submissions from blocked students and, for guests, from actively blocked emails.
     */
    public void ensureMaySubmit(String requesterIdentity, String email) {
        if (requesterIdentity != null) {
            Student student = studentRepository.findByStudentId(requesterIdentity)
                    .orElseThrow(() -> new ForbiddenException("Unknown student account"));
            if (student.isBlocked()) {
                throw new ForbiddenException("Your account has been blocked");
            }
            return;
        }
        if (email != null && blockedEmailRepository.existsByEmailAndActiveTrue(email.trim().toLowerCase(Locale.ROOT))) {
            throw new ForbiddenException("This email is blocked from submitting queries");
        }
    }

    @Transactional
    public BlockedEmail toggleEmailBlock(String email) {
        String normalized = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new ValidationException("Email required");
        }
        BlockedEmail block = blockedEmailRepository.findByEmail(normalized)
                .map(existing -> {
                    existing.setActive(!existing.isActive());
                    return existing;
                })
                .orElseGet(() -> BlockedEmail.builder().email(normalized).active(true).build());
        BlockedEmail saved = blockedEmailRepository.save(block);
        log.info("Guest email {} is now {}", normalized, saved.isActive() ? "blocked" : "unblocked");
        return saved;
    }

    @Transactional
    public Student toggleStudentBlock(Long id) {
        Student student = studentRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Student not found: " + id));
        student.setBlocked(!student.isBlocked());
        log.info("Student {} is now {}", student.getStudentId(), student.isBlocked() ? "blocked" : "unblocked");
        return studentRepository.save(student);
    }
}

package com.querydesk.portal.service;

import com.querydesk.portal.exception.ForbiddenException;
import com.querydesk.portal.exception.NotFoundException;
import com.querydesk.portal.exception.ValidationException;
import com.querydesk.portal.model.BlockedEmail;
import com.querydesk.portal.model.Student;
import com.querydesk.portal.repository.BlockedEmailRepository;
import com.querydesk.portal.repository.StudentRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BlocklistServiceTest {

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private BlockedEmailRepository blockedEmailRepository;

    @InjectMocks
    private BlocklistService blocklistService;

    @Test
    void ensureMaySubmit_blockedStudent_isForbidden() {
        when(studentRepository.findByStudentId("S1"))
                .thenReturn(Optional.of(Student.builder().studentId("S1").blocked(true).build()));

        assertThatThrownBy(() -> blocklistService.ensureMaySubmit("S1", "s1@uni.edu"))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void ensureMaySubmit_activeStudent_ignoresEmailBlocklist() {
        when(studentRepository.findByStudentId("S1"))
                .thenReturn(Optional.of(Student.builder().studentId("S1").blocked(false).build()));

        assertThatCode(() -> blocklistService.ensureMaySubmit("S1", "s1@uni.edu")).doesNotThrowAnyException();
        verifyNoInteractions(blockedEmailRepository);
    }

    @Test
    void ensureMaySubmit_unknownStudent_isForbidden() {
        when(studentRepository.findByStudentId("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> blocklistService.ensureMaySubmit("ghost", "g@x.com"))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void ensureMaySubmit_blockedGuestEmail_matchesCaseInsensitively() {
        when(blockedEmailRepository.existsByEmailAndActiveTrue("spam@x.com")).thenReturn(true);

        assertThatThrownBy(() -> blocklistService.ensureMaySubmit(null, " Spam@X.com "))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void toggleEmailBlock_createsThenFlips() {
        when(blockedEmailRepository.findByEmail("spam@x.com")).thenReturn(Optional.empty());
        when(blockedEmailRepository.save(any(BlockedEmail.class))).thenAnswer(invocation -> invocation.getArgument(0));

        BlockedEmail created = blocklistService.toggleEmailBlock("SPAM@x.com");
        assertThat(created.getEmail()).isEqualTo("spam@x.com");
        assertThat(created.isActive()).isTrue();

        when(blockedEmailRepository.findByEmail("spam@x.com")).thenReturn(Optional.of(created));
        assertThat(blocklistService.toggleEmailBlock("spam@x.com").isActive()).isFalse();
    }

    @Test
    void toggleEmailBlock_requiresEmail() {
        assertThatThrownBy(() -> blocklistService.toggleEmailBlock("  ")).isInstanceOf(ValidationException.class);
    }

    @Test
    void toggleStudentBlock_unknownStudent_throwsNotFound() {
        when(studentRepository.findById(3L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> blocklistService.toggleStudentBlock(3L)).isInstanceOf(NotFoundException.class);
    }
}

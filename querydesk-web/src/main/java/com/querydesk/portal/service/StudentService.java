package com.querydesk.portal.service;

import com.querydesk.portal.dto.RegisterStudentRequest;
import com.querydesk.portal.exception.ValidationException;
import com.querydesk.portal.model.Student;
import com.querydesk.portal.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class StudentService {

    private final StudentRepository studentRepository;
    private final PasswordEncoder passwordEncoder;

    public Student register(RegisterStudentRequest request) {
        String studentId = request.getStudentId() == null ? "" : request.getStudentId().trim();
        String email = request.getEmail() == null ? "" : request.getEmail().trim();
        if (studentId.isEmpty() || email.isEmpty() || request.getPassword() == null || request.getPassword().isBlank()) {
            throw new ValidationException("Student id, email and password are required");
        }
        if (studentRepository.existsByStudentId(studentId)) {
            throw new ValidationException("Student id already registered");
        }
        if (studentRepository.existsByEmailIgnoreCase(email)) {
            throw new ValidationException("Email already registered");
        }

        Student student = Student.builder()
                .studentId(studentId)
                .name(request.getName().trim())
                .email(email)
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .blocked(false)
                .build();
        Student saved = studentRepository.save(student);
        log.info("Registered student {}", studentId);
        return saved;
    }

    public List<Student> listStudents() {
        return studentRepository.findAllByOrderByNameAsc();
    }
}

package com.querydesk.portal.endpoint;

import com.querydesk.portal.dto.ApiResponse;
import com.querydesk.portal.dto.RegisterStudentRequest;
import com.querydesk.portal.dto.StudentView;
import com.querydesk.portal.service.StudentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final StudentService studentService;

    @PostMapping("/register")
    public ResponseEntity<ApiResponse<StudentView>> register(@Valid @RequestBody RegisterStudentRequest request) {
        StudentView student = StudentView.from(studentService.register(request));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Registration successful. Please log in.", student));
    }
}

package com.querydesk.portal.dto;

import com.querydesk.portal.model.Student;

public record StudentView(Long id, String studentId, String name, String email, boolean blocked) {
    public static StudentView from(Student student) {
        return new StudentView(student.getId(), student.getStudentId(), student.getName(),
                student.getEmail(), student.isBlocked());
    }
}

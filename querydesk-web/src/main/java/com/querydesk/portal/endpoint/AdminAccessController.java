package com.querydesk.portal.endpoint;

import com.querydesk.portal.dto.ApiResponse;
import com.querydesk.portal.dto.BlockEmailRequest;
import com.querydesk.portal.dto.StudentView;
import com.querydesk.portal.model.BlockedEmail;
import com.querydesk.portal.service.BlocklistService;
import com.querydesk.portal.service.StudentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminAccessController {

    private final StudentService studentService;
    private final BlocklistService blocklistService;

    @GetMapping("/students")
    public List<StudentView> listStudents() {
        return studentService.listStudents().stream().map(StudentView::from).toList();
    }

    @PostMapping("/students/{id}/toggle-block")
    public ApiResponse<StudentView> toggleStudentBlock(@PathVariable Long id) {
        return ApiResponse.success("Student block status updated",
                StudentView.from(blocklistService.toggleStudentBlock(id)));
    }

    @PostMapping("/blocked-emails/toggle")
    public ApiResponse<BlockedEmail> toggleGuestBlock(@Valid @RequestBody BlockEmailRequest request) {
        return ApiResponse.success("Guest email block status updated",
                blocklistService.toggleEmailBlock(request.getEmail()));
    }
}

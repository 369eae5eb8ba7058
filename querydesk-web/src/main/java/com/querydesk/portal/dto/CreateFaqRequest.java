package com.querydesk.portal.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateFaqRequest {
    @NotBlank(message = "Question is required")
    private String question;

    private String answer;

    @Size(max = 100)
    private String category;
}

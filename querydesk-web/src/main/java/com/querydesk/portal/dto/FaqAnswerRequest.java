package com.querydesk.portal.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FaqAnswerRequest {
    private String answer;

    @Size(max = 100)
    private String category;
}

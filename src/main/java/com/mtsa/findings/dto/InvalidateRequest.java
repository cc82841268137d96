package com.mtsa.findings.dto;

import lombok.Data;

@Data
public class InvalidateRequest {
    private String reason;
}

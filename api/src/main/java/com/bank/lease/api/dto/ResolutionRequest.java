package com.bank.lease.api.dto;

import com.bank.lease.domain.enums.ResolutionDecision;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionRequest {
    private ResolutionDecision decision;
    private String note;
}
